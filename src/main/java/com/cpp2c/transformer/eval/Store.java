package com.cpp2c.transformer.eval;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Location to value. Locations are handed out from 1 upwards, so 0 behaves as a
 * null pointer and any location that was never allocated is invalid.
 */
public final class Store {

    private final TreeMap<Long, Long> cells = new TreeMap<>();
    private long next = 1;

    public Store() {}

    private Store(Store other) {
        this.cells.putAll(other.cells);
        this.next = other.next;
    }

    public long allocate(long initial) {
        long loc = next++;
        cells.put(loc, initial);
        return loc;
    }

    public long read(long location) {
        Long v = cells.get(location);
        if (v == null) throw new UndefinedBehaviorException("Invalid read of location " + location);
        return v;
    }

    public void write(long location, long value) {
        if (!cells.containsKey(location)) throw new UndefinedBehaviorException("Invalid write to location " + location);
        cells.put(location, value);
    }

    public Store copy() {
        return new Store(this);
    }

    /** Immutable view ordered by location; two runs can be compared with {@code equals}. */
    public Map<Long, Long> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(cells));
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
