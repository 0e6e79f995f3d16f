package com.cpp2c.transformer.codegen;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural key to generated definition. Entries are never replaced or removed, so
 * every site with the same key is pointed at the same function.
 */
public final class InternTable {

    private final Map<String, TransformedDefinition> byKey = new LinkedHashMap<>();

    public TransformedDefinition lookup(String key) {
        return byKey.get(key);
    }

    public boolean contains(String key) {
        return byKey.containsKey(key);
    }

    void insert(TransformedDefinition definition) {
        TransformedDefinition previous = byKey.putIfAbsent(definition.key, definition);
        if (previous != null) {
            throw new IllegalStateException("Key " + definition.key + " already interned as " + previous.emittedName());
        }
    }

    /** In insertion order. */
    public Collection<TransformedDefinition> definitions() {
        return Collections.unmodifiableCollection(byKey.values());
    }

    public int size() {
        return byKey.size();
    }
}
