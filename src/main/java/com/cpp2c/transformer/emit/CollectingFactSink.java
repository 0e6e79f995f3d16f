package com.cpp2c.transformer.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class CollectingFactSink implements FactSink {
    private final List<Fact> facts = new ArrayList<>();

    @Override
    public void emit(Fact fact) {
        facts.add(fact);
    }

    public List<Fact> facts() {
        return Collections.unmodifiableList(facts);
    }

    public List<Fact> facts(FactKind kind) {
        return facts.stream().filter(f -> f.kind == kind).collect(Collectors.toList());
    }

    public void clear() {
        facts.clear();
    }
}
