package com.cpp2c.transformer.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names-only view of the environment at an expansion site. Values do not matter to
 * the static checks; only which names are local (shadowing) and which are global.
 */
public final class CallerScope {

    private static final CallerScope EMPTY = new CallerScope(Set.of(), Set.of());

    public final Set<String> localNames;
    public final Set<String> globalNames;

    public CallerScope(Collection<String> localNames, Collection<String> globalNames) {
        this.localNames = Collections.unmodifiableSet(new LinkedHashSet<>(localNames == null ? Set.of() : localNames));
        this.globalNames = Collections.unmodifiableSet(new LinkedHashSet<>(globalNames == null ? Set.of() : globalNames));
    }

    public static CallerScope empty() {
        return EMPTY;
    }

    public static CallerScope of(Collection<String> localNames, Collection<String> globalNames) {
        return new CallerScope(localNames, globalNames);
    }

    public boolean isLocal(String name) {
        return localNames.contains(name);
    }

    @Override
    public String toString() {
        return "locals=" + localNames + ", globals=" + globalNames;
    }
}
