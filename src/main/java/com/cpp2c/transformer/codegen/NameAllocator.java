package com.cpp2c.transformer.codegen;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hands out function names that collide with nothing visible at emission time:
 * {@code <prefix><macro name in lower case>}, then {@code _2}, {@code _3}, ... on
 * collision. Every name handed out is reserved from then on.
 */
public final class NameAllocator {

    private final String prefix;
    private final Set<String> taken = new HashSet<>();

    public NameAllocator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public void reserveAll(Collection<String> names) {
        taken.addAll(names);
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    public String allocate(String macroName) {
        String base = prefix + sanitize(macroName);
        String candidate = base;
        int n = 2;
        while (taken.contains(candidate)) {
            candidate = base + "_" + n++;
        }
        taken.add(candidate);
        return candidate;
    }

    private static String sanitize(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
