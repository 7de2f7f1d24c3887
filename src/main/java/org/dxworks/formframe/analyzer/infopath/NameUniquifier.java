package org.dxworks.formframe.analyzer.infopath;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out names that are unique within one view by appending {@code _2}, {@code _3}, ...
 */
final class NameUniquifier {
    private final Set<String> used = new HashSet<>();

    String claim(String base) {
        String candidate = base;
        int suffix = 2;
        while (used.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        used.add(candidate);
        return candidate;
    }

    boolean isUsed(String name) {
        return used.contains(name);
    }

    void reserve(String name) {
        used.add(name);
    }

    void release(String name) {
        used.remove(name);
    }
}
