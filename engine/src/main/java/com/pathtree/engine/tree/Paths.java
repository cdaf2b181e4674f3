package com.pathtree.engine.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for paths and composite keys.
 */
public final class Paths {

    private Paths() {}

    /**
     * Printable form of a path: keys joined by {@code /}. A {@code null} path prints as the empty
     * string and a string as itself.
     */
    public static String toDisplayString(Object path) {
        if (path == null) {
            return "";
        }
        if (path instanceof List<?> parts) {
            return parts.stream().map(String::valueOf).collect(Collectors.joining("/"));
        }
        return path.toString();
    }

    /** Number of table columns a key occupies: the part count of a composite key, else 1. */
    public static int compositeWidth(Object key) {
        if (key instanceof List<?> parts) {
            return parts.size();
        }
        return 1;
    }

    public static boolean isComposite(Object key) {
        return key instanceof List<?>;
    }
}
