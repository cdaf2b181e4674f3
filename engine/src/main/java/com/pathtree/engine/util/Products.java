package com.pathtree.engine.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Cartesian products over per-level key lists.
 */
public final class Products {

    private Products() {}

    /**
     * Returns every combination picking one element from each list, in lexicographic order of the
     * input. No lists yield a single empty combination; any empty list yields none.
     */
    public static List<List<Object>> cartesian(List<? extends List<?>> levels) {
        List<List<Object>> result = new ArrayList<>();
        result.add(List.of());
        for (List<?> level : levels) {
            List<List<Object>> next = new ArrayList<>(result.size() * Math.max(1, level.size()));
            for (List<Object> combination : result) {
                for (Object key : level) {
                    List<Object> extended = new ArrayList<>(combination.size() + 1);
                    extended.addAll(combination);
                    extended.add(key);
                    next.add(extended);
                }
            }
            result = next;
        }
        return result;
    }

    /** Concatenates the given path fragments into one new list. */
    @SafeVarargs
    public static List<Object> join(List<?>... parts) {
        List<Object> joined = new ArrayList<>();
        for (List<?> part : parts) {
            joined.addAll(part);
        }
        return joined;
    }
}
