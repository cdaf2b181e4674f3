package com.pathtree.engine.source;

import com.pathtree.engine.tree.PathTree;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arranges results stored under flat {@code track/slice} keys into a two-level tree.
 */
public final class TrackSliceArrangement {

    private static final Logger log = LoggerFactory.getLogger(TrackSliceArrangement.class);

    private static final String SEPARATOR = "/";

    public enum GroupBy {
        /** slices on the first level, tracks below them */
        SLICE,
        /** tracks on the first level, slices below them */
        TRACK,
        /** same layout as {@link #SLICE} */
        ALL
    }

    private TrackSliceArrangement() {}

    /**
     * Builds the tree. {@code tracks} and {@code slices} select and order the keys to use; when
     * {@code null} they default to all tracks and slices found in the cache, in first-seen order.
     * Combinations missing from the cache are skipped. Without any slices the tree has a single
     * level keyed by track.
     */
    public static PathTree arrange(
            Map<String, ?> cache, List<String> tracks, List<String> slices, GroupBy groupBy) {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(groupBy, "groupBy");
        LinkedHashSet<String> seenTracks = new LinkedHashSet<>();
        LinkedHashSet<String> seenSlices = new LinkedHashSet<>();
        for (String key : cache.keySet()) {
            String[] parts = key.split(SEPARATOR);
            seenTracks.add(parts[0]);
            if (parts.length > 1) {
                seenSlices.add(parts[1]);
            }
        }
        List<String> useTracks = tracks != null ? tracks : new ArrayList<>(seenTracks);
        List<String> useSlices = slices != null ? slices : new ArrayList<>(seenSlices);

        PathTree tree = new PathTree();
        if (useSlices.isEmpty()) {
            for (String track : useTracks) {
                put(tree, cache, track, List.of(track));
            }
            return tree;
        }
        for (String outer : groupBy == GroupBy.TRACK ? useTracks : useSlices) {
            for (String inner : groupBy == GroupBy.TRACK ? useSlices : useTracks) {
                String track = groupBy == GroupBy.TRACK ? outer : inner;
                String slice = groupBy == GroupBy.TRACK ? inner : outer;
                put(tree, cache, track + SEPARATOR + slice, List.of(outer, inner));
            }
        }
        return tree;
    }

    public static PathTree arrange(Map<String, ?> cache, GroupBy groupBy) {
        return arrange(cache, null, null, groupBy);
    }

    private static void put(PathTree tree, Map<String, ?> cache, String key, List<String> path) {
        if (!cache.containsKey(key)) {
            log.debug("no data for {}", key);
            return;
        }
        tree.set(path, cache.get(key));
    }
}
