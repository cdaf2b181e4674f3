package com.pathtree.demo;

import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied when a request does not say otherwise.
 *
 * @param head row limit for tables, 0 for none
 * @param transpose whether tables are transposed
 * @param pruneIgnore labels whose levels are never collapsed by prune
 */
@ConfigurationProperties(prefix = "pathtree")
public record PathTreeProperties(int head, boolean transpose, Set<String> pruneIgnore) {

    public PathTreeProperties {
        pruneIgnore = pruneIgnore == null ? Set.of() : Set.copyOf(pruneIgnore);
    }
}
