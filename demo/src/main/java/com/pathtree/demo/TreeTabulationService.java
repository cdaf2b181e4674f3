package com.pathtree.demo;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.frame.Frame;
import com.pathtree.engine.pivot.TabularPivot;
import com.pathtree.engine.reshape.LevelTransposer;
import com.pathtree.engine.reshape.StructuralReducer;
import com.pathtree.engine.reshape.StructuralReducer.PrunedLevel;
import com.pathtree.engine.table.Table;
import com.pathtree.engine.table.TableAssembler;
import com.pathtree.engine.tree.PathTree;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Applies the engine operations with the configured defaults.
 */
@Service
class TreeTabulationService {

    private final PathTreeProperties properties;

    TreeTabulationService(PathTreeProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    List<List<Object>> levels(PathTree tree) {
        return PathAnalyzer.getPaths(tree);
    }

    PathTree swop(PathTree tree, int level1, int level2) {
        return LevelTransposer.swop(tree, level1, level2);
    }

    List<PrunedLevel> prune(PathTree tree) {
        return StructuralReducer.prune(tree, properties.pruneIgnore());
    }

    Table table(PathTree tree, Boolean transpose, Integer head) {
        return TableAssembler.tree2table(
                tree,
                transpose != null ? transpose : properties.transpose(),
                head != null ? head : properties.head());
    }

    /** Returns the frame, or {@code null} if the tree holds no data. */
    Frame frame(PathTree tree) {
        return TabularPivot.asFrame(tree);
    }
}
