package com.pathtree.demo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathtree.engine.frame.Frame;
import com.pathtree.engine.reshape.StructuralReducer.PrunedLevel;
import com.pathtree.engine.table.Table;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.server.mvc.WebMvcLinkBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/tree")
class TreeController {

    private static final Logger log = LoggerFactory.getLogger(TreeController.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {};
    private static final String EXAMPLE_BODY = "{\"a\":{\"x\":1}}";

    private final TreeTabulationService service;

    TreeController(TreeTabulationService service) {
        this.service = service;
    }

    @PostMapping(value = "/paths", consumes = MediaType.APPLICATION_JSON_VALUE)
    EntityModel<LevelsResponse> paths(@RequestBody(required = false) String body) {
        PathTree tree = parse(body);
        List<List<Object>> levels = service.levels(tree);
        return EntityModel.of(
                new LevelsResponse(levels, levels.size()),
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(TreeController.class).paths(EXAMPLE_BODY))
                        .withSelfRel());
    }

    @PostMapping(value = "/swop", consumes = MediaType.APPLICATION_JSON_VALUE)
    EntityModel<TreeResponse> swop(
            @RequestBody(required = false) String body,
            @RequestParam int level1,
            @RequestParam int level2) {
        PathTree tree = parse(body);
        PathTree swopped = shaped(() -> service.swop(tree, level1, level2));
        return EntityModel.of(
                new TreeResponse(swopped.toPlainMap()),
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(TreeController.class)
                                        .swop(EXAMPLE_BODY, level1, level2))
                        .withSelfRel());
    }

    @PostMapping(value = "/prune", consumes = MediaType.APPLICATION_JSON_VALUE)
    EntityModel<PruneResponse> prune(@RequestBody(required = false) String body) {
        PathTree tree = parse(body);
        List<PrunedLevel> pruned = service.prune(tree);
        log.info("Pruned {} level(s)", pruned.size());
        return EntityModel.of(
                new PruneResponse(tree.toPlainMap(), pruned),
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(TreeController.class).prune(EXAMPLE_BODY))
                        .withSelfRel());
    }

    @PostMapping(value = "/table", consumes = MediaType.APPLICATION_JSON_VALUE)
    EntityModel<Table> table(
            @RequestBody(required = false) String body,
            @RequestParam(required = false) Boolean transpose,
            @RequestParam(required = false) Integer head) {
        PathTree tree = parse(body);
        Table table = shaped(() -> service.table(tree, transpose, head));
        log.info("Built table with {} row(s)", table.rowCount());
        return EntityModel.of(
                table,
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(TreeController.class)
                                        .table(EXAMPLE_BODY, transpose, head))
                        .withSelfRel());
    }

    @PostMapping(value = "/frame", consumes = MediaType.APPLICATION_JSON_VALUE)
    EntityModel<FrameResponse> frame(@RequestBody(required = false) String body) {
        PathTree tree = parse(body);
        Frame frame = shaped(() -> service.frame(tree));
        FrameResponse response = frame == null ? FrameResponse.noData() : FrameResponse.of(frame);
        return EntityModel.of(
                response,
                WebMvcLinkBuilder.linkTo(
                                WebMvcLinkBuilder.methodOn(TreeController.class).frame(EXAMPLE_BODY))
                        .withSelfRel());
    }

    private static PathTree parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body");
        }
        try {
            return PathTree.fromMap(OBJECT_MAPPER.readValue(body, TREE_TYPE));
        } catch (JsonProcessingException e) {
            log.info("Failed to parse body: {}", e.getOriginalMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid request body", e);
        }
    }

    private static <T> T shaped(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TreeShapeException e) {
            log.info("Rejected tree: {}", e.getMessage());
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST, e.reason() + ": " + e.getMessage(), e);
        }
    }

    record LevelsResponse(List<List<Object>> levels, int depth) {}

    record TreeResponse(Map<Object, Object> tree) {}

    record PruneResponse(Map<Object, Object> tree, List<PrunedLevel> pruned) {}

    record FrameResponse(
            boolean empty, List<List<Object>> index, List<Object> columns, List<List<Object>> rows) {

        static FrameResponse of(Frame frame) {
            return new FrameResponse(frame.isEmpty(), frame.index(), frame.columns(), frame.rows());
        }

        static FrameResponse noData() {
            return new FrameResponse(true, List.of(), List.of(), List.of());
        }
    }
}
