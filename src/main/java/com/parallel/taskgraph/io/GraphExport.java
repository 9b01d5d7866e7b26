package com.parallel.taskgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.engine.ExecutionGraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an {@link ExecutionGraph} as JSON for external renderers.
 *
 * <pre>{@code
 * {"nodes": [{"name": "A", "index": 0, "reads": [], "writes": ["x"]}, ...],
 *  "edges": [{"from": "A", "to": "B", "kind": "INFERRED"}, ...],
 *  "order": ["A", "C", "B", ...]}
 * }</pre>
 */
public final class GraphExport {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private GraphExport() {
        // Utility class
    }

    public static ObjectNode toTree(ExecutionGraph graph) {
        ObjectNode root = MAPPER.createObjectNode();

        ArrayNode nodes = root.putArray("nodes");
        for (int i = 0; i < graph.taskCount(); i++) {
            Task t = graph.task(i);
            ObjectNode n = nodes.addObject();
            n.put("name", t.name());
            n.put("index", i);
            ArrayNode reads = n.putArray("reads");
            t.reads().forEach(reads::add);
            ArrayNode writes = n.putArray("writes");
            t.writes().forEach(writes::add);
        }

        ArrayNode edges = root.putArray("edges");
        for (ExecutionGraph.Edge e : graph.edges()) {
            edges.addObject()
                    .put("from", e.from())
                    .put("to", e.to())
                    .put("kind", e.kind().name());
        }

        ArrayNode order = root.putArray("order");
        for (int ti : graph.stableTopologicalOrder())
            order.add(graph.task(ti).name());
        return root;
    }

    public static String toJson(ExecutionGraph graph) {
        try {
            return MAPPER.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(ExecutionGraph graph, Path path) throws IOException {
        Files.writeString(path, toJson(graph));
    }
}
