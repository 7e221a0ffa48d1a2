package io.surfworks.onnxgrill.onnx;

import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads a source graph from its JSON rendering (see {@link GraphJson}).
 */
public final class JsonGraphParser implements ModelParser {

    private static final Logger LOG = Logger.getLogger(JsonGraphParser.class.getName());

    @Override
    public OnnxGraph parse(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        OnnxGraph graph;
        try {
            graph = GraphJson.read(json);
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Invalid graph file " + path + ": " + e.getMessage(), e);
        }
        LOG.fine("Parsed " + graph.nodes().size() + " nodes from " + path);
        return graph;
    }
}
