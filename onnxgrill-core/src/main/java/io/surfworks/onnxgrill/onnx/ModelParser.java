package io.surfworks.onnxgrill.onnx;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a model file into a source graph.
 */
@FunctionalInterface
public interface ModelParser {

    OnnxGraph parse(Path path) throws IOException;
}
