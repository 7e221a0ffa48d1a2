package io.surfworks.onnxgrill.codegen.record;

import io.surfworks.onnxgrill.graph.ParamData;
import io.surfworks.onnxgrill.graph.PrecisionSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Persists a model's learned parameters next to its generated source.
 */
public interface RecordWriter {

    /**
     * File extension including the dot, e.g. {@code .safetensors}.
     */
    String extension();

    /**
     * Writes all parameters, keyed {@code field.parameter}, in map order.
     */
    void write(Path path, Map<String, ParamData> parameters, PrecisionSettings precision) throws IOException;

    /**
     * SafeTensors dtype tag of a payload.
     */
    static String dtype(ParamData data) {
        return switch (data.kind()) {
            case FLOAT32 -> "F32";
            case FLOAT64 -> "F64";
            case INT32 -> "I32";
            case INT64 -> "I64";
            case BOOL -> "BOOL";
        };
    }
}
