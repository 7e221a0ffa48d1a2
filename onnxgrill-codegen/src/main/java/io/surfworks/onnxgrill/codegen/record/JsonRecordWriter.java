package io.surfworks.onnxgrill.codegen.record;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.surfworks.onnxgrill.graph.ParamData;
import io.surfworks.onnxgrill.graph.PrecisionSettings;
import io.surfworks.onnxgrill.graph.ScalarKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes parameters as pretty-printed JSON, for inspection during development.
 */
public final class JsonRecordWriter implements RecordWriter {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    @Override
    public String extension() {
        return ".json";
    }

    @Override
    public void write(Path path, Map<String, ParamData> parameters, PrecisionSettings precision) throws IOException {
        JsonObject root = new JsonObject();
        JsonObject metadata = new JsonObject();
        metadata.addProperty("format", "onnxgrill");
        metadata.addProperty("precision", precision.name());
        root.add("metadata", metadata);

        JsonObject tensors = new JsonObject();
        parameters.forEach((key, data) -> {
            JsonObject tensor = new JsonObject();
            tensor.addProperty("dtype", RecordWriter.dtype(data));
            JsonArray shape = new JsonArray();
            for (long dim : data.shape()) {
                shape.add(dim);
            }
            tensor.add("shape", shape);
            tensor.add("data", values(data));
            tensors.add(key, tensor);
        });
        root.add("parameters", tensors);

        Files.writeString(path, GSON.toJson(root) + "\n", StandardCharsets.UTF_8);
    }

    private static JsonArray values(ParamData data) {
        JsonArray array = new JsonArray();
        if (data instanceof ParamData.Floats floats) {
            for (double v : floats.values()) {
                if (floats.kind() == ScalarKind.FLOAT32) {
                    array.add((float) v);
                } else {
                    array.add(v);
                }
            }
        } else if (data instanceof ParamData.Ints ints) {
            for (long v : ints.values()) {
                array.add(v);
            }
        }
        return array;
    }
}
