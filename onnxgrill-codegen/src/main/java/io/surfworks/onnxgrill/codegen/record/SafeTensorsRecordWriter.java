package io.surfworks.onnxgrill.codegen.record;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.surfworks.onnxgrill.graph.ParamData;
import io.surfworks.onnxgrill.graph.PrecisionSettings;
import io.surfworks.onnxgrill.graph.ScalarKind;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Writes parameters in SafeTensors format.
 *
 * <p>Format:
 * <pre>
 * [8 bytes: header length N as little-endian u64]
 * [N bytes: JSON header, space padded to a multiple of 8]
 * [tensor data, little-endian, in header order]
 * </pre>
 *
 * <p>The header maps each parameter name to its dtype, shape and
 * {@code data_offsets} relative to the start of the data section, plus a
 * {@code __metadata__} entry recording the format and precision.
 */
public final class SafeTensorsRecordWriter implements RecordWriter {

    private static final Gson GSON = new Gson();

    @Override
    public String extension() {
        return ".safetensors";
    }

    @Override
    public void write(Path path, Map<String, ParamData> parameters, PrecisionSettings precision) throws IOException {
        JsonObject header = new JsonObject();
        JsonObject metadata = new JsonObject();
        metadata.addProperty("format", "onnxgrill");
        metadata.addProperty("precision", precision.name());
        header.add("__metadata__", metadata);

        long offset = 0;
        for (Map.Entry<String, ParamData> entry : parameters.entrySet()) {
            ParamData data = entry.getValue();
            long size = (long) data.size() * elementBytes(data);

            JsonObject info = new JsonObject();
            info.addProperty("dtype", RecordWriter.dtype(data));
            JsonArray shape = new JsonArray();
            for (long dim : data.shape()) {
                shape.add(dim);
            }
            info.add("shape", shape);
            JsonArray offsets = new JsonArray();
            offsets.add(offset);
            offsets.add(offset + size);
            info.add("data_offsets", offsets);
            header.add(entry.getKey(), info);

            offset += size;
        }

        byte[] headerBytes = GSON.toJson(header).getBytes(StandardCharsets.UTF_8);
        int padded = (headerBytes.length + 7) & ~7;

        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer prefix = ByteBuffer.allocate(8 + padded).order(ByteOrder.LITTLE_ENDIAN);
            prefix.putLong(padded);
            prefix.put(headerBytes);
            while (prefix.hasRemaining()) {
                prefix.put((byte) ' ');
            }
            prefix.flip();
            writeFully(channel, prefix);

            for (ParamData data : parameters.values()) {
                writeFully(channel, encode(data));
            }
        }
    }

    private static int elementBytes(ParamData data) {
        return switch (data.kind()) {
            case FLOAT32, INT32 -> 4;
            case FLOAT64, INT64 -> 8;
            case BOOL -> 1;
        };
    }

    private static ByteBuffer encode(ParamData data) {
        ByteBuffer buffer = ByteBuffer.allocate(data.size() * elementBytes(data)).order(ByteOrder.LITTLE_ENDIAN);
        if (data instanceof ParamData.Floats floats) {
            for (double v : floats.values()) {
                if (floats.kind() == ScalarKind.FLOAT32) {
                    buffer.putFloat((float) v);
                } else {
                    buffer.putDouble(v);
                }
            }
        } else if (data instanceof ParamData.Ints ints) {
            for (long v : ints.values()) {
                if (ints.kind() == ScalarKind.INT32) {
                    buffer.putInt((int) v);
                } else {
                    buffer.putLong(v);
                }
            }
        }
        buffer.flip();
        return buffer;
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
