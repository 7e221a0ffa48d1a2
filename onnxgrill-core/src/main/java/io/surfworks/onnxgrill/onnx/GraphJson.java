package io.surfworks.onnxgrill.onnx;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON rendering of the source IR.
 *
 * <p>The same format is written as the development-mode graph dump and read
 * back by {@link JsonGraphParser}:
 * <pre>
 * {
 *   "inputs":  [{"name": "x", "type": {"kind": "tensor", "rank": 2, "elem": "float32"}}],
 *   "outputs": [...],
 *   "nodes": [{
 *     "name": "fc1", "type": "Linear",
 *     "inputs": [...], "outputs": [...],
 *     "attributes": {"alpha": {"kind": "float32", "value": 0.5}},
 *     "states": [{"name": "fc1.weight", "tensor": {"rank": 2, "elem": "float32", "shape": [4, 2], "data": [...]}}]
 *   }]
 * }
 * </pre>
 */
public final class GraphJson {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    private GraphJson() {}

    /**
     * Renders the graph as pretty-printed JSON. Output depends only on the graph.
     */
    public static String write(OnnxGraph graph) {
        return GSON.toJson(toJson(graph)) + "\n";
    }

    /**
     * Parses a graph previously rendered by {@link #write}.
     *
     * @throws JsonParseException  if the text is not JSON
     * @throws OnnxImportException if the JSON does not describe a graph
     */
    public static OnnxGraph read(String json) {
        JsonObject root = GSON.fromJson(json, JsonObject.class);
        if (root == null) {
            throw new OnnxImportException("Empty graph document");
        }
        return fromJson(root);
    }

    // ==================== Writing ====================

    public static JsonObject toJson(OnnxGraph graph) {
        JsonObject root = new JsonObject();
        root.add("inputs", arguments(graph.inputs()));
        root.add("outputs", arguments(graph.outputs()));
        JsonArray nodes = new JsonArray();
        for (Node node : graph.nodes()) {
            nodes.add(node(node));
        }
        root.add("nodes", nodes);
        return root;
    }

    private static JsonObject node(Node node) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", node.name());
        obj.addProperty("type", node.nodeType().onnxName());
        obj.add("inputs", arguments(node.inputs()));
        obj.add("outputs", arguments(node.outputs()));
        JsonObject attributes = new JsonObject();
        node.attributes().forEach((key, value) -> attributes.add(key, attribute(value)));
        obj.add("attributes", attributes);
        JsonArray states = new JsonArray();
        for (State state : node.states()) {
            JsonObject s = new JsonObject();
            s.addProperty("name", state.name());
            s.add("tensor", tensor(state.tensor()));
            states.add(s);
        }
        obj.add("states", states);
        return obj;
    }

    private static JsonArray arguments(List<Argument> arguments) {
        JsonArray array = new JsonArray();
        for (Argument argument : arguments) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", argument.name());
            JsonObject type = new JsonObject();
            ArgType argType = argument.type();
            if (argType instanceof ArgType.TensorArg t) {
                type.addProperty("kind", "tensor");
                type.addProperty("rank", t.rank());
                type.addProperty("elem", elemName(t.elementType()));
            } else if (argType instanceof ArgType.ScalarArg s) {
                type.addProperty("kind", "scalar");
                type.addProperty("elem", elemName(s.elementType()));
            } else if (argType instanceof ArgType.ShapeArg s) {
                type.addProperty("kind", "shape");
                type.addProperty("dims", s.dims());
            }
            obj.add("type", type);
            array.add(obj);
        }
        return array;
    }

    private static JsonObject attribute(AttributeValue value) {
        JsonObject obj = new JsonObject();
        if (value instanceof AttributeValue.Float32 f) {
            obj.addProperty("kind", "float32");
            obj.addProperty("value", f.value());
        } else if (value instanceof AttributeValue.Int64 i) {
            obj.addProperty("kind", "int64");
            obj.addProperty("value", i.value());
        } else if (value instanceof AttributeValue.TensorValue t) {
            obj.addProperty("kind", "tensor");
            obj.add("value", tensor(t.tensor()));
        } else if (value instanceof AttributeValue.Float32s fs) {
            obj.addProperty("kind", "float32s");
            JsonArray array = new JsonArray();
            for (float f : fs.values()) {
                array.add(f);
            }
            obj.add("value", array);
        } else if (value instanceof AttributeValue.Int64s is) {
            obj.addProperty("kind", "int64s");
            JsonArray array = new JsonArray();
            for (long l : is.values()) {
                array.add(l);
            }
            obj.add("value", array);
        } else if (value instanceof AttributeValue.Str s) {
            obj.addProperty("kind", "string");
            obj.addProperty("value", s.value());
        }
        return obj;
    }

    private static JsonObject tensor(Tensor tensor) {
        JsonObject obj = new JsonObject();
        obj.addProperty("rank", tensor.rank());
        obj.addProperty("elem", elemName(tensor.elementType()));
        if (tensor.shape() != null) {
            JsonArray shape = new JsonArray();
            for (long dim : tensor.shape()) {
                shape.add(dim);
            }
            obj.add("shape", shape);
        }
        if (tensor.data() != null) {
            obj.add("data", data(tensor.data()));
        }
        return obj;
    }

    private static JsonArray data(TensorData data) {
        JsonArray array = new JsonArray();
        if (data instanceof TensorData.Float16Data h) {
            for (float f : h.values()) {
                array.add(f);
            }
        } else if (data instanceof TensorData.Float32Data f32) {
            for (float f : f32.values()) {
                array.add(f);
            }
        } else if (data instanceof TensorData.Float64Data f64) {
            for (double d : f64.values()) {
                array.add(d);
            }
        } else if (data instanceof TensorData.Int32Data i32) {
            for (int i : i32.values()) {
                array.add(i);
            }
        } else if (data instanceof TensorData.Int64Data i64) {
            for (long l : i64.values()) {
                array.add(l);
            }
        } else if (data instanceof TensorData.BoolData b) {
            for (boolean v : b.values()) {
                array.add(v);
            }
        } else if (data instanceof TensorData.StringData s) {
            for (String v : s.values()) {
                array.add(v);
            }
        }
        return array;
    }

    private static String elemName(ElementType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    // ==================== Reading ====================

    public static OnnxGraph fromJson(JsonObject root) {
        List<Node> nodes = new ArrayList<>();
        for (JsonElement element : array(root, "nodes")) {
            nodes.add(readNode(element.getAsJsonObject()));
        }
        return new OnnxGraph(nodes, readArguments(array(root, "inputs")), readArguments(array(root, "outputs")));
    }

    private static Node readNode(JsonObject obj) {
        String name = string(obj, "name");
        NodeType type;
        try {
            type = NodeType.fromOnnxName(string(obj, "type"));
        } catch (IllegalArgumentException e) {
            throw new OnnxImportException(e.getMessage() + " (node '" + name + "')", e);
        }

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        if (obj.has("attributes")) {
            for (Map.Entry<String, JsonElement> entry : obj.getAsJsonObject("attributes").entrySet()) {
                attributes.put(entry.getKey(), readAttribute(entry.getKey(), entry.getValue().getAsJsonObject()));
            }
        }

        List<State> states = new ArrayList<>();
        if (obj.has("states")) {
            for (JsonElement element : obj.getAsJsonArray("states")) {
                JsonObject state = element.getAsJsonObject();
                states.add(new State(string(state, "name"), readTensor(object(state, "tensor"))));
            }
        }

        return new Node(name, type, readArguments(array(obj, "inputs")), readArguments(array(obj, "outputs")),
            attributes, states);
    }

    private static List<Argument> readArguments(JsonArray array) {
        List<Argument> arguments = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            JsonObject obj = element.getAsJsonObject();
            JsonObject type = object(obj, "type");
            String kind = string(type, "kind");
            ArgType argType = switch (kind) {
                case "tensor" -> new ArgType.TensorArg(integer(type, "rank"), elementType(type));
                case "scalar" -> new ArgType.ScalarArg(elementType(type));
                case "shape" -> new ArgType.ShapeArg(integer(type, "dims"));
                default -> throw new OnnxImportException("Unknown argument kind '" + kind + "'");
            };
            arguments.add(new Argument(string(obj, "name"), argType));
        }
        return arguments;
    }

    private static AttributeValue readAttribute(String key, JsonObject obj) {
        String kind = string(obj, "kind");
        JsonElement value = obj.get("value");
        if (value == null) {
            throw new OnnxImportException("Attribute '" + key + "' has no value");
        }
        switch (kind) {
            case "float32":
                return new AttributeValue.Float32(value.getAsFloat());
            case "int64":
                return new AttributeValue.Int64(value.getAsLong());
            case "tensor":
                return new AttributeValue.TensorValue(readTensor(value.getAsJsonObject()));
            case "float32s": {
                JsonArray array = value.getAsJsonArray();
                float[] values = new float[array.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = array.get(i).getAsFloat();
                }
                return new AttributeValue.Float32s(values);
            }
            case "int64s": {
                JsonArray array = value.getAsJsonArray();
                long[] values = new long[array.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = array.get(i).getAsLong();
                }
                return new AttributeValue.Int64s(values);
            }
            case "string":
                return new AttributeValue.Str(value.getAsString());
            default:
                throw new OnnxImportException("Unknown kind '" + kind + "' for attribute '" + key + "'");
        }
    }

    private static Tensor readTensor(JsonObject obj) {
        int rank = integer(obj, "rank");
        ElementType elementType = elementType(obj);
        long[] shape = null;
        if (obj.has("shape")) {
            JsonArray array = obj.getAsJsonArray("shape");
            shape = new long[array.size()];
            for (int i = 0; i < shape.length; i++) {
                shape[i] = array.get(i).getAsLong();
            }
        }
        TensorData data = obj.has("data") ? readData(elementType, obj.getAsJsonArray("data")) : null;
        return new Tensor(rank, elementType, shape, data);
    }

    private static TensorData readData(ElementType elementType, JsonArray array) {
        int n = array.size();
        switch (elementType) {
            case FLOAT16:
            case FLOAT32: {
                float[] values = new float[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsFloat();
                }
                return elementType == ElementType.FLOAT16
                    ? new TensorData.Float16Data(values)
                    : new TensorData.Float32Data(values);
            }
            case FLOAT64: {
                double[] values = new double[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsDouble();
                }
                return new TensorData.Float64Data(values);
            }
            case INT32: {
                int[] values = new int[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsInt();
                }
                return new TensorData.Int32Data(values);
            }
            case INT64: {
                long[] values = new long[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsLong();
                }
                return new TensorData.Int64Data(values);
            }
            case BOOL: {
                boolean[] values = new boolean[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsBoolean();
                }
                return new TensorData.BoolData(values);
            }
            case STRING: {
                String[] values = new String[n];
                for (int i = 0; i < n; i++) {
                    values[i] = array.get(i).getAsString();
                }
                return new TensorData.StringData(values);
            }
            default:
                throw new OnnxImportException("Unknown element type " + elementType);
        }
    }

    private static ElementType elementType(JsonObject obj) {
        String elem = string(obj, "elem");
        try {
            return ElementType.valueOf(elem.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OnnxImportException("Unknown element type '" + elem + "'", e);
        }
    }

    private static JsonElement required(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) {
            throw new OnnxImportException("Missing required field '" + key + "' in " + obj);
        }
        return element;
    }

    private static String string(JsonObject obj, String key) {
        return required(obj, key).getAsString();
    }

    private static int integer(JsonObject obj, String key) {
        return required(obj, key).getAsInt();
    }

    private static JsonObject object(JsonObject obj, String key) {
        return required(obj, key).getAsJsonObject();
    }

    private static JsonArray array(JsonObject obj, String key) {
        return required(obj, key).getAsJsonArray();
    }
}
