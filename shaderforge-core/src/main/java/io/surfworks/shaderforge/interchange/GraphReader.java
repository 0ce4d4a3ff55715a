package io.surfworks.shaderforge.interchange;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import io.surfworks.shaderforge.graph.BuiltinVariable;
import io.surfworks.shaderforge.graph.ConstructionException;
import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;
import io.surfworks.shaderforge.graph.Op;
import io.surfworks.shaderforge.graph.ShaderSession;
import io.surfworks.shaderforge.graph.ShaderType;
import io.surfworks.shaderforge.graph.Storage;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads shader graphs from JSON documents.
 *
 * <p>Document layout:
 * <pre>{@code
 * {
 *   "nodes": [
 *     {"id": "pos", "kind": "variable", "storage": "attribute", "name": "aPosition", "type": "vec3"},
 *     {"id": "one", "kind": "literal", "type": "float", "value": 1.0},
 *     {"id": "clip", "kind": "term", "op": "vec4", "operands": ["pos", "one"]},
 *     {"id": "xy", "kind": "term", "op": "swizzle", "selector": "xy", "operands": ["clip"]}
 *   ],
 *   "outputs": {"gl_Position": "clip"}
 * }
 * }</pre>
 *
 * <p>Nodes are built in document order, so operands must name earlier nodes.
 * Naming the same id from several operands shares that node. An output key is
 * either a built-in slot name or the id of a varying variable node.
 */
public final class GraphReader {

    private static final Gson GSON = new Gson();

    private GraphReader() {}

    /**
     * Reads a graph document from a file.
     *
     * @param path    the JSON file
     * @param session the session that numbers the new nodes
     * @throws IOException          if the file cannot be read
     * @throws GraphFormatException if the document is malformed
     */
    public static GraphDocument read(Path path, ShaderSession session) throws IOException, GraphFormatException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), session);
    }

    /**
     * Parses a graph document from a JSON string.
     *
     * @param json    the document text
     * @param session the session that numbers the new nodes
     * @throws GraphFormatException if the document is malformed
     */
    public static GraphDocument parse(String json, ShaderSession session) throws GraphFormatException {
        JsonObject root;
        try {
            root = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw new GraphFormatException("invalid JSON: " + e.getMessage());
        }
        if (root == null || !root.has("nodes") || !root.get("nodes").isJsonArray()) {
            throw new GraphFormatException("document must contain a \"nodes\" array");
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (JsonElement element : root.getAsJsonArray("nodes")) {
            if (!element.isJsonObject()) {
                throw new GraphFormatException("every entry of \"nodes\" must be an object");
            }
            JsonObject obj = element.getAsJsonObject();
            String id = requireString(obj, "id", "?");
            if (nodes.containsKey(id)) {
                throw new GraphFormatException(id, "duplicate node id");
            }
            nodes.put(id, buildNode(id, obj, nodes, session));
        }

        List<GraphDocument.Output> outputs = new ArrayList<>();
        if (root.has("outputs")) {
            if (!root.get("outputs").isJsonObject()) {
                throw new GraphFormatException("\"outputs\" must be an object");
            }
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("outputs").entrySet()) {
                String slot = entry.getKey();
                if (!isString(entry.getValue())) {
                    throw new GraphFormatException("output '" + slot + "' must name a node id");
                }
                Node value = resolve(slot, entry.getValue().getAsString(), nodes);
                Node target = nodes.get(slot);
                if (target != null && !isVarying(target)) {
                    throw new GraphFormatException(slot, "output target must be a varying variable");
                }
                outputs.add(new GraphDocument.Output(slot, target, value));
            }
        }
        return new GraphDocument(nodes, outputs);
    }

    private static Node buildNode(String id, JsonObject obj, Map<String, Node> defined, ShaderSession session)
            throws GraphFormatException {
        String kind = requireString(obj, "kind", id);
        try {
            return switch (kind) {
                case "literal" -> buildLiteral(id, obj, session);
                case "variable" -> buildVariable(id, obj, session);
                case "term" -> buildTerm(id, obj, defined, session);
                case "conditional" -> {
                    List<Node> operands = operands(id, obj, defined);
                    if (operands.size() != 3) {
                        throw new GraphFormatException(id, "conditional needs exactly 3 operands, got " + operands.size());
                    }
                    yield session.conditional(operands.get(0), operands.get(1), operands.get(2));
                }
                default -> throw new GraphFormatException(id, "unknown kind '" + kind + "'");
            };
        } catch (ConstructionException e) {
            throw new GraphFormatException(id, e.getMessage(), e);
        }
    }

    private static Node buildLiteral(String id, JsonObject obj, ShaderSession session) throws GraphFormatException {
        ShaderType type = requireType(id, obj);
        JsonElement value = obj.get("value");
        if (value == null || !value.isJsonPrimitive()) {
            throw new GraphFormatException(id, "literal needs a \"value\"");
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        switch (type) {
            case FLOAT:
                if (!primitive.isNumber()) {
                    throw new GraphFormatException(id, "float literal value must be a number");
                }
                return session.literal(primitive.getAsDouble());
            case INT:
                return session.literal(intValue(id, primitive));
            case BOOL:
                if (!primitive.isBoolean()) {
                    throw new GraphFormatException(id, "bool literal value must be true or false");
                }
                return session.literal(primitive.getAsBoolean());
            default:
                throw new GraphFormatException(id, "literals must be float, int or bool, got " + type);
        }
    }

    private static int intValue(String id, JsonPrimitive primitive) throws GraphFormatException {
        if (!primitive.isNumber()) {
            throw new GraphFormatException(id, "int literal value must be an integer");
        }
        BigDecimal value = primitive.getAsBigDecimal();
        if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
            throw new GraphFormatException(id, "int literal value must be an integer");
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new GraphFormatException(id, "int literal value " + value.toPlainString() + " is out of range");
        }
    }

    private static Node buildVariable(String id, JsonObject obj, ShaderSession session) throws GraphFormatException {
        String storageName = requireString(obj, "storage", id);
        String name = requireString(obj, "name", id);
        Storage storage;
        try {
            storage = Storage.valueOf(storageName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GraphFormatException(id, "unknown storage '" + storageName + "'");
        }
        if (storage == Storage.BUILTIN) {
            for (BuiltinVariable builtin : BuiltinVariable.values()) {
                if (builtin.glslName().equals(name)) {
                    return session.builtin(builtin);
                }
            }
            throw new GraphFormatException(id, "unknown built-in variable '" + name + "'");
        }
        ShaderType type = requireType(id, obj);
        return switch (storage) {
            case ATTRIBUTE -> session.attribute(name, type);
            case UNIFORM -> session.uniform(name, type);
            case VARYING -> session.varying(name, type);
            case BUILTIN -> throw new IllegalStateException("handled above");
        };
    }

    private static Node buildTerm(String id, JsonObject obj, Map<String, Node> defined, ShaderSession session)
            throws GraphFormatException {
        String key = requireString(obj, "op", id);
        Op op = Op.fromKey(key)
                .orElseThrow(() -> new GraphFormatException(id, "unknown operator '" + key + "'"));
        List<Node> operands = operands(id, obj, defined);
        if (op == Op.SWIZZLE) {
            if (operands.size() != 1) {
                throw new GraphFormatException(id, "swizzle needs exactly 1 operand, got " + operands.size());
            }
            return session.swizzle(operands.get(0), requireString(obj, "selector", id));
        }
        return session.term(op, operands.toArray());
    }

    // ==================== Helpers ====================

    private static List<Node> operands(String id, JsonObject obj, Map<String, Node> defined)
            throws GraphFormatException {
        JsonElement element = obj.get("operands");
        if (element == null || !element.isJsonArray()) {
            throw new GraphFormatException(id, "needs an \"operands\" array");
        }
        JsonArray array = element.getAsJsonArray();
        List<Node> operands = new ArrayList<>(array.size());
        for (JsonElement ref : array) {
            if (!isString(ref)) {
                throw new GraphFormatException(id, "operands must be node ids");
            }
            operands.add(resolve(id, ref.getAsString(), defined));
        }
        return operands;
    }

    private static Node resolve(String id, String ref, Map<String, Node> defined) throws GraphFormatException {
        Node node = defined.get(ref);
        if (node == null) {
            throw new GraphFormatException(id, "reference to undefined node '" + ref + "'");
        }
        return node;
    }

    private static ShaderType requireType(String id, JsonObject obj) throws GraphFormatException {
        String keyword = requireString(obj, "type", id);
        return ShaderType.fromKeyword(keyword)
                .orElseThrow(() -> new GraphFormatException(id, "unknown type '" + keyword + "'"));
    }

    private static String requireString(JsonObject obj, String field, String id) throws GraphFormatException {
        JsonElement element = obj.get(field);
        if (!isString(element)) {
            throw new GraphFormatException(id, "missing string field \"" + field + "\"");
        }
        return element.getAsString();
    }

    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static boolean isVarying(Node node) {
        return node.kind() == NodeKind.VARIABLE && node.variable().storage() == Storage.VARYING;
    }
}
