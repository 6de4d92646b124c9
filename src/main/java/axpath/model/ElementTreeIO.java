package axpath.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads and writes accessibility tree dumps as JSON.
 *
 * <p>A dump is one object per node:
 * <pre>{@code
 * {
 *   "role": "AXButton",
 *   "title": "OK", "value": null, "description": "confirm",
 *   "frame": {"x": 10, "y": 20, "width": 80, "height": 24},
 *   "attributes": {"identifier": "ok-button", "enabled": true},
 *   "actions": ["AXPress"],
 *   "children": [ ... ]
 * }
 * }</pre>
 * Attribute names may use any spelling {@link AttributeNormalizer} accepts.
 */
public final class ElementTreeIO {

    private static final Logger log = LoggerFactory.getLogger(ElementTreeIO.class);

    /** Shared ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private ElementTreeIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a tree dump from a JSON file.
     *
     * @throws IOException if the file cannot be read or is not a valid dump
     */
    public static ElementNode read(Path path) throws IOException {
        log.debug("Reading tree dump from: {}", path);
        ElementNode root = fromJson(Files.readString(path));
        log.info("Loaded tree rooted at {} from {}", root.getRole(), path);
        return root;
    }

    /** Reads a tree dump from a stream (e.g. a classpath resource). */
    public static ElementNode read(InputStream in) throws IOException {
        return toNode(MAPPER.readTree(in), "$");
    }

    /** Parses a tree dump from a JSON string. */
    public static ElementNode fromJson(String json) throws IOException {
        return toNode(MAPPER.readTree(json), "$");
    }

    /** Serializes a tree to a JSON string. */
    public static String toJson(NodeView root) throws IOException {
        return MAPPER.writeValueAsString(toJsonNode(root));
    }

    /** Writes a tree dump to a file (pretty-printed; parent directories are created). */
    public static void write(NodeView root, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), toJsonNode(root));
        log.info("Wrote tree rooted at {} to {}", root.getRole(), path);
    }

    /** Returns the shared ObjectMapper (for reuse by other JSON writers). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Conversion ────────────────────────────────────────────────────────

    private static ElementNode toNode(JsonNode json, String where) throws IOException {
        if (json == null || !json.isObject()) {
            throw new IOException("Tree node at " + where + " is not a JSON object");
        }
        JsonNode role = json.get("role");
        if (role == null || !role.isTextual() || role.asText().isBlank()) {
            throw new IOException("Tree node at " + where + " has no role");
        }

        ElementNode.Builder b = ElementNode.builder(role.asText())
                .title(text(json, "title"))
                .value(text(json, "value"))
                .description(text(json, "description"));

        JsonNode frame = json.get("frame");
        if (frame != null && frame.isObject()) {
            b.frame(frame.path("x").asDouble(), frame.path("y").asDouble(),
                    frame.path("width").asDouble(), frame.path("height").asDouble());
        }

        JsonNode attrs = json.get("attributes");
        if (attrs != null && attrs.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = attrs.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                b.attribute(e.getKey(), MAPPER.convertValue(e.getValue(), Object.class));
            }
        }

        JsonNode actions = json.get("actions");
        if (actions != null && actions.isArray()) {
            actions.forEach(a -> b.action(a.asText()));
        }

        JsonNode children = json.get("children");
        if (children != null && children.isArray()) {
            for (int i = 0; i < children.size(); i++) {
                b.child(toNode(children.get(i), where + ".children[" + i + "]"));
            }
        }
        return b.build();
    }

    private static String text(JsonNode json, String field) {
        JsonNode v = json.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static ObjectNode toJsonNode(NodeView node) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("role", node.getRole());
        if (node.getTitle() != null)       out.put("title", node.getTitle());
        if (node.getValue() != null)       out.put("value", node.getValue());
        if (node.getDescription() != null) out.put("description", node.getDescription());
        out.set("frame", MAPPER.valueToTree(node.getFrame()));

        if (!node.getAttributes().isEmpty()) {
            ObjectNode attrs = out.putObject("attributes");
            node.getAttributes().forEach((k, v) -> {
                switch (v.getKind()) {
                    case STRING  -> attrs.put(k.name(), v.asText());
                    case BOOLEAN -> attrs.put(k.name(), v.asBoolean());
                    case NUMBER  -> attrs.put(k.name(), Double.parseDouble(v.asText()));
                    case RECT    -> attrs.set(k.name(), MAPPER.valueToTree(v.asRect()));
                }
            });
        }
        if (!node.getActions().isEmpty()) {
            ArrayNode actions = out.putArray("actions");
            node.getActions().forEach(actions::add);
        }
        if (!node.getChildren().isEmpty()) {
            ArrayNode children = out.putArray("children");
            node.getChildren().forEach(c -> children.add(toJsonNode(c)));
        }
        return out;
    }
}
