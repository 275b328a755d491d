package io.memento.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Codec for the JSON text columns of the workspace schema.
 *
 * <p>Encodings are kept compatible with existing workspace files:</p>
 * <ul>
 *   <li>tags and id lists: {@code ["a","b"]}</li>
 *   <li>linkages: {@code [{"type":"memory","id":"ab12cd34","label":"related"},
 *       {"type":"file","path":"src/app.js","label":"touches"}]}</li>
 * </ul>
 *
 * <p>Reading never fails: null, blank or malformed text decodes to an empty list, and
 * malformed entries inside an otherwise valid array are skipped.</p>
 */
public final class MemoryJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(MemoryJsonCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MemoryJsonCodec() {
    }

    public static List<String> parseStrings(String json) {
        JsonNode root = readArray(json);
        if (root == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode node : root) {
            if (node.isValueNode() && !node.isNull()) {
                values.add(node.asText());
            }
        }
        return values;
    }

    public static String writeStrings(Collection<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        if (values != null) {
            values.forEach(array::add);
        }
        return write(array);
    }

    public static List<Linkage> parseLinkages(String json) {
        JsonNode root = readArray(json);
        if (root == null) {
            return List.of();
        }
        List<Linkage> linkages = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                continue;
            }
            LinkageKind kind = LinkageKind.fromString(node.path("type").asText(null));
            String ref = kind == LinkageKind.FILE
                    ? node.path("path").asText(null)
                    : node.path("id").asText(null);
            if (ref == null) {
                log.debug("Skipping linkage without target: {}", node);
                continue;
            }
            linkages.add(new Linkage(kind, ref, node.path("label").asText("")));
        }
        return linkages;
    }

    public static String writeLinkages(List<Linkage> linkages) {
        ArrayNode array = MAPPER.createArrayNode();
        if (linkages != null) {
            for (Linkage linkage : linkages) {
                ObjectNode node = array.addObject();
                node.put("type", linkage.kind().wireName());
                node.put(linkage.kind() == LinkageKind.FILE ? "path" : "id", linkage.ref());
                node.put("label", linkage.label());
            }
        }
        return write(array);
    }

    private static JsonNode readArray(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            return root != null && root.isArray() ? root : null;
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed JSON column value: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON column value", e);
        }
    }
}
