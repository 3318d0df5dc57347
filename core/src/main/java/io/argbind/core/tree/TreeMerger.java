package io.argbind.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Merges per-argument trees into one.
 *
 * <ul>
 * <li>object ⊕ object: union of keys; keys on both sides merge recursively</li>
 * <li>array ⊕ array: concatenation, later elements last</li>
 * <li>anything else: the later node replaces the earlier one</li>
 * </ul>
 *
 * <p>
 * Merging happens in argument submission order, so conflicting scalars resolve to the last value
 * submitted. The accumulator is modified in place.
 */
public final class TreeMerger {

    private TreeMerger() {}

    /**
     * Merges {@code later} into {@code earlier}.
     *
     * @param earlier the accumulated node, may be modified
     * @param later   the node built from a later argument
     * @return the merged node: {@code earlier} when both are objects or both arrays, else {@code later}
     */
    public static JsonNode merge(JsonNode earlier, JsonNode later) {
        if (earlier instanceof ObjectNode earlierObject && later instanceof ObjectNode laterObject) {
            return mergeObjects(earlierObject, laterObject);
        }
        if (earlier instanceof ArrayNode earlierArray && later instanceof ArrayNode laterArray) {
            return earlierArray.addAll(laterArray);
        }
        return later;
    }

    private static ObjectNode mergeObjects(ObjectNode earlier, ObjectNode later) {
        Iterator<Map.Entry<String, JsonNode>> fields = later.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = earlier.get(field.getKey());
            if (existing != null) {
                earlier.set(field.getKey(), merge(existing, field.getValue()));
            } else {
                earlier.set(field.getKey(), field.getValue());
            }
        }
        return earlier;
    }
}
