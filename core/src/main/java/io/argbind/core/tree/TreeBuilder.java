package io.argbind.core.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the tree for a single (key, value) argument pair.
 *
 * <p>
 * {@code a[b][c]=4} becomes {@code {"a":{"b":{"c":4}}}}. An empty second segment marks a collection:
 * {@code a[]=4} becomes {@code {"a":[4]}} and {@code a[][b]=4} becomes {@code {"a":[{"b":4}]}}.
 *
 * <p>
 * Leaf values that are JSON number, boolean or {@code null} literals become typed nodes. Everything
 * else, including quoted strings, leading zeros, a leading {@code +}, surrounding whitespace,
 * numbers too large for a {@code double} and numbers longer than the JSON parser accepts, stays
 * literal text.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final ObjectMapper LITERALS = new ObjectMapper();

    /** JSON number grammar (RFC 8259 §6). */
    private static final Pattern JSON_NUMBER = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

    private TreeBuilder() {}

    /**
     * Builds the tree for one argument.
     *
     * @param segments the key segments from {@link BracketKey#split}, never empty
     * @param value    the raw argument value
     * @return an object node with the first segment as its only key
     */
    public static ObjectNode build(List<String> segments, String value) {
        ObjectNode node = NODES.objectNode();
        String head = segments.get(0);
        if (segments.size() == 1) {
            node.set(head, scalar(value));
            return node;
        }

        ObjectNode nested = build(segments.subList(1, segments.size()), value);
        if (segments.get(1).isEmpty()) {
            node.set(head, NODES.arrayNode().add(nested.get("")));
        } else {
            node.set(head, nested);
        }
        return node;
    }

    /**
     * Infers a scalar node from raw text.
     *
     * @param raw the raw argument value
     * @return a numeric, boolean or null node for JSON literals, otherwise a text node
     */
    public static JsonNode scalar(String raw) {
        switch (raw) {
            case "true":
                return NODES.booleanNode(true);
            case "false":
                return NODES.booleanNode(false);
            case "null":
                return NODES.nullNode();
            default:
                break;
        }
        if (!JSON_NUMBER.matcher(raw).matches()) {
            return NODES.textNode(raw);
        }
        JsonNode number;
        try {
            number = LITERALS.readTree(raw);
        } catch (JsonProcessingException e) {
            // Over the parser's number length limit.
            LOG.debug("Keeping {}-character numeric value as text: {}", raw.length(), e.getOriginalMessage());
            return NODES.textNode(raw);
        }
        if (number.isDouble() && !Double.isFinite(number.doubleValue())) {
            return NODES.textNode(raw);
        }
        return number;
    }
}
