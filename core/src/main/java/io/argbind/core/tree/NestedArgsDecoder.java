package io.argbind.core.tree;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.argbind.core.error.KeySyntaxException;
import io.argbind.core.error.TreeDecodeException;
import io.argbind.core.model.Args;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nested-key decoder: turns bracket-notation arguments into a typed value.
 *
 * <p>
 * Pipeline per call:
 * <ol>
 * <li>each (key, value) pair → {@link BracketKey#split} → {@link TreeBuilder#build}</li>
 * <li>all trees → {@link TreeMerger#merge}, in argument submission order</li>
 * <li>merged tree → JSON</li>
 * <li>JSON → target type through Jackson, matching keys to declared field names (any visibility)
 * or {@code @JsonProperty} names</li>
 * </ol>
 *
 * <p>
 * {@code bar[one][two]=2&bar[one][red]=112} decodes as {@code {"bar":{"one":{"two":2,"red":112}}}}.
 *
 * <p>
 * Unlike {@link io.argbind.core.scan.ArgScanner}, keys come from the argument syntax rather than
 * from annotations, and are matched to the target by property name.
 *
 * <p>
 * Thread-safe: the mapper is configured once at construction and only read afterwards.
 */
public final class NestedArgsDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(NestedArgsDecoder.class);

    private static final NestedArgsDecoder STANDARD = new NestedArgsDecoder(DecoderOptions.DEFAULT);

    private final DecoderOptions options;
    private final ObjectMapper mapper;

    public NestedArgsDecoder(DecoderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.mapper = JsonMapper.builder()
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, options.caseInsensitiveProperties())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, options.failOnUnknownProperties())
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .build();
    }

    /** Returns the shared decoder with {@link DecoderOptions#DEFAULT}. */
    public static NestedArgsDecoder standard() {
        return STANDARD;
    }

    /** The options this decoder was built with. */
    public DecoderOptions options() {
        return options;
    }

    /**
     * Builds and merges the trees of all arguments.
     *
     * @param args the argument multimap
     * @return the merged tree, an empty object for no arguments
     * @throws KeySyntaxException if any key is malformed
     */
    public ObjectNode toTree(Args args) {
        Objects.requireNonNull(args, "args");
        Map<String, List<String>> segmentsByKey = new HashMap<>();
        JsonNode merged = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, String> pair : args.pairs()) {
            List<String> segments =
                    segmentsByKey.computeIfAbsent(pair.getKey(), key -> BracketKey.split(key, options.maxDepth()));
            merged = TreeMerger.merge(merged, TreeBuilder.build(segments, pair.getValue()));
        }
        // Object ⊕ object always yields the accumulator.
        return (ObjectNode) merged;
    }

    /**
     * Serializes the merged tree as JSON.
     *
     * @param args the argument multimap
     * @return compact JSON text
     * @throws KeySyntaxException if any key is malformed
     */
    public String toJson(Args args) {
        try {
            return mapper.writeValueAsString(toTree(args));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("argument tree could not be serialized", e);
        }
    }

    /**
     * Decodes the arguments into a new instance of {@code type}.
     *
     * @throws KeySyntaxException  if any key is malformed
     * @throws TreeDecodeException if the tree does not fit the type
     */
    public <T> T decode(Args args, Class<T> type) {
        return readAs(args, mapper.constructType(type));
    }

    /**
     * Decodes the arguments into a new instance of a generic type, e.g.
     * {@code new TypeReference<Map<String, List<Integer>>>() {}}.
     *
     * @throws KeySyntaxException  if any key is malformed
     * @throws TreeDecodeException if the tree does not fit the type
     */
    public <T> T decode(Args args, TypeReference<T> type) {
        return readAs(args, mapper.constructType(type));
    }

    /**
     * Decodes the arguments onto an existing object. Properties absent from the arguments keep their
     * current values.
     *
     * @param args   the argument multimap
     * @param target the object to update
     * @return the updated object, the same instance for beans
     * @throws KeySyntaxException  if any key is malformed
     * @throws TreeDecodeException if the tree does not fit the target
     */
    public <T> T decodeInto(Args args, T target) {
        Objects.requireNonNull(target, "target");
        byte[] json = serialize(args);
        try {
            T updated = mapper.readerForUpdating(target).readValue(json);
            LOG.debug("Decoded {} byte(s) of arguments onto {}", json.length, target.getClass().getName());
            return updated;
        } catch (IOException e) {
            throw decodeFailure(target.getClass().getName(), e);
        }
    }

    private <T> T readAs(Args args, JavaType type) {
        byte[] json = serialize(args);
        try {
            T value = mapper.readValue(json, type);
            LOG.debug("Decoded {} byte(s) of arguments into {}", json.length, type.toCanonical());
            return value;
        } catch (IOException e) {
            throw decodeFailure(type.toCanonical(), e);
        }
    }

    private byte[] serialize(Args args) {
        try {
            return mapper.writeValueAsBytes(toTree(args));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("argument tree could not be serialized", e);
        }
    }

    private static TreeDecodeException decodeFailure(String targetType, IOException e) {
        String detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
        return new TreeDecodeException("failed to decode arguments into " + targetType + ": " + detail, e, targetType);
    }
}
