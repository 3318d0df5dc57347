package io.argbind.javalin;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.argbind.core.error.BindException;
import io.argbind.core.error.MissingArgException;
import io.argbind.core.model.Args;
import io.argbind.core.scan.ArgScanner;
import io.argbind.core.scan.RequiredArgs;
import io.argbind.core.tree.NestedArgsDecoder;
import io.argbind.javalin.config.BinderConfig;
import io.javalin.http.Context;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a Javalin request onto handler-defined types.
 *
 * <p>
 * {@link #decode} picks the strategy from the request content type:
 * <ul>
 * <li>{@code application/json} or any {@code +json} type: the body is read as JSON onto the target,
 * updating it in place</li>
 * <li>anything else: the form parameters are scanned onto the fields annotated with the configured
 * namespace ({@code @FormParam} by default)</li>
 * </ul>
 *
 * <p>
 * Thread-safe; one instance is typically shared by all handlers.
 */
public final class RequestDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(RequestDecoder.class);

    private static final String JSON_TYPE = "application/json";
    private static final String JSON_SUFFIX = "+json";

    private final BinderConfig config;
    private final NestedArgsDecoder nested;
    private final ObjectMapper json;

    public RequestDecoder() {
        this(BinderConfig.DEFAULT);
    }

    public RequestDecoder(BinderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.nested = new NestedArgsDecoder(config.decoderOptions());
        // JSON bodies follow the same property matching rules as nested query keys.
        this.json = JsonMapper.builder()
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, config.caseInsensitiveProperties())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, config.failOnUnknownProperties())
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .build();
    }

    /** The configuration this decoder was built with. */
    public BinderConfig config() {
        return config;
    }

    /**
     * Decodes the request body onto {@code target}.
     *
     * @param ctx    the Javalin request context
     * @param target the object to populate
     * @throws RequestDecodeException if the body does not fit the target
     */
    public void decode(Context ctx, Object target) {
        Objects.requireNonNull(target, "target");
        String contentType = ctx.contentType();
        try {
            if (isJson(contentType)) {
                json.readerForUpdating(target).readValue(ctx.body());
                LOG.debug("Decoded JSON body onto {}", target.getClass().getSimpleName());
            } else {
                List<String> matched =
                        ArgScanner.scan(JavalinArgs.form(ctx), target, config.scanNamespace().annotation());
                LOG.debug(
                        "Decoded {} body onto {}: {} field(s)",
                        contentType,
                        target.getClass().getSimpleName(),
                        matched.size());
            }
        } catch (JsonProcessingException | BindException e) {
            throw new RequestDecodeException(e);
        }
    }

    /**
     * Decodes bracket-notation query parameters into a new instance of {@code type}, e.g.
     * {@code ?filter[status]=open&filter[tags][]=a}.
     *
     * @throws RequestDecodeException if a key is malformed or the tree does not fit the type
     */
    public <T> T decodeQuery(Context ctx, Class<T> type) {
        try {
            return nested.decode(JavalinArgs.query(ctx), type);
        } catch (BindException e) {
            throw new RequestDecodeException(e);
        }
    }

    /**
     * Verifies that each name has a non-empty value in the form body or the query string.
     *
     * @throws MissingArgException for the first name neither provides
     */
    public void requireParams(Context ctx, List<String> names) {
        Args form = isJson(ctx.contentType()) ? Args.empty() : JavalinArgs.form(ctx);
        RequiredArgs.check(names, form, JavalinArgs.query(ctx));
    }

    static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }
        int semicolon = contentType.indexOf(';');
        String mediaType = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType)
                .trim()
                .toLowerCase(Locale.ROOT);
        return mediaType.equals(JSON_TYPE) || mediaType.endsWith(JSON_SUFFIX);
    }
}
