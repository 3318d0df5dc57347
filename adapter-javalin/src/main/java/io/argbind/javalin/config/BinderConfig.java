package io.argbind.javalin.config;

import io.argbind.core.tree.DecoderOptions;
import java.util.Objects;

/**
 * Settings for {@link io.argbind.javalin.RequestDecoder}.
 *
 * <p>
 * Use {@link #builder()} to override individual values; unset values take the defaults of
 * {@link #DEFAULT}.
 *
 * @param scanNamespace             annotation namespace for form-body scanning
 * @param maxDepth                  maximum bracket nesting for query-string decoding
 * @param caseInsensitiveProperties match nested keys to properties ignoring case
 * @param failOnUnknownProperties   reject nested keys with no matching property
 */
public record BinderConfig(
        ScanNamespace scanNamespace,
        int maxDepth,
        boolean caseInsensitiveProperties,
        boolean failOnUnknownProperties) {

    /** Form namespace, depth 32, case-insensitive, unknown keys ignored. */
    public static final BinderConfig DEFAULT = builder().build();

    public BinderConfig {
        Objects.requireNonNull(scanNamespace, "scanNamespace");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
    }

    /** Options for the nested-key decoder. */
    public DecoderOptions decoderOptions() {
        return new DecoderOptions(maxDepth, caseInsensitiveProperties, failOnUnknownProperties);
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BinderConfig}. */
    public static final class Builder {
        private ScanNamespace scanNamespace = ScanNamespace.FORM;
        private int maxDepth = DecoderOptions.DEFAULT.maxDepth();
        private boolean caseInsensitiveProperties = DecoderOptions.DEFAULT.caseInsensitiveProperties();
        private boolean failOnUnknownProperties = DecoderOptions.DEFAULT.failOnUnknownProperties();

        Builder() {}

        public Builder scanNamespace(ScanNamespace scanNamespace) {
            this.scanNamespace = scanNamespace;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder caseInsensitiveProperties(boolean caseInsensitiveProperties) {
            this.caseInsensitiveProperties = caseInsensitiveProperties;
            return this;
        }

        public Builder failOnUnknownProperties(boolean failOnUnknownProperties) {
            this.failOnUnknownProperties = failOnUnknownProperties;
            return this;
        }

        public BinderConfig build() {
            return new BinderConfig(scanNamespace, maxDepth, caseInsensitiveProperties, failOnUnknownProperties);
        }
    }
}
