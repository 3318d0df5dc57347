package io.argbind.javalin.config;

import io.argbind.core.scan.FormParam;
import io.argbind.core.scan.UrlParam;
import java.lang.annotation.Annotation;
import java.util.Locale;

/** Annotation namespace used when a non-JSON request body is scanned onto a target. */
public enum ScanNamespace {
    FORM(FormParam.class),
    URL(UrlParam.class);

    private final Class<? extends Annotation> annotation;

    ScanNamespace(Class<? extends Annotation> annotation) {
        this.annotation = annotation;
    }

    /** The field annotation whose {@code value()} names each binding key. */
    public Class<? extends Annotation> annotation() {
        return annotation;
    }

    /**
     * Parses a configuration value, {@code form} or {@code url}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ScanNamespace parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "form":
                return FORM;
            case "url":
                return URL;
            default:
                throw new IllegalArgumentException("unknown scan namespace '" + value + "', expected form or url");
        }
    }
}
