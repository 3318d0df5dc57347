package io.argbind.javalin;

import io.argbind.core.model.Args;
import io.javalin.http.Context;

/**
 * Reads Javalin's request parameters as {@link Args}. Javalin's parameter maps are already
 * percent-decoded but group repeated keys, so the query is re-read from the raw query string
 * when one is available to keep pairs in submission order.
 */
public final class JavalinArgs {

    private JavalinArgs() {}

    /** Query-string parameters, in submission order when the raw query string is available. */
    public static Args query(Context ctx) {
        String raw = ctx.queryString();
        return raw != null ? Args.parse(raw) : Args.of(ctx.queryParamMap());
    }

    /** Form body parameters ({@code application/x-www-form-urlencoded} or multipart fields). */
    public static Args form(Context ctx) {
        return Args.of(ctx.formParamMap());
    }
}
