package io.argbind.core.scan;

import io.argbind.core.error.MissingArgException;
import io.argbind.core.model.Args;
import java.util.List;

/**
 * Presence check for mandatory arguments, run before binding so handlers can rely on them.
 *
 * <p>
 * A name is satisfied when at least one of the given sources (typically the form body and the query
 * string) has a non-empty first value for it.
 */
public final class RequiredArgs {

    private RequiredArgs() {}

    /**
     * Verifies that every name is provided by at least one source.
     *
     * @param names   required argument keys, checked in order
     * @param sources argument multimaps to search
     * @throws MissingArgException for the first name no source provides
     */
    public static void check(List<String> names, Args... sources) {
        for (String name : names) {
            if (!isProvided(name, sources)) {
                throw new MissingArgException(name);
            }
        }
    }

    private static boolean isProvided(String name, Args... sources) {
        for (Args source : sources) {
            String first = source.first(name);
            if (first != null && !first.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
