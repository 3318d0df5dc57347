package io.argbind.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.argbind.core.error.KeySyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BracketKey")
class BracketKeyTest {

    @Test
    @DisplayName("plain name is a single segment")
    void plainName() {
        assertThat(BracketKey.split("name", 32)).containsExactly("name");
    }

    @Test
    @DisplayName("each bracket pair adds a segment")
    void nestedSegments() {
        assertThat(BracketKey.split("bar[one][two]", 32)).containsExactly("bar", "one", "two");
    }

    @Test
    @DisplayName("empty brackets yield empty segments")
    void emptySegments() {
        assertThat(BracketKey.split("items[]", 32)).containsExactly("items", "");
        assertThat(BracketKey.split("a[][b]", 32)).containsExactly("a", "", "b");
    }

    @Test
    @DisplayName("the top-level name may be empty")
    void emptyName() {
        assertThat(BracketKey.split("", 32)).containsExactly("");
        assertThat(BracketKey.split("[x]", 32)).containsExactly("", "x");
    }

    @Test
    @DisplayName("segments keep dots, spaces and other characters verbatim")
    void verbatimSegments() {
        assertThat(BracketKey.split("a.b[c d][-1]", 32)).containsExactly("a.b", "c d", "-1");
    }

    @ParameterizedTest(name = "{0} → {2} at {1}")
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '"',
            value = {
                "a]b     | 1 | unexpected ']'",
                "a[b     | 1 | unclosed '['",
                "a[b]c   | 4 | expected '[' after ']'",
                "a[b[c]] | 3 | unexpected '[' inside brackets",
                "a[b]]   | 4 | expected '[' after ']'"
            })
    @DisplayName("malformed keys are rejected with the offending index")
    void malformedKeys(String key, int position, String reason) {
        assertThatThrownBy(() -> BracketKey.split(key, 32))
                .isInstanceOf(KeySyntaxException.class)
                .satisfies(e -> {
                    KeySyntaxException ex = (KeySyntaxException) e;
                    assertThat(ex.position()).isEqualTo(position);
                    assertThat(ex.key()).isEqualTo(key);
                    assertThat(ex.getMessage()).endsWith(reason);
                });
    }

    @Test
    @DisplayName("nesting is limited to maxDepth bracket segments")
    void depthLimit() {
        assertThat(BracketKey.split("a[1][2]", 2)).containsExactly("a", "1", "2");
        assertThatThrownBy(() -> BracketKey.split("a[1][2][3]", 2))
                .isInstanceOf(KeySyntaxException.class)
                .hasMessageContaining("nesting deeper than 2 levels");
    }
}
