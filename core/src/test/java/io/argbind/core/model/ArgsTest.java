package io.argbind.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Args}. */
class ArgsTest {

    // ── Lookup ──

    @Test
    void firstReturnsFirstSubmittedValue() {
        Args args = Args.builder().add("tag", "a").add("tag", "b").build();
        assertThat(args.first("tag")).isEqualTo("a");
    }

    @Test
    void firstReturnsNullForMissingKey() {
        assertThat(Args.builder().add("a", "1").build().first("b")).isNull();
    }

    @Test
    void allPreservesSubmissionOrder() {
        Args args = Args.builder()
                .add("str", "str1")
                .add("str", "str2")
                .add("str", "str3")
                .build();
        assertThat(args.all("str")).containsExactly("str1", "str2", "str3");
    }

    @Test
    void allReturnsEmptyListForMissingKey() {
        assertThat(Args.empty().all("missing")).isEmpty();
    }

    @Test
    void keysAreCaseSensitive() {
        Args args = Args.builder().add("Name", "x").build();
        assertThat(args.has("Name")).isTrue();
        assertThat(args.has("name")).isFalse();
    }

    @Test
    void emptyValueStillCountsAsPresent() {
        Args args = Args.builder().add("flag", "").build();
        assertThat(args.has("flag")).isTrue();
        assertThat(args.first("flag")).isEmpty();
    }

    // ── Ordering ──

    @Test
    void keysIterateInFirstOccurrenceOrder() {
        Args args = Args.builder()
                .add("b", "1")
                .add("a", "2")
                .add("b", "3")
                .add("c", "4")
                .build();
        assertThat(args.keys()).containsExactly("b", "a", "c");
    }

    @Test
    void forEachVisitsPairsInSubmissionOrder() {
        Args args = Args.builder()
                .add("b", "1")
                .add("a", "2")
                .add("b", "3")
                .build();
        List<String> visited = new ArrayList<>();
        args.forEach((key, value) -> visited.add(key + "=" + value));
        assertThat(visited).containsExactly("b=1", "a=2", "b=3");
        assertThat(args.toMultiValueMap()).containsExactly(
                Map.entry("b", List.of("1", "3")), Map.entry("a", List.of("2")));
    }

    @Test
    void pairsKeepInterleaving() {
        Args args = Args.parse("a=1&a[b]=2&a=3");

        assertThat(args.pairs()).containsExactly(Map.entry("a", "1"), Map.entry("a[b]", "2"), Map.entry("a", "3"));
        assertThat(args.all("a")).containsExactly("1", "3");
    }

    @Test
    void setDropsLaterPairsOfTheKey() {
        Args args = Args.builder()
                .add("a", "1")
                .add("b", "2")
                .add("a", "3")
                .set("a", "9")
                .build();

        assertThat(args.pairs()).containsExactly(Map.entry("a", "9"), Map.entry("b", "2"));
    }

    @Test
    void equalityFollowsSubmissionOrder() {
        Args interleaved = Args.parse("a=1&b=2&a=3");
        Args grouped = Args.parse("a=1&a=3&b=2");

        assertThat(interleaved.toMultiValueMap()).isEqualTo(grouped.toMultiValueMap());
        assertThat(interleaved).isNotEqualTo(grouped);
    }

    // ── Builder ──

    @Test
    void setReplacesValuesAndKeepsPosition() {
        Args args = Args.builder()
                .add("a", "1")
                .add("b", "2")
                .add("a", "3")
                .set("a", "9")
                .build();
        assertThat(args.keys()).containsExactly("a", "b");
        assertThat(args.all("a")).containsExactly("9");
    }

    @Test
    void removeDropsKey() {
        Args args = Args.builder().add("a", "1").add("b", "2").remove("a").build();
        assertThat(args.keys()).containsExactly("b");
    }

    @Test
    void builderRejectsNullValue() {
        assertThatThrownBy(() -> Args.builder().add("a", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void builtArgsAreIsolatedFromLaterBuilderChanges() {
        Args.Builder builder = Args.builder().add("a", "1");
        Args first = builder.build();
        builder.add("a", "2");
        assertThat(first.all("a")).containsExactly("1");
    }

    // ── of() ──

    @Test
    void ofPreservesMapOrderAndDropsEmptyLists() {
        Map<String, List<String>> source = new LinkedHashMap<>();
        source.put("z", List.of("1"));
        source.put("empty", List.of());
        source.put("a", List.of("2", "3"));
        Args args = Args.of(source);
        assertThat(args.keys()).containsExactly("z", "a");
        assertThat(args.all("a")).containsExactly("2", "3");
    }

    @Test
    void ofNullIsEmpty() {
        assertThat(Args.of(null).isEmpty()).isTrue();
    }

    // ── parse() ──

    @Test
    void parseDecodesPercentEscapesAndPlus() {
        Args args = Args.parse("name=hello+world&path=%2Ffoo%2Fbar&bar%5Bone%5D%5Btwo%5D=2");
        assertThat(args.first("name")).isEqualTo("hello world");
        assertThat(args.first("path")).isEqualTo("/foo/bar");
        assertThat(args.first("bar[one][two]")).isEqualTo("2");
    }

    @Test
    void parseKeepsRepeatedKeysInOrder() {
        Args args = Args.parse("?bool=true&int=456&bool=false&int=789");
        assertThat(args.keys()).containsExactly("bool", "int");
        assertThat(args.all("bool")).containsExactly("true", "false");
        assertThat(args.all("int")).containsExactly("456", "789");
    }

    @Test
    void parseSplitsAtFirstEquals() {
        assertThat(Args.parse("expr=a=b").first("expr")).isEqualTo("a=b");
    }

    @Test
    void parseTreatsBareKeyAsEmptyValueAndSkipsEmptyPairs() {
        Args args = Args.parse("flag&&x=1&");
        assertThat(args.keys()).containsExactly("flag", "x");
        assertThat(args.first("flag")).isEmpty();
    }

    @Test
    void parseRejectsMalformedEscape() {
        assertThatThrownBy(() -> Args.parse("a=%zz")).isInstanceOf(IllegalArgumentException.class);
    }

    // ── Views ──

    @Test
    void multiValueMapIsUnmodifiable() {
        Map<String, List<String>> map = Args.builder().add("a", "1").build().toMultiValueMap();
        assertThatThrownBy(() -> map.put("b", List.of("2"))).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> map.get("a").add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toStringHidesValues() {
        Args args = Args.builder().add("password", "hunter2").build();
        assertThat(args.toString()).contains("password").doesNotContain("hunter2");
    }

    @Test
    void equalArgsAreEqual() {
        assertThat(Args.parse("a=1&b=2")).isEqualTo(Args.builder().add("a", "1").add("b", "2").build());
        assertThat(Args.parse("a=1&b=2").hashCode())
                .isEqualTo(Args.builder().add("a", "1").add("b", "2").build().hashCode());
    }
}
