package io.argbind.core.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldDescriptorTest {

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    @interface Query {
        String value();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    @interface Numbered {
        int value();
    }

    static class Sample {
        static final String CONSTANT = "c";

        @UrlParam("static")
        static String shared;

        @UrlParam("final")
        final String fixed = "f";

        @UrlParam("q")
        @Query("query")
        String query;

        @UrlParam("tags,omitempty")
        List<String> tags;

        @UrlParam("raw")
        List rawList;

        @UrlParam("wild")
        List<? extends Number> wildcard;

        @UrlParam("bytes")
        byte[] payload;

        @UrlParam("nested")
        List<byte[]> nested;

        @UrlParam("")
        String unnamed;

        @UrlParam(",omitempty")
        String onlyModifier;

        @UrlParam("n")
        @Unsigned
        Integer[] counts;
    }

    @Test
    void describesOnlyBindableFields() {
        List<FieldDescriptor> descriptors = FieldDescriptor.describe(Sample.class, UrlParam.class);

        assertThat(descriptors).extracting(FieldDescriptor::key).containsExactly("q", "tags", "bytes", "n");
    }

    @Test
    void resolvesShapesAndKinds() {
        List<FieldDescriptor> descriptors = FieldDescriptor.describe(Sample.class, UrlParam.class);

        assertThat(descriptors.get(0).shape()).isEqualTo(FieldDescriptor.Shape.SCALAR);
        assertThat(descriptors.get(0).kind()).isEqualTo(ValueKind.STRING);
        assertThat(descriptors.get(1).shape()).isEqualTo(FieldDescriptor.Shape.LIST);
        assertThat(descriptors.get(1).elementType()).isEqualTo(String.class);
        assertThat(descriptors.get(2).shape()).isEqualTo(FieldDescriptor.Shape.BYTES);
        assertThat(descriptors.get(3).shape()).isEqualTo(FieldDescriptor.Shape.ARRAY);
        assertThat(descriptors.get(3).kind()).isEqualTo(ValueKind.UNSIGNED_INT);
        assertThat(descriptors.get(3).elementType()).isEqualTo(Integer.class);
    }

    @Test
    void namespacesAreDescribedIndependently() {
        List<FieldDescriptor> descriptors = FieldDescriptor.describe(Sample.class, Query.class);

        assertThat(descriptors).singleElement().satisfies(d -> {
            assertThat(d.key()).isEqualTo("query");
            assertThat(d.field().getName()).isEqualTo("query");
        });
    }

    @Test
    void descriptorsAreCachedAndImmutable() {
        List<FieldDescriptor> first = FieldDescriptor.describe(Sample.class, UrlParam.class);

        assertThat(FieldDescriptor.describe(Sample.class, UrlParam.class)).isSameAs(first);
        assertThatThrownBy(() -> first.clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsNamespaceWithoutStringValue() {
        assertThatThrownBy(() -> FieldDescriptor.describe(Sample.class, Numbered.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("String value()");
        assertThatThrownBy(() -> FieldDescriptor.describe(Sample.class, Unsigned.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bindingKeyStripsModifiers() {
        assertThat(FieldDescriptor.bindingKey("name")).isEqualTo("name");
        assertThat(FieldDescriptor.bindingKey("name,omitempty")).isEqualTo("name");
        assertThat(FieldDescriptor.bindingKey("a,b,c")).isEqualTo("a");
        assertThat(FieldDescriptor.bindingKey("-")).isNull();
        assertThat(FieldDescriptor.bindingKey("")).isNull();
        assertThat(FieldDescriptor.bindingKey(",x")).isNull();
        assertThat(FieldDescriptor.bindingKey("-,x")).isEqualTo("-");
    }
}
