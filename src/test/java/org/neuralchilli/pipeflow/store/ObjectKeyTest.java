package org.neuralchilli.pipeflow.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ObjectKeyTest {

    @Test
    void shouldParseNamespacedKey() {
        ObjectKey key = ObjectKey.parse("team-a/nightly");

        assertThat(key.namespace()).isEqualTo("team-a");
        assertThat(key.name()).isEqualTo("nightly");
        assertThat(key.toString()).isEqualTo("team-a/nightly");
    }

    @Test
    void shouldParseClusterScopedKey() {
        ObjectKey key = ObjectKey.parse("shared-task");

        assertThat(key).isEqualTo(ObjectKey.of("", "shared-task"));
        assertThat(key.toString()).isEqualTo("shared-task");
    }

    @Test
    void shouldReturnNullForMalformedKeys() {
        assertThat(ObjectKey.parse(null)).isNull();
        assertThat(ObjectKey.parse("")).isNull();
        assertThat(ObjectKey.parse("a/b/c")).isNull();
        assertThat(ObjectKey.parse("/name")).isNull();
        assertThat(ObjectKey.parse("ns/")).isNull();
    }

    @Test
    void shouldTreatNullNamespaceAsClusterScoped() {
        assertThat(ObjectKey.of(null, "x")).isEqualTo(ObjectKey.of("", "x"));
        assertThat(ObjectKey.of(null, "x").hashCode()).isEqualTo(ObjectKey.of("", "x").hashCode());
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> ObjectKey.of("ns", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
