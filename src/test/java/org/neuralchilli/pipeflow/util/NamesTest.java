package org.neuralchilli.pipeflow.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NamesTest {

    @Test
    void shouldAppendFiveCharacterSuffix() {
        String name = Names.withRandomSuffix("nightly-build");

        assertThat(name).matches("nightly-build-[a-z0-9]{5}");
    }

    @Test
    void shouldTruncateLongBasesToFitALabel() {
        String base = "a".repeat(40) + "-" + "b".repeat(40);

        String name = Names.withRandomSuffix(base);

        assertThat(name).hasSize(Names.MAX_LENGTH);
        assertThat(Names.isDnsLabel(name)).isTrue();
    }

    @Test
    void shouldNotLeaveDoubleDashWhenTruncatingAtADash() {
        String base = "a".repeat(56) + "-tail";

        String name = Names.withRandomSuffix(base);

        assertThat(name).doesNotContain("--");
        assertThat(Names.isDnsLabel(name)).isTrue();
    }

    @Test
    void shouldValidateDnsLabels() {
        assertThat(Names.isDnsLabel("build-1")).isTrue();
        assertThat(Names.isDnsLabel("Build")).isFalse();
        assertThat(Names.isDnsLabel("-build")).isFalse();
        assertThat(Names.isDnsLabel("build_1")).isFalse();
        assertThat(Names.isDnsLabel("x".repeat(64))).isFalse();
        assertThat(Names.isDnsLabel(null)).isFalse();
    }
}
