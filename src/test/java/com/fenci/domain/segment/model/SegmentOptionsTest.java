package com.fenci.domain.segment.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentOptionsTest {

    @Test
    void defaults() {
        SegmentOptions options = SegmentOptions.defaults();

        assertThat(options.isUseDictionary()).isTrue();
        assertThat(options.isUseAlgorithm()).isTrue();
        assertThat(options.getRandomMinLength()).isEqualTo(1);
        assertThat(options.getRandomMaxLength()).isEqualTo(10);
        assertThat(options.getChaosMinTokens()).isEqualTo(3);
        assertThat(options.isNamingRemoveSymbols()).isTrue();
        assertThat(options.getLineCharLimit()).isEqualTo(100);
        assertThat(options.getRules()).isEmpty();
    }

    // ── Merge ──

    @Nested
    @DisplayName("Merge")
    class Merge {

        @Test
        @DisplayName("Non-null overrides win, null fields keep the stored value")
        void partial_override() {
            SegmentOverrides overrides = new SegmentOverrides(false, null, null, 20, null, null, 40,
                    Set.of(RuleId.DIGIT_SPLIT));

            SegmentOptions merged = SegmentOptions.defaults().mergeFrom(overrides);

            assertThat(merged.isUseDictionary()).isFalse();
            assertThat(merged.isUseAlgorithm()).isTrue();
            assertThat(merged.getRandomMaxLength()).isEqualTo(20);
            assertThat(merged.getLineCharLimit()).isEqualTo(40);
            assertThat(merged.getRules()).containsExactly(RuleId.DIGIT_SPLIT);
        }

        @Test
        void no_overrides() {
            SegmentOptions defaults = SegmentOptions.defaults();

            assertThat(defaults.mergeFrom(SegmentOverrides.none())).isEqualTo(defaults);
            assertThat(defaults.mergeFrom(null)).isSameAs(defaults);
        }

        @Test
        void merged_result_is_validated() {
            SegmentOverrides overrides = new SegmentOverrides(null, null, 5, 2, null, null, null, null);

            assertThatThrownBy(() -> SegmentOptions.defaults().mergeFrom(overrides))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ── Validation ──

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void min_length_below_one() {
            assertThatThrownBy(() -> SegmentOptions.builder().randomMinLength(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void chaos_tokens_below_one() {
            assertThatThrownBy(() -> SegmentOptions.builder().chaosMinTokens(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void line_limit_below_one() {
            assertThatThrownBy(() -> SegmentOptions.builder().lineCharLimit(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
