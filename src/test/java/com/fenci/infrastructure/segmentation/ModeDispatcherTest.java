package com.fenci.infrastructure.segmentation;

import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentMode;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.infrastructure.ai.AiSegmentException;
import com.fenci.infrastructure.ai.AiSegmentPipeline;
import com.fenci.infrastructure.segmentation.chinese.ChineseAnalyzer;
import com.fenci.infrastructure.segmentation.code.CodeAnalyzer;
import com.fenci.infrastructure.segmentation.random.ChaosTokenizer;
import com.fenci.infrastructure.segmentation.rule.MultiRuleComposer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModeDispatcherTest {

    @Mock private SmartSegmenter smartSegmenter;
    @Mock private ChineseAnalyzer chineseAnalyzer;
    @Mock private EnglishSegmenter englishSegmenter;
    @Mock private CodeAnalyzer codeAnalyzer;
    @Mock private SentenceSegmenter sentenceSegmenter;
    @Mock private CharBreakSegmenter charBreakSegmenter;
    @Mock private SymbolStripSegmenter symbolStripSegmenter;
    @Mock private ChaosTokenizer chaosTokenizer;
    @Mock private MultiRuleComposer multiRuleComposer;
    @Mock private AiSegmentPipeline aiSegmentPipeline;

    @InjectMocks
    private ModeDispatcher dispatcher;

    // ── Routing ──

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        void blank_text_skips_every_strategy() {
            assertThat(dispatcher.segment("  ", SegmentMode.CHINESE, SegmentOptions.defaults())).isEmpty();
            verifyNoInteractions(chineseAnalyzer, smartSegmenter);
        }

        @Test
        void null_mode_is_smart() {
            when(smartSegmenter.segment("abc")).thenReturn(List.of("abc"));

            assertThat(dispatcher.segment("abc", null, null)).containsExactly("abc");
        }

        @Test
        void char_break_uses_line_limit() {
            SegmentOptions options = SegmentOptions.builder().lineCharLimit(7).build();
            when(charBreakSegmenter.segment("abcdefghij", 7)).thenReturn(List.of("abcdefg", "hij"));

            assertThat(dispatcher.segment("abcdefghij", SegmentMode.CHAR_BREAK, options))
                    .containsExactly("abcdefg", "hij");
        }

        @Test
        void random_uses_chaos_parameters() {
            SegmentOptions options = SegmentOptions.builder()
                    .randomMinLength(2).randomMaxLength(4).chaosMinTokens(5).build();
            when(chaosTokenizer.tokenize("abcdefghij", 2, 4, 5)).thenReturn(List.of("ab", "cd"));

            assertThat(dispatcher.segment("abcdefghij", SegmentMode.RANDOM, options)).hasSize(2);
        }

        @Test
        void multi_uses_rules_from_options() {
            SegmentOptions options = SegmentOptions.builder().rules(Set.of(RuleId.DIGIT_SPLIT)).build();
            when(multiRuleComposer.compose("a1", Set.of(RuleId.DIGIT_SPLIT), options))
                    .thenReturn(new MultiRuleResult(List.of("a", "1"), List.of(RuleId.DIGIT_SPLIT), List.of(),
                            MultiRuleResult.Stats.of(2, 2)));

            assertThat(dispatcher.segment("a1", SegmentMode.MULTI, options)).containsExactly("a", "1");
        }
    }

    // ── AI fallback ──

    @Nested
    @DisplayName("AI fallback")
    class AiFallback {

        @Test
        void unavailable_ai_uses_smart() {
            when(aiSegmentPipeline.isAvailable()).thenReturn(false);
            when(smartSegmenter.segment("hi")).thenReturn(List.of("hi"));

            assertThat(dispatcher.segment("hi", SegmentMode.AI, SegmentOptions.defaults())).containsExactly("hi");
        }

        @Test
        @DisplayName("A failed AI call is never surfaced")
        void failure_falls_back_to_smart() {
            when(aiSegmentPipeline.isAvailable()).thenReturn(true);
            when(aiSegmentPipeline.segment("hi")).thenThrow(new AiSegmentException("timeout"));
            when(smartSegmenter.segment("hi")).thenReturn(List.of("hi"));

            assertThat(dispatcher.segment("hi", SegmentMode.AI, SegmentOptions.defaults())).containsExactly("hi");
        }

        @Test
        void success_returns_ai_tokens() {
            when(aiSegmentPipeline.isAvailable()).thenReturn(true);
            when(aiSegmentPipeline.segment("hi there")).thenReturn(List.of("hi", "there"));

            assertThat(dispatcher.segment("hi there", SegmentMode.AI, SegmentOptions.defaults()))
                    .containsExactly("hi", "there");
            verifyNoInteractions(smartSegmenter);
        }
    }

    @Test
    void compose_rules_defaults_null_options() {
        when(multiRuleComposer.compose(eq("x"), eq(Set.of()), any(SegmentOptions.class)))
                .thenReturn(MultiRuleResult.empty());

        dispatcher.composeRules("x", Set.of(), null);

        verify(multiRuleComposer).compose("x", Set.of(), SegmentOptions.defaults());
    }
}
