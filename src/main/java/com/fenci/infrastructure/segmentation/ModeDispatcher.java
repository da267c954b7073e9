package com.fenci.infrastructure.segmentation;

import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentMode;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.domain.segment.service.SegmentService;
import com.fenci.infrastructure.ai.AiSegmentException;
import com.fenci.infrastructure.ai.AiSegmentPipeline;
import com.fenci.infrastructure.segmentation.chinese.ChineseAnalyzer;
import com.fenci.infrastructure.segmentation.code.CodeAnalyzer;
import com.fenci.infrastructure.segmentation.random.ChaosTokenizer;
import com.fenci.infrastructure.segmentation.rule.MultiRuleComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Routes a segmentation request to the strategy for its mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModeDispatcher implements SegmentService {

    private final SmartSegmenter smartSegmenter;
    private final ChineseAnalyzer chineseAnalyzer;
    private final EnglishSegmenter englishSegmenter;
    private final CodeAnalyzer codeAnalyzer;
    private final SentenceSegmenter sentenceSegmenter;
    private final CharBreakSegmenter charBreakSegmenter;
    private final SymbolStripSegmenter symbolStripSegmenter;
    private final ChaosTokenizer chaosTokenizer;
    private final MultiRuleComposer multiRuleComposer;
    private final AiSegmentPipeline aiSegmentPipeline;

    @Override
    public List<String> segment(String text, SegmentMode mode, SegmentOptions options) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }
        SegmentMode resolved = mode == null ? SegmentMode.SMART : mode;
        SegmentOptions opts = options == null ? SegmentOptions.defaults() : options;

        List<String> tokens = switch (resolved) {
            case SMART -> smartSegmenter.segment(text);
            case CHINESE -> chineseAnalyzer.segment(text, opts);
            case ENGLISH -> englishSegmenter.segment(text);
            case CODE -> codeAnalyzer.analyze(text);
            case AI -> segmentWithAi(text);
            case SENTENCE -> sentenceSegmenter.sentences(text);
            case HALF_SENTENCE -> sentenceSegmenter.halfSentences(text);
            case CHAR_BREAK -> charBreakSegmenter.segment(text, opts.getLineCharLimit());
            case REMOVE_SYMBOLS -> symbolStripSegmenter.segment(text);
            case RANDOM -> chaosTokenizer.tokenize(text,
                    opts.getRandomMinLength(), opts.getRandomMaxLength(), opts.getChaosMinTokens());
            case MULTI -> multiRuleComposer.compose(text, opts.getRules(), opts).tokens();
        };

        log.debug("[ModeDispatcher] mode={}, inputLength={}, tokens={}", resolved.id(), text.length(), tokens.size());
        return tokens;
    }

    @Override
    public MultiRuleResult composeRules(String text, Set<RuleId> rules, SegmentOptions options) {
        return multiRuleComposer.compose(text, rules, options == null ? SegmentOptions.defaults() : options);
    }

    private List<String> segmentWithAi(String text) {
        if (!aiSegmentPipeline.isAvailable()) {
            log.debug("[ModeDispatcher] AI disabled or not configured, using smart mode");
            return smartSegmenter.segment(text);
        }
        try {
            return aiSegmentPipeline.segment(text);
        } catch (AiSegmentException e) {
            log.warn("[ModeDispatcher] AI segmentation failed, falling back to smart mode: {}", e.getMessage());
            return smartSegmenter.segment(text);
        }
    }
}
