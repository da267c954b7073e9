package com.fenci.application.segment;

import com.fenci.application.segment.exception.TextTooLongException;
import com.fenci.domain.segment.model.ChineseDictionary;
import com.fenci.domain.segment.model.KeywordScore;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleDescriptor;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentMode;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.domain.segment.model.SegmentOverrides;
import com.fenci.domain.segment.model.SingleRuleResult;
import com.fenci.domain.segment.repository.SettingsRepository;
import com.fenci.domain.segment.service.SegmentService;
import com.fenci.infrastructure.segmentation.chinese.ChineseSegmenter;
import com.fenci.infrastructure.segmentation.chinese.DictionaryDocument;
import com.fenci.infrastructure.segmentation.chinese.DictionaryStore;
import com.fenci.infrastructure.segmentation.rule.MultiRuleComposer;
import com.fenci.infrastructure.segmentation.rule.RuleCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentAppService {

    private final SegmentService segmentService;
    private final SettingsRepository settingsRepository;
    private final MultiRuleComposer multiRuleComposer;
    private final RuleCatalog ruleCatalog;
    private final ChineseSegmenter chineseSegmenter;
    private final DictionaryStore dictionaryStore;

    @Value("${segmenter.max-text-length:20000}")
    private int maxTextLength;

    /**
     * Segment with stored defaults merged with the per-call overrides.
     * Unknown mode identifiers fall back to smart mode.
     */
    public SegmentResult segment(String text, String modeId, SegmentOverrides overrides) {
        SegmentMode mode = resolveMode(modeId);
        if (text == null || text.isBlank()) {
            return new SegmentResult(mode, List.of());
        }
        checkLength(text);

        SegmentOptions options = settingsRepository.loadDefaults().mergeFrom(overrides);
        return new SegmentResult(mode, segmentService.segment(text, mode, options));
    }

    public MultiRuleResult composeRules(String text, Collection<String> ruleIds, SegmentOverrides overrides) {
        if (text == null || text.isBlank()) {
            return MultiRuleResult.empty();
        }
        checkLength(text);

        SegmentOptions options = settingsRepository.loadDefaults().mergeFrom(overrides);
        return segmentService.composeRules(text, resolveRules(ruleIds), options);
    }

    public SingleRuleResult applySingleRule(List<String> tokens, String ruleId, SegmentOverrides overrides) {
        RuleId rule = RuleId.fromId(ruleId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule: " + ruleId));
        if (tokens != null) {
            checkLength(String.join("", tokens));
        }

        SegmentOptions options = settingsRepository.loadDefaults().mergeFrom(overrides);
        return multiRuleComposer.applySingleRule(tokens, rule, options);
    }

    public List<SegmentMode> modes() {
        return List.of(SegmentMode.values());
    }

    public List<RuleDescriptor> rules() {
        return ruleCatalog.all();
    }

    public List<KeywordScore> extractKeywords(String text, int topK) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        checkLength(text);
        return chineseSegmenter.extractKeywords(text, topK);
    }

    public boolean containsDictionaryWord(String text) {
        return chineseSegmenter.containsDictionaryWord(text);
    }

    public ChineseDictionary replaceDictionary(DictionaryDocument document) {
        return dictionaryStore.replace(document);
    }

    public DictionaryStore.WordUpdate addWords(List<String> words) {
        return dictionaryStore.addWords(words == null ? List.of() : words);
    }

    public ChineseDictionary currentDictionary() {
        return dictionaryStore.snapshot();
    }

    private SegmentMode resolveMode(String modeId) {
        if (modeId != null && !modeId.isBlank() && !SegmentMode.isKnown(modeId)) {
            log.warn("[SegmentAppService] Unknown mode '{}', falling back to smart", modeId);
        }
        return SegmentMode.fromId(modeId);
    }

    /**
     * Map rule identifiers to rules; unknown identifiers are logged and skipped.
     */
    public Set<RuleId> resolveRules(Collection<String> ruleIds) {
        Set<RuleId> rules = EnumSet.noneOf(RuleId.class);
        if (ruleIds == null) {
            return rules;
        }
        for (String id : ruleIds) {
            RuleId.fromId(id).ifPresentOrElse(rules::add,
                    () -> log.warn("[SegmentAppService] Unknown rule '{}' ignored", id));
        }
        return rules;
    }

    private void checkLength(String text) {
        if (text.length() > maxTextLength) {
            throw new TextTooLongException(text.length(), maxTextLength);
        }
    }
}
