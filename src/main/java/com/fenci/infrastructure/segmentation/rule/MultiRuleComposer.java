package com.fenci.infrastructure.segmentation.rule;

import com.fenci.domain.segment.model.ConflictRecord;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleDescriptor;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.domain.segment.model.SingleRuleResult;
import com.fenci.infrastructure.segmentation.CharClasses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Composes a user-selected set of rules.
 *
 * Flow:
 *   1. Conflicts: a rule that declares a conflict wins, the rules it names are dropped
 *   2. Dependencies: force-include declared dependencies, transitively
 *   3. Order: split group before remove group, each by ascending priority
 *   4. Fold the rules over {@code [text]}, dropping empty strings after every step
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiRuleComposer {

    static final String SYMBOLS_ALREADY_REMOVED = "Symbols already removed, symbol split has no effect";

    private final RuleCatalog ruleCatalog;
    private final TokenRules tokenRules;

    public MultiRuleResult compose(String text, Collection<RuleId> selectedRules, SegmentOptions options) {
        if (CharClasses.isBlank(text)) {
            return MultiRuleResult.empty();
        }

        Set<RuleId> selected = selectedRules == null || selectedRules.isEmpty()
                ? EnumSet.noneOf(RuleId.class)
                : EnumSet.copyOf(selectedRules);

        List<ConflictRecord> conflicts = resolveConflicts(selected);
        Set<RuleId> resolved = resolveDependencies(selected);
        List<RuleId> ordered = resolved.stream()
                .map(ruleCatalog::get)
                .sorted(ruleCatalog.executionOrder())
                .map(RuleDescriptor::id)
                .toList();

        List<String> tokens = List.of(text);
        for (RuleId rule : ordered) {
            tokens = tokenRules.apply(rule, tokens, options);
        }

        log.debug("[MultiRuleComposer] rules={}, conflicts={}, tokens={}", ordered, conflicts.size(), tokens.size());
        return new MultiRuleResult(tokens, ordered, conflicts, MultiRuleResult.Stats.of(text.length(), tokens.size()));
    }

    /**
     * Apply exactly one rule to an existing token list. A detected conflict is reported but the
     * rule is applied regardless.
     */
    public SingleRuleResult applySingleRule(List<String> tokens, RuleId rule, SegmentOptions options) {
        if (tokens == null || tokens.isEmpty()) {
            return new SingleRuleResult(List.of(), false, null);
        }

        boolean hasConflict = false;
        String conflictMessage = null;
        if (rule == RuleId.SYMBOL_SPLIT
                && tokens.stream().filter(t -> t != null).noneMatch(TokenRules::containsSymbol)) {
            hasConflict = true;
            conflictMessage = SYMBOLS_ALREADY_REMOVED;
            log.warn("[MultiRuleComposer] {}", conflictMessage);
        }

        return new SingleRuleResult(tokenRules.apply(rule, tokens, options), hasConflict, conflictMessage);
    }

    private List<ConflictRecord> resolveConflicts(Set<RuleId> selected) {
        List<ConflictRecord> conflicts = new ArrayList<>();
        for (RuleDescriptor descriptor : ruleCatalog.all()) {
            if (!selected.contains(descriptor.id())) {
                continue;
            }
            for (RuleId loser : descriptor.conflictsWith()) {
                if (selected.remove(loser)) {
                    String reason = String.format("%s conflicts with %s, %s skipped",
                            descriptor.id().id(), loser.id(), loser.id());
                    conflicts.add(ConflictRecord.skipped(loser, reason));
                    log.warn("[MultiRuleComposer] {}", reason);
                }
            }
        }
        return conflicts;
    }

    private Set<RuleId> resolveDependencies(Set<RuleId> selected) {
        Set<RuleId> resolved = EnumSet.noneOf(RuleId.class);
        for (RuleId rule : selected) {
            visit(rule, resolved, EnumSet.noneOf(RuleId.class), new ArrayList<>());
        }
        return resolved;
    }

    private void visit(RuleId rule, Set<RuleId> resolved, Set<RuleId> inProgress, List<RuleId> path) {
        if (resolved.contains(rule)) {
            return;
        }
        path.add(rule);
        if (!inProgress.add(rule)) {
            throw new RuleConfigurationException("Rule dependency cycle: "
                    + String.join(" -> ", path.stream().map(RuleId::id).toList()));
        }
        for (RuleId dependency : ruleCatalog.get(rule).dependsOn()) {
            visit(dependency, resolved, inProgress, path);
        }
        inProgress.remove(rule);
        path.remove(path.size() - 1);
        resolved.add(rule);
    }
}
