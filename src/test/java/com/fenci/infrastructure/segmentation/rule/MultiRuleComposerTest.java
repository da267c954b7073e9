package com.fenci.infrastructure.segmentation.rule;

import com.fenci.domain.segment.model.ConflictRecord;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleDescriptor;
import com.fenci.domain.segment.model.RuleGroup;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.domain.segment.model.SingleRuleResult;
import com.fenci.infrastructure.segmentation.NamingSplitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiRuleComposerTest {

    private final SegmentOptions options = SegmentOptions.defaults();
    private TokenRules tokenRules;
    private MultiRuleComposer composer;

    @BeforeEach
    void setUp() {
        tokenRules = new TokenRules(new NamingSplitter());
        composer = new MultiRuleComposer(RuleCatalog.standard(), tokenRules);
    }

    // ── Composition ──

    @Nested
    @DisplayName("Composition")
    class Composition {

        @Test
        @DisplayName("No rules leaves the text as a single token")
        void no_rules() {
            MultiRuleResult result = composer.compose("hello world", Set.of(), options);

            assertThat(result.tokens()).containsExactly("hello world");
            assertThat(result.appliedRules()).isEmpty();
        }

        @Test
        void blank_text() {
            assertThat(composer.compose("  ", Set.of(RuleId.WHITESPACE_SPLIT), options).tokens()).isEmpty();
        }

        @Test
        @DisplayName("Split rules run before remove rules")
        void execution_order() {
            MultiRuleResult result = composer.compose("a1 b2",
                    Set.of(RuleId.REMOVE_DIGITS, RuleId.WHITESPACE_SPLIT), options);

            assertThat(result.appliedRules()).containsExactly(RuleId.WHITESPACE_SPLIT, RuleId.REMOVE_DIGITS);
            assertThat(result.tokens()).containsExactly("a", " ", "b");
        }

        @Test
        void stats() {
            MultiRuleResult result = composer.compose("hello world", Set.of(RuleId.WHITESPACE_SPLIT), options);

            assertThat(result.stats().inputLength()).isEqualTo(11);
            assertThat(result.stats().outputCount()).isEqualTo(3);
            assertThat(result.stats().avgLength()).isEqualTo(4);
        }

        @Test
        void same_input_same_output() {
            Set<RuleId> rules = Set.of(RuleId.SYMBOL_SPLIT, RuleId.NAMING_SPLIT, RuleId.DIGIT_SPLIT);
            String text = "getUser(id42), setName";

            assertThat(composer.compose(text, rules, options))
                    .isEqualTo(composer.compose(text, rules, options));
        }
    }

    // ── Conflicts and dependencies ──

    @Nested
    @DisplayName("Conflicts and dependencies")
    class ConflictsAndDependencies {

        @Test
        @DisplayName("removeSymbols wins over symbolSplit")
        void conflict_recorded() {
            MultiRuleResult result = composer.compose("a,b",
                    Set.of(RuleId.SYMBOL_SPLIT, RuleId.REMOVE_SYMBOLS), options);

            assertThat(result.appliedRules()).containsExactly(RuleId.REMOVE_SYMBOLS);
            assertThat(result.tokens()).containsExactly("ab");
            assertThat(result.conflicts()).containsExactly(ConflictRecord.skipped(RuleId.SYMBOL_SPLIT,
                    "removeSymbols conflicts with symbolSplit, symbolSplit skipped"));
        }

        @Test
        @DisplayName("namingSplit pulls in uppercaseSplit")
        void dependency_included() {
            MultiRuleResult result = composer.compose("myVarName", Set.of(RuleId.NAMING_SPLIT), options);

            assertThat(result.appliedRules()).containsExactly(RuleId.UPPERCASE_SPLIT, RuleId.NAMING_SPLIT);
            assertThat(result.tokens()).containsExactly("my", "Var", "Name");
        }

        @Test
        void dependency_cycle_rejected() {
            List<RuleDescriptor> descriptors = new ArrayList<>();
            for (RuleDescriptor d : RuleCatalog.standard().all()) {
                if (d.id() == RuleId.UPPERCASE_SPLIT) {
                    descriptors.add(new RuleDescriptor(d.id(), RuleGroup.SPLIT, d.priority(),
                            Set.of(RuleId.NAMING_SPLIT), Set.of(), d.displayName(), d.description()));
                } else {
                    descriptors.add(d);
                }
            }
            MultiRuleComposer cyclic = new MultiRuleComposer(new RuleCatalog(descriptors), tokenRules);

            assertThatThrownBy(() -> cyclic.compose("x", Set.of(RuleId.NAMING_SPLIT), options))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessage("Rule dependency cycle: namingSplit -> uppercaseSplit -> namingSplit");
        }

        @Test
        void incomplete_catalog_rejected() {
            assertThatThrownBy(() -> new RuleCatalog(List.of()))
                    .isInstanceOf(RuleConfigurationException.class);
        }
    }

    // ── Single rule ──

    @Nested
    @DisplayName("Single rule")
    class SingleRule {

        @Test
        @DisplayName("Symbol split on symbol-free tokens reports a conflict but still runs")
        void symbol_split_after_removal() {
            SingleRuleResult result = composer.applySingleRule(List.of("ab", "cd"), RuleId.SYMBOL_SPLIT, options);

            assertThat(result.hasConflict()).isTrue();
            assertThat(result.conflictMessage()).isEqualTo(MultiRuleComposer.SYMBOLS_ALREADY_REMOVED);
            assertThat(result.tokens()).containsExactly("ab", "cd");
        }

        @Test
        void symbol_split_with_symbols() {
            SingleRuleResult result = composer.applySingleRule(List.of("f(x)"), RuleId.SYMBOL_SPLIT, options);

            assertThat(result.hasConflict()).isFalse();
            assertThat(result.tokens()).containsExactly("f", "(", "x)");
        }

        @Test
        void empty_tokens() {
            SingleRuleResult result = composer.applySingleRule(List.of(), RuleId.DIGIT_SPLIT, options);

            assertThat(result.tokens()).isEmpty();
            assertThat(result.hasConflict()).isFalse();
        }
    }

    // ── Properties ──

    @Nested
    @DisplayName("Properties")
    class Properties {

        private static final String[] PIECES = {
                "getUser", "set_name", "HTTPServer", "中文", "42", "(x)", "[a]", ", ", "!", "\"q\"",
                "-", " ", "\n", "值"};

        @Test
        @DisplayName("Removing symbols from a result that already removed them changes nothing")
        void remove_symbols_idempotent() {
            List<RuleId> all = List.of(RuleId.values());
            Random random = new Random(99L);
            for (int round = 0; round < 300; round++) {
                StringBuilder text = new StringBuilder();
                int pieces = 1 + random.nextInt(8);
                for (int i = 0; i < pieces; i++) {
                    text.append(PIECES[random.nextInt(PIECES.length)]);
                }
                Set<RuleId> rules = EnumSet.of(RuleId.REMOVE_SYMBOLS);
                for (RuleId rule : all) {
                    if (random.nextInt(3) == 0) {
                        rules.add(rule);
                    }
                }

                List<String> once = composer.compose(text.toString(), rules, options).tokens();
                List<String> twice = composer.applySingleRule(once, RuleId.REMOVE_SYMBOLS, options).tokens();

                assertThat(twice).as("input %s with %s", text, rules).isEqualTo(once);
            }
        }
    }
}
