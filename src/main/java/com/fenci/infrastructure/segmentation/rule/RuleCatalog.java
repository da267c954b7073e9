package com.fenci.infrastructure.segmentation.rule;

import com.fenci.domain.segment.model.RuleDescriptor;
import com.fenci.domain.segment.model.RuleGroup;
import com.fenci.domain.segment.model.RuleId;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static rule metadata keyed by {@link RuleId}.
 */
public class RuleCatalog {

    private static final List<RuleDescriptor> STANDARD = List.of(
            new RuleDescriptor(RuleId.SYMBOL_SPLIT, RuleGroup.SPLIT, 1, Set.of(), Set.of(),
                    "Symbol split", "Opening symbols stand alone, other symbols stay on the end of the previous word"),
            new RuleDescriptor(RuleId.WHITESPACE_SPLIT, RuleGroup.SPLIT, 2, Set.of(), Set.of(),
                    "Whitespace split", "Split on whitespace runs, keeping them as separate elements"),
            new RuleDescriptor(RuleId.NEWLINE_SPLIT, RuleGroup.SPLIT, 3, Set.of(), Set.of(),
                    "Newline split", "Split on line breaks, keeping them as separate elements"),
            new RuleDescriptor(RuleId.CHINESE_ENGLISH_SPLIT, RuleGroup.SPLIT, 4, Set.of(), Set.of(),
                    "Chinese/English split", "Separate runs of Chinese ideographs from runs of ASCII letters"),
            new RuleDescriptor(RuleId.UPPERCASE_SPLIT, RuleGroup.SPLIT, 5, Set.of(), Set.of(),
                    "Uppercase split", "Split before every uppercase letter"),
            new RuleDescriptor(RuleId.NAMING_SPLIT, RuleGroup.SPLIT, 6, Set.of(RuleId.UPPERCASE_SPLIT), Set.of(),
                    "Naming split", "Split camelCase, snake_case and kebab-case identifiers"),
            new RuleDescriptor(RuleId.DIGIT_SPLIT, RuleGroup.SPLIT, 7, Set.of(), Set.of(),
                    "Digit split", "Digit runs become their own tokens"),
            new RuleDescriptor(RuleId.REMOVE_WHITESPACE, RuleGroup.REMOVE, 8, Set.of(), Set.of(),
                    "Remove whitespace", "Delete all whitespace"),
            new RuleDescriptor(RuleId.REMOVE_SYMBOLS, RuleGroup.REMOVE, 9, Set.of(), Set.of(RuleId.SYMBOL_SPLIT),
                    "Remove symbols", "Delete all symbols"),
            new RuleDescriptor(RuleId.REMOVE_CHINESE, RuleGroup.REMOVE, 10, Set.of(), Set.of(),
                    "Remove Chinese", "Delete all Chinese ideographs"),
            new RuleDescriptor(RuleId.REMOVE_ENGLISH, RuleGroup.REMOVE, 11, Set.of(), Set.of(),
                    "Remove English", "Delete all ASCII letters"),
            new RuleDescriptor(RuleId.REMOVE_DIGITS, RuleGroup.REMOVE, 12, Set.of(), Set.of(),
                    "Remove digits", "Delete all decimal digits")
    );

    private final Map<RuleId, RuleDescriptor> descriptors = new EnumMap<>(RuleId.class);

    public RuleCatalog(Collection<RuleDescriptor> descriptors) {
        for (RuleDescriptor descriptor : descriptors) {
            this.descriptors.put(descriptor.id(), descriptor);
        }
        for (RuleId id : RuleId.values()) {
            if (!this.descriptors.containsKey(id)) {
                throw new RuleConfigurationException("Rule catalogue is missing a descriptor for " + id.id());
            }
        }
    }

    public static RuleCatalog standard() {
        return new RuleCatalog(STANDARD);
    }

    public RuleDescriptor get(RuleId id) {
        return descriptors.get(id);
    }

    /**
     * All descriptors, split group first, each group by ascending priority.
     */
    public List<RuleDescriptor> all() {
        return descriptors.values().stream()
                .sorted(executionOrder())
                .toList();
    }

    public Comparator<RuleDescriptor> executionOrder() {
        return Comparator.comparing(RuleDescriptor::group)
                .thenComparingInt(RuleDescriptor::priority);
    }
}
