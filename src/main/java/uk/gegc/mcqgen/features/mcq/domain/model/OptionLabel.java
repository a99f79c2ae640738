package uk.gegc.mcqgen.features.mcq.domain.model;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The four labels a well-formed question uses for its options.
 */
public enum OptionLabel {
    A, B, C, D;

    public static Set<String> expectedLabels() {
        return EnumSet.allOf(OptionLabel.class).stream()
                .map(Enum::name)
                .collect(Collectors.toUnmodifiableSet());
    }
}
