package com.statementprocessor.tokenizer;

import com.statementprocessor.domain.enums.SectionKind;
import java.util.function.Predicate;

/**
 * One header-matching rule: a header line whose section name satisfies {@code predicate} starts a
 * section of {@code kind}. Rules are evaluated in list order and the first match wins.
 */
public record SectionRule(String name, SectionKind kind, Predicate<String> predicate) {

    public boolean matches(String sectionName) {
        return sectionName != null && predicate.test(sectionName.trim());
    }

    public static SectionRule exact(String name, SectionKind kind, String sectionName) {
        return new SectionRule(name, kind, candidate -> candidate.equalsIgnoreCase(sectionName));
    }

    public static SectionRule prefix(String name, SectionKind kind, String prefix) {
        String lowered = prefix.toLowerCase();
        return new SectionRule(name, kind, candidate -> candidate.toLowerCase().startsWith(lowered));
    }
}
