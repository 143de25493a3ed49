package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.SectionKind;

/**
 * Name/value row of the Statement or Account Information section (e.g. "Period", "Base Currency").
 */
public record StatementField(SectionKind sectionKind, String name, String value) {}
