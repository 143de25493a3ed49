package com.statementprocessor.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Effective metadata of a run after merging request fields, statement sections and naming conventions.
 * {@code periodEnd} is the snapshot as-of date.
 */
@Value
@Builder
public class StatementMetadata {

    String accountId;
    LocalDate periodStart;
    LocalDate periodEnd;
    String baseCurrency;
}
