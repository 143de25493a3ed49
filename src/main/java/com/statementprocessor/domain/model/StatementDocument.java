package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.SectionKind;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * One raw statement as delivered by the retrieval workflow, plus whatever metadata came with it.
 *
 * <p>Immutable for the duration of a processing run. Metadata fields are optional: anything missing
 * is resolved from the statement's own Statement/Account Information sections, the email subject or
 * the file name (see {@code StatementMetadataResolver}).
 */
@Value
@Builder
public class StatementDocument {

    String documentId;
    String rawText;

    String accountId;
    LocalDate periodStart;
    LocalDate periodEnd;
    String baseCurrency;

    /** Subject line of the delivery email; its trailing MM/dd/yyyy date is the statement date. */
    String subject;

    String filename;
    LocalDateTime ingestedAt;

    /** Section kinds this statement claims to contain; absence of any is a structural failure. */
    @Builder.Default
    Set<SectionKind> requiredSections = Set.of();
}
