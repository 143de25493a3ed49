package com.statementprocessor.pipeline;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.StatementDocument;
import com.statementprocessor.domain.model.StatementField;
import com.statementprocessor.domain.model.StatementMetadata;
import com.statementprocessor.exception.ErrorCode;
import com.statementprocessor.exception.StatementFormatException;
import com.statementprocessor.parser.DateFieldParser;
import com.statementprocessor.parser.FieldParseException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Works out which account, period and base currency a statement belongs to.
 *
 * <p>Each value is taken from the first source that has it:
 * <ol>
 *   <li>metadata supplied with the document</li>
 *   <li>the statement's own Statement ("Period") and Account Information ("Account", "Base Currency")
 *       sections</li>
 *   <li>the trailing {@code MM/dd/yyyy} date of the delivery email subject</li>
 *   <li>an 8-digit {@code yyyyMMdd} token in the file name</li>
 *   <li>configured defaults (account and base currency only)</li>
 * </ol>
 * An account, as-of date or base currency that no source provides makes the statement unprocessable.
 */
@Component
public class StatementMetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(StatementMetadataResolver.class);

    private static final Pattern SUBJECT_DATE = Pattern.compile("(\\d{2}/\\d{2}/\\d{4})\\s*$");
    private static final Pattern FILENAME_TOKEN = Pattern.compile("[._\\-\\s]");
    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final StatementProcessingConfig config;

    public StatementMetadataResolver(StatementProcessingConfig config) {
        this.config = config;
    }

    public StatementMetadata resolve(StatementDocument document, List<StatementField> fields) {
        String accountId = firstNonBlank(
                document.getAccountId(), field(fields, SectionKind.ACCOUNT_INFO, "Account"), config.getDefaultAccountId());
        if (accountId == null) {
            throw new StatementFormatException(
                    ErrorCode.STATEMENT_METADATA_MISSING,
                    "Cannot determine the account of statement " + document.getDocumentId(),
                    Map.of("documentId", String.valueOf(document.getDocumentId())));
        }

        LocalDate[] period = parsePeriod(field(fields, SectionKind.STATEMENT_INFO, "Period"));
        LocalDate periodEnd = document.getPeriodEnd();
        if (periodEnd == null) {
            periodEnd = period != null ? period[1] : null;
        }
        if (periodEnd == null) {
            periodEnd = dateFromSubject(document.getSubject());
        }
        if (periodEnd == null) {
            periodEnd = dateFromFilename(document.getFilename());
        }
        if (periodEnd == null) {
            throw new StatementFormatException(
                    ErrorCode.STATEMENT_METADATA_MISSING,
                    "Cannot determine the as-of date of statement " + document.getDocumentId(),
                    Map.of("documentId", String.valueOf(document.getDocumentId())));
        }

        LocalDate periodStart = document.getPeriodStart();
        if (periodStart == null) {
            periodStart = period != null ? period[0] : periodEnd;
        }

        String baseCurrency = firstNonBlank(
                document.getBaseCurrency(),
                field(fields, SectionKind.ACCOUNT_INFO, "Base Currency"),
                config.getDefaultBaseCurrency());
        if (baseCurrency == null) {
            throw new StatementFormatException(
                    ErrorCode.STATEMENT_METADATA_MISSING,
                    "Cannot determine the base currency of statement " + document.getDocumentId(),
                    Map.of("documentId", String.valueOf(document.getDocumentId())));
        }

        StatementMetadata metadata = StatementMetadata.builder()
                .accountId(accountId)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .baseCurrency(baseCurrency.toUpperCase())
                .build();
        log.debug("Resolved metadata for {}: {}", document.getDocumentId(), metadata);
        return metadata;
    }

    /** "January 1, 2025 - January 30, 2025" or a single "January 30, 2025". Returns {start, end} or null. */
    static LocalDate[] parsePeriod(String period) {
        if (period == null) {
            return null;
        }
        String[] parts = period.split("\\s+-\\s+");
        try {
            LocalDate end = DateFieldParser.parseDate(parts[parts.length - 1], "Period");
            LocalDate start = parts.length > 1 ? DateFieldParser.parseDate(parts[0], "Period") : end;
            return end != null ? new LocalDate[] {start, end} : null;
        } catch (FieldParseException e) {
            log.warn("Ignoring unparseable statement period '{}'", period);
            return null;
        }
    }

    static LocalDate dateFromSubject(String subject) {
        if (subject == null) {
            return null;
        }
        Matcher matcher = SUBJECT_DATE.matcher(subject.trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return DateFieldParser.parseDate(matcher.group(1), "subject");
        } catch (FieldParseException e) {
            log.warn("Ignoring invalid date in subject '{}'", subject);
            return null;
        }
    }

    static LocalDate dateFromFilename(String filename) {
        if (filename == null) {
            return null;
        }
        String[] tokens = FILENAME_TOKEN.split(filename);
        for (int i = tokens.length - 1; i >= 0; i--) {
            String token = tokens[i];
            if (token.length() == 8 && token.chars().allMatch(Character::isDigit)) {
                try {
                    return LocalDate.parse(token, COMPACT_DATE);
                } catch (DateTimeParseException e) {
                    log.debug("Token '{}' of file name {} is not a date", token, filename);
                }
            }
        }
        return null;
    }

    private static String field(List<StatementField> fields, SectionKind kind, String name) {
        return fields.stream()
                .filter(f -> f.sectionKind() == kind && f.name().equalsIgnoreCase(name))
                .map(StatementField::value)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }
}
