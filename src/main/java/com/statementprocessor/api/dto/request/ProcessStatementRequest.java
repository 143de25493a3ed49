package com.statementprocessor.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.statementprocessor.domain.enums.SectionKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting one raw activity statement.
 *
 * <p>Only {@code csvContent} is mandatory. The snake_case names used by the mail-retrieval workflow
 * ({@code csv_content}, {@code account_id}, ...) are accepted as aliases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessStatementRequest {

    @NotBlank(message = "csvContent is required")
    @JsonAlias("csv_content")
    private String csvContent;

    /** Delivery email subject; its trailing MM/dd/yyyy date is used when the statement has no period. */
    private String subject;

    private String filename;

    @JsonAlias("account_id")
    private String accountId;

    @JsonAlias("period_start")
    private LocalDate periodStart;

    @JsonAlias("period_end")
    private LocalDate periodEnd;

    @JsonAlias("base_currency")
    @Pattern(regexp = "[A-Za-z]{3}", message = "baseCurrency must be a 3-letter currency code")
    private String baseCurrency;

    @JsonAlias("required_sections")
    private Set<SectionKind> requiredSections;
}
