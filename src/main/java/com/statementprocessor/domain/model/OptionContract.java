package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Contract terms parsed from an option symbol such as {@code ASTS 07FEB25 26 C}.
 */
public record OptionContract(String underlying, LocalDate expiry, BigDecimal strike, OptionRight right) {}
