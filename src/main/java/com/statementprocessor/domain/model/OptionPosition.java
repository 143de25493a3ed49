package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Option holding with its parsed contract terms. Side (long/short) follows the signed quantity.
 */
@Getter
@SuperBuilder(toBuilder = true)
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class OptionPosition extends PositionRecord {

    private final String underlying;
    private final BigDecimal strike;
    private final LocalDate expiry;
    private final OptionRight right;
}
