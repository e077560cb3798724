package com.paycollect.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.paycollect.domain.service.PaymentService;
import jakarta.validation.GroupSequence;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of {@code POST /payments}.
 *
 * Presence is checked before range, so a request missing a field always gets
 * the "required" message. A zero amount passes here and is reported as missing
 * by {@link PaymentService}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@GroupSequence({PaymentRequestDto.Presence.class, PaymentRequestDto.Range.class, PaymentRequestDto.class})
public class PaymentRequestDto {

    @NotBlank(groups = Presence.class, message = PaymentService.REQUIRED_MESSAGE)
    private String accountNumber;

    @NotNull(groups = Presence.class, message = PaymentService.REQUIRED_MESSAGE)
    @DecimalMin(value = "0", groups = Range.class, message = PaymentService.NOT_POSITIVE_MESSAGE)
    @DecimalMax(value = "99999999.99", groups = Range.class, message = PaymentService.TOO_LARGE_MESSAGE)
    private BigDecimal paymentAmount;

    interface Presence {
    }

    interface Range {
    }
}
