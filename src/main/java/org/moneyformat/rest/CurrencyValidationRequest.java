package org.moneyformat.rest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import org.moneyformat.domain.CurrencyFormat;
import org.moneyformat.domain.FormatOverrides;

/**
 * @param text the candidate amount
 * @param format preset to validate against; the configured default when absent
 * @param overrides individual options replacing those of the preset
 */
@Builder
public record CurrencyValidationRequest(
    @NotNull(message = "text is required") String text,
    CurrencyFormat format,
    @Valid FormatOverrides overrides) {}
