package org.moneyformat.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.moneyformat.domain.CurrencyFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the validation API, bound from {@code moneyformat.validation.*}.
 *
 * @param defaultFormat format used when a request names none
 * @param cacheGrammars reuse built grammars across requests with identical options
 * @param maxTextLength longest text accepted by the API
 */
@Validated
@ConfigurationProperties(prefix = "moneyformat.validation")
public record CurrencyValidationProperties(
    @NotNull @DefaultValue("US_DOLLAR") CurrencyFormat defaultFormat,
    @DefaultValue("true") boolean cacheGrammars,
    @Min(1) @DefaultValue("256") int maxTextLength) {}
