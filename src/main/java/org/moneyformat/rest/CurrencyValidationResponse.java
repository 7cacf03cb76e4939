package org.moneyformat.rest;

import org.moneyformat.domain.CurrencyFormat;

public record CurrencyValidationResponse(String text, CurrencyFormat format, boolean valid) {}
