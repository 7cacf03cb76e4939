package org.moneyformat.rest;

import org.moneyformat.domain.CurrencyFormat;
import org.moneyformat.domain.FormatOptions;

/** A named preset together with the options it expands to. */
public record CurrencyFormatResponse(CurrencyFormat format, FormatOptions options) {}
