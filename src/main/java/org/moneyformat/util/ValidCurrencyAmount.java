package org.moneyformat.util;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.*;
import org.moneyformat.domain.CurrencyFormat;

/**
 * Validates that a string is a well-formed monetary amount in the given locale format,
 * for example {@code "$10,123.45"} or {@code "€ 1.234,56"}.
 *
 * <p>Null values are considered valid. Use {@code @NotNull} in addition to this
 * annotation if null values should be rejected.</p>
 *
 */
@Documented
@Constraint(validatedBy = ValidCurrencyAmountValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidCurrencyAmount {
    /**
     * The error message to be used when validation fails.
     */
    String message() default "Invalid currency amount";

    /**
     * The locale format the value must follow.
     */
    CurrencyFormat format() default CurrencyFormat.US_DOLLAR;

    /**
     * Require the currency symbol even if the format leaves it optional.
     */
    boolean requireSymbol() default false;

    /**
     * The validation groups this constraint belongs to.
     */
    Class<?>[] groups() default {};

    /**
     * Additional payload information.
     */
    Class<? extends Payload>[] payload() default {};
}
