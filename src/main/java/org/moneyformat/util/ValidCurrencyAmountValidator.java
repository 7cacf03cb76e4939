package org.moneyformat.util;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.moneyformat.domain.FormatOptions;
import org.moneyformat.validation.CurrencyValidator;

/**
 * Implementation of the currency amount validator.
 */
public class ValidCurrencyAmountValidator implements ConstraintValidator<ValidCurrencyAmount, CharSequence> {

    private FormatOptions options = FormatOptions.defaults();

    /**
     * Required no-args constructor for Jakarta Validation
     */
    public ValidCurrencyAmountValidator() {
        // Empty constructor required by Jakarta Validation
    }

    @Override
    public void initialize(ValidCurrencyAmount constraintAnnotation) {
        FormatOptions formatOptions = constraintAnnotation.format().options();
        if (constraintAnnotation.requireSymbol()) {
            formatOptions = formatOptions.withRequireSymbol(true);
        }
        this.options = formatOptions;
    }

    @Override
    public boolean isValid(CharSequence value, ConstraintValidatorContext context) {
        if (value == null) {
            return true; // null values are handled by @NotNull if needed
        }
        return CurrencyValidator.isCurrency(value.toString(), options);
    }
}
