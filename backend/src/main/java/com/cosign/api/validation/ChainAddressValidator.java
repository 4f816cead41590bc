package com.cosign.api.validation;

import com.cosign.common.AddressFormat;
import com.cosign.common.AddressNormalizer;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Null passes; pair with @NotBlank where the address is required.
 */
public class ChainAddressValidator implements ConstraintValidator<ChainAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        for (AddressFormat format : AddressFormat.values()) {
            if (AddressNormalizer.isValid(value, format)) {
                return true;
            }
        }
        return false;
    }
}
