package com.jimin.blog.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.UUID;

public class NonNilUuidValidator implements ConstraintValidator<NonNilUuid, UUID> {

    static final UUID NIL = new UUID(0L, 0L);

    @Override
    public boolean isValid(UUID value, ConstraintValidatorContext context) {
        return value != null && !NIL.equals(value);
    }
}
