package com.jimin.blog.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class TrimmedLengthValidator implements ConstraintValidator<TrimmedLength, String> {

    private int min;
    private int max;
    private String minMessage;
    private String maxMessage;

    @Override
    public void initialize(TrimmedLength annotation) {
        if (annotation.min() < 0 || annotation.max() < annotation.min()) {
            throw new IllegalArgumentException(
                    "Invalid @TrimmedLength bounds: min=" + annotation.min() + ", max=" + annotation.max());
        }
        this.min = annotation.min();
        this.max = annotation.max();
        this.minMessage = annotation.minMessage();
        this.maxMessage = annotation.maxMessage();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }

        int length = value.trim().length();
        if (length < min) {
            return reject(context, minMessage);
        }
        if (length > max) {
            return reject(context, maxMessage);
        }
        return true;
    }

    private static boolean reject(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
        return false;
    }
}
