package com.jimin.blog.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * UUID 필드가 null도 아니고 nil UUID(00000000-0000-0000-0000-000000000000)도 아니어야 함
 */
@Documented
@Constraint(validatedBy = NonNilUuidValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface NonNilUuid {

    String message() default "must not be null or the nil UUID";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
