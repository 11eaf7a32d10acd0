package com.jimin.blog.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 앞뒤 공백을 제거한 문자열 길이 검증
 *
 * {@code @Size}와 달리 하한/상한 위반 시 서로 다른 메시지를 사용함
 *  - 하한 미달: minMessage
 *  - 상한 초과: maxMessage
 *
 * null은 통과 (필수 여부는 {@code @NotBlank}로 따로 검증)
 */
@Documented
@Constraint(validatedBy = TrimmedLengthValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface TrimmedLength {

    int min() default 0;

    int max() default Integer.MAX_VALUE;

    String minMessage() default "length must be at least {min}";

    String maxMessage() default "length must be at most {max}";

    String message() default "length must be between {min} and {max}";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
