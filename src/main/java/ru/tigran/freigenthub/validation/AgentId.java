package ru.tigran.freigenthub.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Валидирует идентификатор агента: 1-128 символов из набора [A-Za-z0-9._@-].
 * Тот же идентификатор используется как user_id профиля и ключ почтового ящика.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = AgentIdValidator.class)
public @interface AgentId {
    String message() default "Agent id must be 1-128 characters of letters, digits, '.', '_', '@' or '-'";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
