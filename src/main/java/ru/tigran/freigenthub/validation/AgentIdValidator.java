package ru.tigran.freigenthub.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Валидатор для {@link AgentId}.
 */
public class AgentIdValidator implements ConstraintValidator<AgentId, String> {

    private static final Pattern AGENT_ID_PATTERN = Pattern.compile("[A-Za-z0-9._@-]{1,128}");

    public static boolean isValidAgentId(String value) {
        return value != null && AGENT_ID_PATTERN.matcher(value).matches();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return isValidAgentId(value);
    }
}
