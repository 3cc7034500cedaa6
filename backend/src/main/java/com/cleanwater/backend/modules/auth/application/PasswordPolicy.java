package com.cleanwater.backend.modules.auth.application;

import com.cleanwater.backend.global.config.SecurityProperties;
import com.cleanwater.backend.global.error.ProblemException;

import org.springframework.stereotype.Component;

/**
 * Strength rules applied to new passwords.
 */
@Component
public class PasswordPolicy {

    private final int minLength;

    public PasswordPolicy(SecurityProperties properties) {
        this.minLength = properties.password().minLength();
    }

    public void check(String password) {
        if (password == null || password.length() < minLength) {
            throw ProblemException.invalidInput("auth.password_too_short",
                    "Password must be at least " + minLength + " characters long");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            throw ProblemException.invalidInput("auth.password_missing_uppercase",
                    "Password must contain at least one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            throw ProblemException.invalidInput("auth.password_missing_lowercase",
                    "Password must contain at least one lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            throw ProblemException.invalidInput("auth.password_missing_digit",
                    "Password must contain at least one digit");
        }
    }
}
