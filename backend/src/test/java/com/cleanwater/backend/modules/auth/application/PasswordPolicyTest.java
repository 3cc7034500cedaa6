package com.cleanwater.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.support.TestSecurityProperties;

import org.junit.jupiter.api.Test;

class PasswordPolicyTest {

    private final PasswordPolicy policy = new PasswordPolicy(TestSecurityProperties.defaults());

    @Test
    void acceptsMixedCaseWithDigit() {
        assertThatCode(() -> policy.check("Abcdefg1")).doesNotThrowAnyException();
    }

    @Test
    void rejectsEachMissingClass() {
        assertThatThrownBy(() -> policy.check("Abc1"))
                .isInstanceOf(ProblemException.class).hasMessageContaining("auth.password_too_short");
        assertThatThrownBy(() -> policy.check("abcdefg1"))
                .isInstanceOf(ProblemException.class).hasMessageContaining("auth.password_missing_uppercase");
        assertThatThrownBy(() -> policy.check("ABCDEFG1"))
                .isInstanceOf(ProblemException.class).hasMessageContaining("auth.password_missing_lowercase");
        assertThatThrownBy(() -> policy.check("Abcdefgh"))
                .isInstanceOf(ProblemException.class).hasMessageContaining("auth.password_missing_digit");
    }
}
