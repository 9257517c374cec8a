package com.collegeportal.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void acceptsCompleteConfiguration() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/college_portal")
                .withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET)
                .withProperty("jwt.expiration", "900000");

        assertThat(new EnvironmentValidator(environment).validate()).isEmpty();
    }

    @Test
    void reportsMissingProperties() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.expiration", "900000");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactlyInAnyOrder("spring.datasource.url is required", "jwt.secret is required");
    }

    @Test
    void rejectsShortSecretAndOutOfRangeTtl() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/college_portal")
                .withProperty("jwt.secret", "too-short")
                .withProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).validate())
                .hasSize(2)
                .anyMatch(problem -> problem.startsWith("jwt.secret"))
                .anyMatch(problem -> problem.startsWith("jwt.expiration"));
    }

    @Test
    void failsStartupOnProblems() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.expiration", "soon");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be a number");
    }
}
