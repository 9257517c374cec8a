package com.collegeportal.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-only-college-portal-secret-change-me-0123456789";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Environment configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            if (!StringUtils.hasText(environment.getProperty(key))) {
                problems.add(key + " is required");
            }
        }

        String secret = environment.getProperty("jwt.secret");
        if (StringUtils.hasText(secret)) {
            if (secretLength(secret) < MIN_SECRET_BYTES) {
                problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            if (DEV_JWT_SECRET.equals(secret)) {
                log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
            }
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (StringUtils.hasText(expiration)) {
            try {
                long ttl = Long.parseLong(expiration.trim());
                if (ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_ACCESS_TTL_MILLIS
                            + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        }
        return problems;
    }

    private static int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
