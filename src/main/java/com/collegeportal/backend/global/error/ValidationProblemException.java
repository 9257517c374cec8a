package com.collegeportal.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;

/**
 * Input rejected before any mutation. Carries per-field messages so clients can highlight inputs.
 */
public class ValidationProblemException extends ProblemException {

    public static final String DEFAULT_CODE = "validation_error";

    private final Map<String, String> fieldErrors;

    public ValidationProblemException(String detail, Map<String, String> fieldErrors) {
        this(DEFAULT_CODE, detail, fieldErrors);
    }

    public ValidationProblemException(String code, String detail, Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, code, detail);
        this.fieldErrors = fieldErrors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public static ValidationProblemException field(String field, String message) {
        return new ValidationProblemException(message, Map.of(field, message));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
