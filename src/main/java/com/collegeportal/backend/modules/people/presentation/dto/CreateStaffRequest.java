package com.collegeportal.backend.modules.people.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Gender;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateStaffRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") String email,
        @NotBlank(message = "firstName is required") @Size(max = 30) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 30) String lastName,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password,
        @NotBlank(message = "passwordConfirm is required") String passwordConfirm,
        @NotBlank(message = "staffId is required")
        @Size(max = 50)
        @Pattern(regexp = PeopleConstraints.CODE_PATTERN, message = "Staff ID must contain only uppercase letters and numbers.")
        String staffId,
        LocalDate dateOfBirth,
        Gender gender,
        @Pattern(regexp = PeopleConstraints.PHONE_PATTERN, message = PeopleConstraints.PHONE_MESSAGE) String phone,
        String address,
        Department department,
        @Size(max = 100) String designation,
        @Size(max = 200) String qualification,
        @DecimalMin(value = "0.00", message = "salary must not be negative")
        @Digits(integer = 8, fraction = 2, message = "salary must have at most 8 integer and 2 fraction digits")
        BigDecimal salary
) {
}
