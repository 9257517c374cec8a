package com.collegeportal.backend.modules.people.presentation.dto;

import java.time.LocalDate;

import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Gender;
import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateStudentRequest(
        @JsonAlias({"userEmail", "user_email"}) @Email(message = "email must be a valid address") String email,
        @JsonAlias({"userFirstName", "user_first_name"}) @Size(max = 30) String firstName,
        @JsonAlias({"userLastName", "user_last_name"}) @Size(max = 30) String lastName,
        @Size(max = 50)
        @Pattern(regexp = PeopleConstraints.CODE_PATTERN, message = "Student ID must contain only uppercase letters and numbers.")
        String studentId,
        LocalDate dateOfBirth,
        Gender gender,
        @Pattern(regexp = PeopleConstraints.PHONE_PATTERN, message = PeopleConstraints.PHONE_MESSAGE) String phone,
        String address,
        Department department
) {
}
