package com.collegeportal.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.support.AbstractPostgresIntegrationTest;
import com.collegeportal.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ADMIN_EMAIL = "admin@college.test";
    private static final String ADMIN_PASSWORD = "AdminPass123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PortalUserRepository portalUserRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureAdmin(ADMIN_EMAIL, ADMIN_PASSWORD);
    }

    @Test
    void loginReturnsTokensAndProfile() throws Exception {
        JsonNode response = login(ADMIN_EMAIL, ADMIN_PASSWORD);

        assertThat(response.path("tokens").path("accessToken").asText()).isNotBlank();
        assertThat(response.path("tokens").path("tokenType").asText()).isEqualTo("Bearer");
        assertThat(response.path("user").path("role").asText()).isEqualTo("admin");
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "wrong-password"}
                                """.formatted(ADMIN_EMAIL)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"));
    }

    @Test
    void profileIncludesStaffId() throws Exception {
        testUserFactory.ensureStaff("STF200", "prof@college.test", "StaffPass123!", Department.EE);
        String accessToken = login("prof@college.test", "StaffPass123!").path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("prof@college.test"))
                .andExpect(jsonPath("$.role").value("staff"))
                .andExpect(jsonPath("$.staffId").value("STF200"))
                .andExpect(jsonPath("$.department").value("EE"));
    }

    @Test
    void requestsWithoutTokenAreRejected() throws Exception {
        mockMvc.perform(get("/notices")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/notices").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void registrationDefaultsToStudentAndRejectsPrivilegedRoles() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "Fresh.Student@college.test",
                                  "password": "Password123!",
                                  "passwordConfirm": "Password123!",
                                  "firstName": "Fresh",
                                  "lastName": "Student"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.role").value("student"))
                .andExpect(jsonPath("$.user.email").value("fresh.student@college.test"));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "sneaky@college.test",
                                  "password": "Password123!",
                                  "passwordConfirm": "Password123!",
                                  "firstName": "Sneaky",
                                  "lastName": "Admin",
                                  "role": "admin"
                                }
                                """))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "typo@college.test",
                                  "password": "Password123!",
                                  "passwordConfirm": "Password124!",
                                  "firstName": "Typo",
                                  "lastName": "User"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.password").value("Password fields didn't match."));

        assertThat(portalUserRepository.findByEmailIgnoreCase("sneaky@college.test")).isEmpty();
    }

    @Test
    void refreshRotatesTokenAndOldTokenStopsWorking() throws Exception {
        String original = login(ADMIN_EMAIL, ADMIN_PASSWORD).path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(original)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.refreshToken").isNotEmpty())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();
        assertThat(rotated).isNotEqualTo(original);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(original)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void logoutRevokesRefreshToken() throws Exception {
        String refreshToken = login(ADMIN_EMAIL, ADMIN_PASSWORD).path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isUnauthorized());
    }

    private JsonNode login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "%s",
                                  "password": "%s"
                                }
                                """.formatted(email, password)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
