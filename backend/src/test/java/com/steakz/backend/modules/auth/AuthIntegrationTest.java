package com.steakz.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.branch.domain.Branch;
import com.steakz.backend.support.AbstractPostgresIntegrationTest;
import com.steakz.backend.support.TestUserFactory;

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

    private static final String DEVICE_ID = "integration-device";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private Branch branch;
    private AppUser manager;

    @BeforeEach
    void setUp() {
        branch = testUserFactory.createBranch("Central");
        manager = testUserFactory.createUser(Role.BRANCH_MANAGER, branch.getId());
    }

    @Test
    void loginReturnsTokensAndProfile() throws Exception {
        JsonNode response = login(manager.getEmail(), TestUserFactory.DEFAULT_PASSWORD);

        assertThat(response.path("user").path("role").asText()).isEqualTo("BRANCH_MANAGER");
        assertThat(response.path("user").path("homeBranchId").asLong()).isEqualTo(branch.getId());

        String accessToken = response.path("tokens").path("accessToken").asText();
        mockMvc.perform(get("/api/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(manager.getEmail()));
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "not-the-password"}
                                """.formatted(manager.getEmail())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void refreshRotatesAndOldTokenStopsWorking() throws Exception {
        String original = login(manager.getEmail(), TestUserFactory.DEFAULT_PASSWORD)
                .path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original)))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();
        assertThat(rotated).isNotEqualTo(original);

        mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(original)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void logoutRevokesRefreshToken() throws Exception {
        String refreshToken = login(manager.getEmail(), TestUserFactory.DEFAULT_PASSWORD)
                .path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/api/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(refreshToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(refreshToken)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void signupCreatesCustomerOfChosenBranch() throws Exception {
        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "new-guest-%d@steakz.test", "password": "guest-pass-1", "branchId": %d}
                                """.formatted(System.nanoTime(), branch.getId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.role").value("CUSTOMER"))
                .andExpect(jsonPath("$.user.homeBranchId").value(branch.getId()));

        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "guest-pass-1", "branchId": %d}
                                """.formatted(manager.getEmail(), branch.getId())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("auth.email_taken"));
    }

    @Test
    void malformedSignupIsValidationError() throws Exception {
        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "not-an-email", "password": "short"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    private JsonNode login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s", "deviceId": "%s"}
                                """.formatted(email, password, DEVICE_ID)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String refreshBody(String refreshToken) {
        return """
                {"refreshToken": "%s", "deviceId": "%s"}
                """.formatted(refreshToken, DEVICE_ID);
    }
}
