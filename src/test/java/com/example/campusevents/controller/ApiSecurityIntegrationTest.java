package com.example.campusevents.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "app.upload-dir=target/test-uploads",
        "app.bootstrap.admin-email=admin@test.local",
        "app.bootstrap.admin-password=admin-pass",
        "app.bootstrap.admin-name=Test Admin"
})
@AutoConfigureMockMvc
@DisplayName("REST API with JWT security")
class ApiSecurityIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private MvcResult signUp(String email) throws Exception {
        String body = String.format(
                "{\"email\":\"%s\",\"password\":\"secret123\",\"name\":\"Test Student\",\"registrationNumber\":\"%s\"}",
                email, UUID.randomUUID().toString().substring(0, 12));
        return mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.role").value("student"))
                .andExpect(jsonPath("$.data.profileStatus").value("pending"))
                .andReturn();
    }

    private String login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"" + password + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.token");
    }

    private static String read(MvcResult result, String path) throws Exception {
        return JsonPath.read(result.getResponse().getContentAsString(), path);
    }

    @Test
    @DisplayName("Requests without a token get a 401 envelope")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/events"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/api/events").header(HttpHeaders.AUTHORIZATION, bearer("not-a-jwt")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void badCredentials() throws Exception {
        mockMvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"admin@test.local\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    void signUpValidationAndDuplicates() throws Exception {
        mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\",\"password\":\"secret123\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_FAILED"));

        String email = "dup-" + UUID.randomUUID() + "@campus.edu";
        signUp(email);
        mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"secret123\",\"name\":\"Again\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("DUPLICATE_ACCOUNT"));
    }

    @Test
    @DisplayName("Admin creates an event, a student registers once approved")
    void eventRegistrationFlow() throws Exception {
        String email = "student-" + UUID.randomUUID() + "@campus.edu";
        MvcResult signUp = signUp(email);
        String studentToken = read(signUp, "$.data.token");
        String studentId = read(signUp, "$.data.profileId");
        String adminToken = login("admin@test.local", "admin-pass");

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").value(email));

        String eventBody = String.format(
                "{\"name\":\"Tech Talk\",\"venue\":\"Auditorium\",\"eventDate\":\"%s\",\"eventTime\":\"10:00:00\",\"maxParticipants\":50}",
                LocalDate.now(ZoneOffset.UTC).plusDays(5));

        mockMvc.perform(post("/api/events").header(HttpHeaders.AUTHORIZATION, bearer(studentToken))
                        .contentType(MediaType.APPLICATION_JSON).content(eventBody))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));

        MvcResult created = mockMvc.perform(post("/api/events").header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON).content(eventBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("Active"))
                .andExpect(jsonPath("$.data.gracePeriodMinutes").value(15))
                .andReturn();
        String eventId = read(created, "$.data.id");

        // pending profile
        mockMvc.perform(post("/api/events/" + eventId + "/register").header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("PROFILE_NOT_APPROVED"));

        mockMvc.perform(put("/api/admin/students/" + studentId + "/status").header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"status\":\"approved\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("approved"));

        mockMvc.perform(post("/api/events/" + eventId + "/register").header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.registrationStatus").value("registered"))
                .andExpect(jsonPath("$.message").value("Registered successfully"));

        mockMvc.perform(post("/api/events/" + eventId + "/register").header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("You are already registered for this event"));

        mockMvc.perform(get("/api/events/" + eventId).header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.registrationStatus").value("registered"))
                .andExpect(jsonPath("$.data.totalParticipants").value(1));

        mockMvc.perform(get("/api/events/" + eventId + "/participants").header(HttpHeaders.AUTHORIZATION, bearer(studentToken)))
                .andExpect(status().isForbidden());
    }

    @Test
    void unknownEventIs404() throws Exception {
        String adminToken = login("admin@test.local", "admin-pass");

        mockMvc.perform(get("/api/events/" + UUID.randomUUID()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("EVENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("Certificates: students upload and see their own, admins review")
    void certificateFlow() throws Exception {
        MvcResult owner = signUp("cert-" + UUID.randomUUID() + "@campus.edu");
        String ownerToken = read(owner, "$.data.token");
        String ownerId = read(owner, "$.data.profileId");
        String otherToken = read(signUp("cert-" + UUID.randomUUID() + "@campus.edu"), "$.data.token");
        String adminToken = login("admin@test.local", "admin-pass");

        MockMultipartFile file = new MockMultipartFile("certificate", "quiz.pdf", "application/pdf", new byte[]{37, 80, 68, 70});
        MvcResult uploaded = mockMvc.perform(multipart("/api/certificates/upload").file(file)
                        .param("title", "Quiz winner").param("issueDate", "2025-02-01")
                        .header(HttpHeaders.AUTHORIZATION, bearer(ownerToken)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("Pending"))
                .andExpect(jsonPath("$.data.fileUrl").exists())
                .andReturn();
        String certificateId = read(uploaded, "$.data.id");

        mockMvc.perform(get("/api/certificates/student/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(ownerToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].title").value("Quiz winner"));
        mockMvc.perform(get("/api/certificates/" + certificateId).header(HttpHeaders.AUTHORIZATION, bearer(otherToken)))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/certificates").header(HttpHeaders.AUTHORIZATION, bearer(ownerToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/certificates/" + certificateId + "/status").header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"status\":\"approved\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Certificate approved successfully"))
                .andExpect(jsonPath("$.data.approvedBy").exists());
        mockMvc.perform(get("/api/certificates").param("status", "approved").param("studentId", ownerId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value(certificateId));
    }

    @Test
    @DisplayName("Student profiles: own view only, deletion by admins")
    void studentProfileAccess() throws Exception {
        MvcResult owner = signUp("profile-" + UUID.randomUUID() + "@campus.edu");
        String ownerToken = read(owner, "$.data.token");
        String ownerId = read(owner, "$.data.profileId");
        String otherToken = read(signUp("profile-" + UUID.randomUUID() + "@campus.edu"), "$.data.token");
        String adminToken = login("admin@test.local", "admin-pass");

        mockMvc.perform(put("/api/students/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(ownerToken))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"department\":\"Mechanical\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.department").value("Mechanical"));
        mockMvc.perform(get("/api/students/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(otherToken)))
                .andExpect(status().isForbidden());
        mockMvc.perform(delete("/api/students/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(otherToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/students/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Student deleted successfully"));
        mockMvc.perform(get("/api/students/" + ownerId).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNotFound());
    }
}
