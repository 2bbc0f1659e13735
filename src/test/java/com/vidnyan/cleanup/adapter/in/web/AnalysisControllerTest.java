package com.vidnyan.cleanup.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.service.StoreTopology;
import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.SubmissionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StoreTopology storeTopology;

    private static final AgentFailure QUALITY_DOWN = new AgentFailure(
            Category.QUALITY, "quality-fork", "StoreConnectivityException", "Connection refused");

    @Test
    void analyze_ShouldReturnMergedReport() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "filename", "creds.py",
                "content", "password = \"admin123\"\n"));

        String json = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("sequential"))
                .andExpect(jsonPath("$.security.count").value(1))
                .andExpect(jsonPath("$.security.issues[0].issue").value("Hardcoded password"))
                .andExpect(jsonPath("$.security.issues[0].severity").value("HIGH"))
                .andExpect(jsonPath("$.security.issues[0].line").value(1))
                .andReturn().getResponse().getContentAsString();

        JsonNode report = objectMapper.readTree(json);
        long id = report.get("submission_id").asLong();
        assertFalse(report.has("submissionId"));
        assertEquals(report.get("total_issues").asInt(), report.get("security").get("count").asInt()
                + report.get("quality").get("count").asInt()
                + report.get("performance").get("count").asInt()
                + report.get("best_practices").get("count").asInt());

        mockMvc.perform(get("/api/submissions/{id}/report", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("stored"))
                .andExpect(jsonPath("$.total_issues").value(report.get("total_issues").asInt()))
                .andExpect(jsonPath("$.failures.length()").value(0));
    }

    @Test
    void abortedSubmission_ShouldHaveNoReport() throws Exception {
        FindingStore primary = storeTopology.primary();
        long id = primary.newSubmissionId("secrets.py", "password = \"admin123\"\n");
        primary.recordOutcome(id, SubmissionStatus.ABORTED, List.of(QUALITY_DOWN));

        mockMvc.perform(get("/api/submissions/{id}/report", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Submission #" + id + " has no report: analysis aborted"))
                .andExpect(jsonPath("$.details[0].category").value("quality"))
                .andExpect(jsonPath("$.details[0].error_type").value("StoreConnectivityException"));
    }

    @Test
    void unfinishedSubmission_ShouldHaveNoReport() throws Exception {
        long id = storeTopology.primary().newSubmissionId("pending.py", "x = 1");

        mockMvc.perform(get("/api/submissions/{id}/report", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.length()").value(0));
    }

    @Test
    void partialSubmission_ShouldReportItsFailures() throws Exception {
        FindingStore primary = storeTopology.primary();
        long id = primary.newSubmissionId("partial.py", "x = 1");
        primary.recordOutcome(id, SubmissionStatus.PARTIAL, List.of(QUALITY_DOWN));

        mockMvc.perform(get("/api/submissions/{id}/report", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("stored"))
                .andExpect(jsonPath("$.total_issues").value(0))
                .andExpect(jsonPath("$.failures[0].store").value("quality-fork"))
                .andExpect(jsonPath("$.failures[0].message").value("Connection refused"));
    }

    @Test
    void upload_ShouldUseOriginalFilename() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "handler.py", "text/x-python",
                "try:\n    risky()\nexcept:\n    handle()\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/analyze/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("handler.py"))
                .andExpect(jsonPath("$.best_practices.count").value(1))
                .andExpect(jsonPath("$.best_practices.issues[0].category").value("best_practices"));
    }

    @Test
    void missingFilename_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"x = 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("filename is required"));
    }

    @Test
    void unknownSubmission_ShouldBeNotFound() throws Exception {
        mockMvc.perform(get("/api/submissions/{id}/report", 987654))
                .andExpect(status().isNotFound());
    }

    @Test
    void status_ShouldListThePrimaryStore() throws Exception {
        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("sequential"))
                .andExpect(jsonPath("$.stores[0].name").value("primary"))
                .andExpect(jsonPath("$.stores[0].reachable").value(true))
                .andExpect(jsonPath("$.stores[0].analyzers.length()").value(4));
    }
}
