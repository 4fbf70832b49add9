package com.blackboard.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RunControllerTest {

    @Autowired MockMvc mvc;

    @Test
    void forensicRun_returnsReport() throws Exception {
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"let x = try! load()\", \"config\": \"-Xlinker -interposable\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CONVERGED"))
            .andExpect(jsonPath("$.mode").value("forensic"))
            .andExpect(jsonPath("$.verdict.kind").value("verdict"))
            .andExpect(jsonPath("$.verdict.payload.label").exists())
            .andExpect(jsonPath("$.facts[0].kind").value("seed"));
    }

    @Test
    void synthesisRun_returnsCompliantArtifact() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"HomeView\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.label").value("COMPLIANT"))
            .andExpect(jsonPath("$.score").value(1.0))
            .andExpect(jsonPath("$.round_reports.length()").value(2));
    }

    @Test
    void stalledRun_isStillAReport() throws Exception {
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"let x = try! load()\", \"max_rounds\": 1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("STALLED"))
            .andExpect(jsonPath("$.partial").value(true))
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void missingSource_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void nonPositiveMaxRounds_isInvalidConfiguration() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"HomeView\", \"max_rounds\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_CONFIGURATION"));
    }

    @Test
    void runTimeoutBeyondOneDay_isInvalidConfiguration() throws Exception {
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"let x = 1\", \"run_timeout_ms\": 9460800000000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_CONFIGURATION"));
    }

    @Test
    void maxRoundsOutOfIntRange_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"HomeView\", \"max_rounds\": 3000000000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void oversizedSource_isRejectedBeforeScanning() throws Exception {
        String source = "a".repeat(200_001);
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"" + source + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void serviceSynthesis_returnsCompliantService() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"FeedService\", \"artifact_type\": \"service\", \"methods\": [\"fetchFeed\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.label").value("COMPLIANT"))
            .andExpect(jsonPath("$.verdict.payload.target").value("FeedService"));
    }

    @Test
    void projectWithoutHotReload_isPartiallyCompliant() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"Demo\", \"artifact_type\": \"project\", "
                    + "\"views\": [\"HomeView\"], \"hot_reload\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CONVERGED"))
            .andExpect(jsonPath("$.label").value("PARTIAL"))
            .andExpect(jsonPath("$.verdict.payload.failed_checks.length()").value(1));
    }

    @Test
    void unknownArtifactType_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/runs/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"Demo\", \"artifact_type\": \"widget\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void malformedBody_isBadRequest() throws Exception {
        mvc.perform(post("/v1/runs/forensic")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }
}
