package com.blackboard.api;

import com.blackboard.agent.synthesis.ProjectConfigGeneratorAgent;
import com.blackboard.agent.synthesis.ServiceGeneratorAgent;
import com.blackboard.agent.synthesis.ViewGeneratorAgent;
import com.blackboard.coordinator.RunOverrides;
import com.blackboard.coordinator.RunResult;
import com.blackboard.coordinator.RunService;
import com.blackboard.projection.RunReport;
import com.blackboard.projection.RunReportProjector;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs the blackboard synchronously and returns the run report. Every terminal
 * status is a 200; the report's {@code status} tells them apart.
 */
@RestController
@RequestMapping("/v1/runs")
public class RunController {

    private final RunService runService;
    private final RunReportProjector projector;

    public RunController(RunService runService, RunReportProjector projector) {
        this.runService = runService;
        this.projector = projector;
    }

    @PostMapping("/forensic")
    public RunReport forensic(@RequestBody Map<String, Object> request) {
        RunResult result = runService.startForensic(
            optionalString(request, "source"),
            optionalString(request, "config"),
            overrides(request));
        return projector.project(result);
    }

    /**
     * {@code artifact_type} selects what is generated: {@code view} (default),
     * {@code service} with optional {@code methods}, or {@code project} with optional
     * {@code views}, {@code services} and {@code hot_reload}.
     */
    @PostMapping("/synthesis")
    public RunReport synthesis(@RequestBody Map<String, Object> request) {
        String target = optionalString(request, "target");
        String artifactType = optionalString(request, "artifact_type");
        RunOverrides overrides = overrides(request);

        RunResult result;
        if (artifactType == null || ViewGeneratorAgent.ARTIFACT_TYPE.equals(artifactType)) {
            result = runService.startSynthesis(target, overrides);
        } else if (ServiceGeneratorAgent.ARTIFACT_TYPE.equals(artifactType)) {
            result = runService.startServiceSynthesis(target, optionalStrings(request, "methods"), overrides);
        } else if (ProjectConfigGeneratorAgent.ARTIFACT_TYPE.equals(artifactType)) {
            Boolean hotReload = optionalBoolean(request, "hot_reload");
            result = runService.startProjectSynthesis(target,
                optionalStrings(request, "views"),
                optionalStrings(request, "services"),
                hotReload == null || hotReload,
                overrides);
        } else {
            throw new IllegalArgumentException("unsupported artifact_type: " + artifactType);
        }
        return projector.project(result);
    }

    private RunOverrides overrides(Map<String, Object> request) {
        Long maxRounds = optionalLong(request, "max_rounds");
        Long runTimeoutMs = optionalLong(request, "run_timeout_ms");
        Long agentTimeoutMs = optionalLong(request, "agent_timeout_ms");
        if (maxRounds != null && (maxRounds < Integer.MIN_VALUE || maxRounds > Integer.MAX_VALUE)) {
            throw new IllegalArgumentException("max_rounds is out of range: " + maxRounds);
        }
        return new RunOverrides(
            maxRounds != null ? maxRounds.intValue() : null,
            runTimeoutMs != null ? Duration.ofMillis(runTimeoutMs) : null,
            agentTimeoutMs != null ? Duration.ofMillis(agentTimeoutMs) : null
        );
    }

    private String optionalString(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return text;
    }

    private Long optionalLong(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return ((Number) value).longValue();
    }

    private List<String> optionalStrings(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list) || !list.stream().allMatch(String.class::isInstance)) {
            throw new IllegalArgumentException(field + " must be a list of strings");
        }
        return list.stream().map(String.class::cast).toList();
    }

    private Boolean optionalBoolean(Map<String, Object> request, String field) {
        Object value = request.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException(field + " must be a boolean");
        }
        return flag;
    }
}
