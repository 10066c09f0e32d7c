package com.appforge.dispatch.api;

import com.appforge.core.engine.AgentRunEngine;
import com.appforge.core.model.AgentRun;
import com.appforge.core.model.GenerationRequest;
import com.appforge.core.model.TargetStack;
import com.appforge.core.model.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for generation runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final AgentRunEngine engine;
    private final SseStreamingService sseStreamingService;

    public RunController(AgentRunEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Start a generation run. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> requestGeneration(@RequestBody RunRequest request) {
        TargetStack framework = null;
        if (request.framework() != null && !request.framework().isBlank()) {
            framework = TargetStack.fromId(request.framework()).orElse(null);
            if (framework == null) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "Unknown framework: " + request.framework()));
            }
        }
        ValidationMode mode;
        try {
            mode = request.mode() != null ? ValidationMode.valueOf(request.mode().toUpperCase(Locale.ROOT)) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid mode: " + request.mode()));
        }

        AgentRun run = engine.requestGeneration(new GenerationRequest(
                request.projectId(), request.request(), framework, mode, request.previousFragmentId()));
        log.info("Accepted run {} for project {}", run.id(), run.projectId());

        Map<String, String> body = new LinkedHashMap<>();
        body.put("run_id", run.id());
        body.put("fragment_id", run.fragmentId());
        body.put("stage", run.stage().name());
        if (run.pendingJobId() != null) {
            body.put("pending_job_id", run.pendingJobId());
        }
        return ResponseEntity.accepted().body(body);
    }

    /**
     * GET /api/v1/runs: Most recently updated runs.
     */
    @GetMapping
    public List<RunResponse> listRuns(@RequestParam(defaultValue = "20") int limit) {
        return engine.recentRuns(Math.max(1, Math.min(limit, 200))).stream()
                .map(RunResponse::from)
                .toList();
    }

    /**
     * GET /api/v1/runs/{id}: Current stage, plan, report and failure of one run.
     */
    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> getRunStatus(@PathVariable String id) {
        return engine.getRunStatus(id)
                .map(run -> ResponseEntity.ok(RunResponse.from(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/runs/{id}/events: Live telemetry for one run as server-sent events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        Optional<AgentRun> run = engine.getRunStatus(id);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (run.get().stage().isTerminal()) {
            return ResponseEntity.ok(sseStreamingService.finishedEmitter(run.get()));
        }
        SseEmitter emitter = sseStreamingService.createEmitter(id);
        // The run may have finished between the lookup and the subscription
        engine.getRunStatus(id)
                .filter(current -> current.stage().isTerminal())
                .ifPresent(current -> sseStreamingService.sendFinished(emitter, current));
        return ResponseEntity.ok(emitter);
    }
}
