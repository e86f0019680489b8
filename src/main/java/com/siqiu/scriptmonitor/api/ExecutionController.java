package com.siqiu.scriptmonitor.api;

import com.siqiu.scriptmonitor.api.dto.ExecutionResponse;
import com.siqiu.scriptmonitor.execution.ExecutionQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Read-only views over recorded executions.
 */
@RestController
public class ExecutionController {

    private final ExecutionQueryService service;

    public ExecutionController(ExecutionQueryService service) {
        this.service = service;
    }

    @GetMapping("/executions/{id}")
    public ExecutionResponse get(@PathVariable UUID id) {
        return ExecutionResponse.from(service.getOrThrow(id));
    }

    @GetMapping("/schedules/{scheduleId}/executions")
    public List<ExecutionResponse> recent(
            @PathVariable long scheduleId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        return service.recent(scheduleId, limit).stream().map(ExecutionResponse::from).toList();
    }
}
