package com.editflow.orchestrator.api;

import com.editflow.orchestrator.api.dto.ResourceStatusResponse;
import com.editflow.orchestrator.service.OrchestrationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator controls for admission.
 *
 * POST /queue/pause    stop starting new jobs (running ones finish)
 * POST /queue/resume   start admitting again, sensors permitting
 * GET  /resources      latest sample and what the governor made of it
 */
@RestController
public class QueueController {

    private final OrchestrationService orchestration;

    public QueueController(OrchestrationService orchestration) {
        this.orchestration = orchestration;
    }

    @PostMapping("/queue/pause")
    public ResourceStatusResponse pause() {
        return ResourceStatusResponse.from(orchestration.pause());
    }

    @PostMapping("/queue/resume")
    public ResourceStatusResponse resume() {
        return ResourceStatusResponse.from(orchestration.resume());
    }

    @GetMapping("/resources")
    public ResourceStatusResponse resources() {
        return ResourceStatusResponse.from(orchestration.resourceState());
    }
}
