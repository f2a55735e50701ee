package com.editflow.orchestrator.api;

import com.editflow.orchestrator.api.dto.JobResponse;
import com.editflow.orchestrator.api.dto.StatsResponse;
import com.editflow.orchestrator.api.dto.SubmitJobRequest;
import com.editflow.orchestrator.api.dto.SubmitResponse;
import com.editflow.orchestrator.api.dto.TierRequest;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.service.CancelResult;
import com.editflow.orchestrator.service.OrchestrationService;
import com.editflow.orchestrator.service.SubmitResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for job lifecycle.
 *
 * POST   /jobs                 submit a job (201, or 409 duplicate / 400 invalid)
 * GET    /jobs                 list jobs, optionally by status and/or subjectRef
 * GET    /jobs/stats           counts per status and tier, oldest pending age
 * GET    /jobs/{id}            current state of a job
 * DELETE /jobs/{id}            cancel a PENDING job
 * PATCH  /jobs/{id}/priority   change the tier of a PENDING job
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final OrchestrationService orchestration;

    public JobController(OrchestrationService orchestration) {
        this.orchestration = orchestration;
    }

    /**
     * Submit a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"id":"clip-42-grade","subjectRef":"clip-42","priorityTier":1,"qualityScore":4.8}'
     *
     * A rejected submission never changes the stored job; the body carries
     * the reason and, for duplicates, the existing record.
     */
    @PostMapping
    public ResponseEntity<SubmitResponse> submit(@RequestBody SubmitJobRequest req) {
        SubmitResult result = orchestration.submit(req.toSubmission());
        HttpStatus status = switch (result.kind()) {
            case ACCEPTED  -> HttpStatus.CREATED;
            case DUPLICATE -> HttpStatus.CONFLICT;
            case INVALID   -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(SubmitResponse.from(result));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) JobStatus status,
                                  @RequestParam(required = false) String subjectRef) {
        return orchestration.listJobs(status, subjectRef).stream()
                .map(JobResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return StatsResponse.from(orchestration.stats());
    }

    /**
     * Current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable String id) {
        return orchestration.getJob(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    /**
     * Cancel a job that has not started yet.
     * 404 if unknown, 409 if it is past PENDING.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        orchestration.getJob(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        CancelResult result = orchestration.cancel(id);
        if (!result.ok()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, result.reason());
        }
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/priority")
    public JobResponse adjustPriority(@PathVariable String id, @RequestBody TierRequest req) {
        orchestration.getJob(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        return orchestration.adjustPriority(id, req.priorityTier())
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.CONFLICT, "Only PENDING jobs can be re-prioritised: " + id));
    }
}
