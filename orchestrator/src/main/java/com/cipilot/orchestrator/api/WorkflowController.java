package com.cipilot.orchestrator.api;

import com.cipilot.orchestrator.api.dto.PreviewResponse;
import com.cipilot.orchestrator.api.dto.StartWorkflowRequest;
import com.cipilot.orchestrator.api.dto.StartWorkflowResponse;
import com.cipilot.orchestrator.api.dto.WorkflowResponse;
import com.cipilot.orchestrator.service.StartedWorkflow;
import com.cipilot.orchestrator.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for workflow lifecycle.
 *
 * POST   /workflows           start a workflow (returns once the first commit exists)
 * GET    /workflows/{id}      poll state and event timeline
 * DELETE /workflows/{id}      abort at the next poll boundary
 * POST   /workflows/preview   generate without committing
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Start a workflow.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"repoUrl":"http://gitlab/group/service","token":"glpat-...","maxAttempts":5}'
     */
    @PostMapping
    public ResponseEntity<StartWorkflowResponse> start(@RequestBody StartWorkflowRequest req) {
        StartedWorkflow started = workflowService.startWorkflow(req.toWorkflowRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(StartWorkflowResponse.from(started));
    }

    /**
     * Returns 404 if the workflow ID is not found.
     */
    @GetMapping("/{id}")
    public WorkflowResponse getWorkflow(@PathVariable UUID id) {
        return WorkflowResponse.from(workflowService.getWorkflowStatus(id));
    }

    /**
     * HTTP 202: abort signalled
     * HTTP 409: workflow already finished
     * HTTP 404: workflow ID not found
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> abort(@PathVariable UUID id) {
        if (!workflowService.abort(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Workflow already finished: " + id);
        }
        return ResponseEntity.accepted().body(Map.of("workflowId", id.toString(), "status", "aborting"));
    }

    @PostMapping("/preview")
    public PreviewResponse preview(@RequestBody StartWorkflowRequest req) {
        return PreviewResponse.from(workflowService.preview(req.toWorkflowRequest()));
    }
}
