package com.cipilot.orchestrator.api;

import com.cipilot.orchestrator.api.dto.LearnCallbackRequest;
import com.cipilot.orchestrator.service.WorkflowService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Target of the learn_record job injected into every committed pipeline.
 *
 * Always answers 202 so a callback for an unknown branch never fails the CI job;
 * "matched" tells whether a workflow picked it up.
 */
@RestController
@RequestMapping("/learn")
public class LearnCallbackController {

    private final WorkflowService workflowService;

    public LearnCallbackController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping("/record")
    public ResponseEntity<Map<String, Object>> record(@RequestBody LearnCallbackRequest req) {
        if (req.branch() == null || req.branch().isBlank()) {
            throw new IllegalArgumentException("branch is required");
        }
        boolean matched = workflowService.recordLearnCallback(req.projectUrl(), req.branch(), req.pipelineId());
        return ResponseEntity.accepted().body(Map.of("matched", matched));
    }
}
