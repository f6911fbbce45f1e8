package com.cipilot.orchestrator.api;

import com.cipilot.orchestrator.api.dto.TemplateResponse;
import com.cipilot.orchestrator.api.dto.UploadTemplateRequest;
import com.cipilot.orchestrator.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Seeds the template collection with known-good pipeline/Dockerfile pairs.
 *
 * Example:
 *   curl -X POST http://localhost:8080/templates \
 *     -H "Content-Type: application/json" \
 *     -d '{"language":"java","framework":"spring","pipelineDefinition":"stages: ..."}'
 */
@RestController
@RequestMapping("/templates")
public class TemplateController {

    private final WorkflowService workflowService;

    public TemplateController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping
    public ResponseEntity<TemplateResponse> upload(@RequestBody UploadTemplateRequest req) {
        String id = workflowService.uploadTemplate(
                req.language(),
                req.framework(),
                req.pipelineDefinition(),
                req.imageBuildDefinition(),
                req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(new TemplateResponse(id));
    }
}
