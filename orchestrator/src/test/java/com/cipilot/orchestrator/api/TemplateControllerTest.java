package com.cipilot.orchestrator.api;

import com.cipilot.orchestrator.service.WorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TemplateController.class)
class TemplateControllerTest {

    @Autowired MockMvc          mockMvc;
    @MockitoBean WorkflowService workflowService;

    @Test
    void upload_validTemplate_returns201WithId() throws Exception {
        when(workflowService.uploadTemplate(eq("java"), eq("spring"), any(), isNull(), isNull()))
                .thenReturn("manual_java_spring_0123456789abcdef");

        mockMvc.perform(post("/templates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"language":"java","framework":"spring","pipelineDefinition":"stages: [build]"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("manual_java_spring_0123456789abcdef"));
    }

    @Test
    void upload_rejectedTemplate_returns400() throws Exception {
        when(workflowService.uploadTemplate(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("at least one of pipeline or Dockerfile is required"));

        mockMvc.perform(post("/templates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"language":"java"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("at least one of pipeline or Dockerfile is required"));
    }
}
