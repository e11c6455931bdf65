/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestRunnerConfig.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReportHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("agent-service"))
                .andExpect(jsonPath("$.mode").value("daemon_thread"))
                .andExpect(jsonPath("$.runner").value("ready"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void shouldAnswerProbes() throws Exception {
        mockMvc.perform(get("/readiness"))
                .andExpect(status().isOk())
                .andExpect(content().string("success"));
        mockMvc.perform(get("/liveness"))
                .andExpect(status().isOk())
                .andExpect(content().string("success"));
    }

    @Test
    void shouldDescribeServiceAtRoot() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handler").exists())
                .andExpect(jsonPath("$.endpoints.process").value("/process"))
                .andExpect(jsonPath("$.endpoints.health").value("/health"))
                .andExpect(jsonPath("$.endpoints.admin_shutdown").doesNotExist())
                .andExpect(jsonPath("$.endpoints.config").doesNotExist());
    }

    @Test
    void shouldNotExposeModeSpecificEndpointsInDaemonMode() throws Exception {
        mockMvc.perform(get("/admin/status")).andExpect(status().isNotFound());
        mockMvc.perform(get("/config")).andExpect(status().isNotFound());
        mockMvc.perform(get("/health"))
                .andExpect(header().doesNotExist("X-Process-Mode"))
                .andExpect(header().doesNotExist("X-Deployment-Mode"));
    }
}
