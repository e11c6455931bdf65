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
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "agent.service.mode=detached_process")
@AutoConfigureMockMvc
@Import(TestRunnerConfig.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReportProcessStatus() throws Exception {
        mockMvc.perform(get("/admin/status"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Process-Mode", "detached"))
                .andExpect(jsonPath("$.pid").value(ProcessHandle.current().pid()))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.memory_usage.heap_used").exists())
                .andExpect(jsonPath("$.uptime").exists());
    }

    @Test
    void shouldListAdminEndpoints() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(jsonPath("$.mode").value("detached_process"))
                .andExpect(jsonPath("$.endpoints.admin_status").value("/admin/status"))
                .andExpect(jsonPath("$.endpoints.admin_shutdown").value("/admin/shutdown"));
    }
}
