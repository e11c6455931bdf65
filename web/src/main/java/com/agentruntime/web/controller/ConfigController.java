/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** GET /config - effective service configuration, standalone deployments only. */
@RestController
@ConditionalOnProperty(name = "agent.service.mode", havingValue = "standalone")
public class ConfigController {

    @Value("${agent.service.mode}")
    private String mode;

    @Value("${agent.service.endpoint-path:/process}")
    private String endpointPath;

    @Value("${agent.service.response-type:sse}")
    private String responseType;

    @Value("${agent.service.stream:true}")
    private boolean stream;

    @GetMapping("/config")
    public Map<String, Object> config() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("deployment_mode", mode);
        config.put("endpoint_path", endpointPath);
        config.put("response_type", responseType);
        config.put("stream", stream);
        return config;
    }
}
