/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.AgentResponse;
import com.agentruntime.web.metrics.AgentMetrics;
import com.agentruntime.web.service.AgentStreamService;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * The agent endpoint.
 *
 * <pre>
 *   POST {agent.service.endpoint-path}               text/event-stream, one data: frame per event
 *   POST {agent.service.endpoint-path}?response_type=json   terminal envelope as one JSON document
 * </pre>
 *
 * <p>The handler method is declared as {@code Object}: MVC picks the return
 * value handler from the runtime value, so an {@link SseEmitter} is streamed
 * and a {@code ResponseEntity<AgentResponse>} is written as a plain body.</p>
 */
@RestController
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentStreamService streamService;
    private final AgentMetrics metrics;

    @Value("${agent.service.response-type:sse}")
    private String defaultResponseType;

    @Value("${agent.service.stream:true}")
    private boolean streamEnabled;

    public AgentController(AgentStreamService streamService, AgentMetrics metrics) {
        this.streamService = streamService;
        this.metrics = metrics;
    }

    @PostMapping("${agent.service.endpoint-path:/process}")
    public Object process(
            @RequestBody(required = false) String body,
            @RequestParam(name = "response_type", required = false) String responseType,
            HttpServletResponse servletResponse) {
        AgentRequest request;
        try {
            request = AgentRequest.fromJson(body);
        } catch (ValidationException e) {
            metrics.requestRejected();
            throw e;
        }
        String effective = responseType != null ? responseType : defaultResponseType;
        log.debug("Processing {} as {}", request, effective);

        if (AgentStreamService.RESPONSE_JSON.equalsIgnoreCase(effective) || !streamEnabled) {
            return respondJson(request);
        }
        return respondStream(request, servletResponse);
    }

    private ResponseEntity<AgentResponse> respondJson(AgentRequest request) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(streamService.collect(request));
    }

    private SseEmitter respondStream(AgentRequest request, HttpServletResponse servletResponse) {
        SseEmitter emitter = streamService.stream(request);
        servletResponse.setHeader(HttpHeaders.CACHE_CONTROL, CacheControl.noCache().getHeaderValue());
        servletResponse.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
        return emitter;
    }
}
