/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.agentruntime.common.exception.HandlerException;
import com.agentruntime.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentResponseTest {

    @Test
    void shouldStartCreatedWithResponseIdPrefix() {
        AgentResponse response = new AgentResponse("s-1");

        assertEquals(RunStatus.CREATED, response.getStatus());
        assertEquals("response", response.getObject());
        assertTrue(response.getId().startsWith("response_"));
        assertNotNull(response.getCreatedAt());
        assertNull(response.getCompletedAt());
    }

    @Test
    void shouldCompleteExactlyOnce() {
        AgentResponse response = new AgentResponse("s-1").inProgress().completed();

        assertEquals(RunStatus.COMPLETED, response.getStatus());
        assertNotNull(response.getCompletedAt());
        assertThrows(IllegalStateException.class, response::completed);
        assertThrows(IllegalStateException.class, () -> response.failed(new ErrorInfo("X", "late")));
        assertThrows(IllegalStateException.class, () -> response.addNewMessage(Message.text("late")));
    }

    @Test
    void shouldCarryErrorWhenFailed() {
        AgentResponse response = new AgentResponse("s-1").inProgress()
                .failed(new ErrorInfo("IllegalArgumentException", "boom"));

        assertEquals(RunStatus.FAILED, response.getStatus());
        assertEquals("IllegalArgumentException", response.getError().getCode());
        assertEquals("boom", response.getError().getMessage());
        assertTrue(response.isTerminal());
    }

    @Test
    void shouldNotLetSnapshotSeeLaterMutations() {
        AgentResponse response = new AgentResponse("s-1").inProgress();
        AgentResponse before = response.snapshot();

        response.addNewMessage(Message.text("ok"));
        response.completed();

        assertEquals(RunStatus.IN_PROGRESS, before.getStatus());
        assertTrue(before.getOutput().isEmpty());
        assertEquals(1, response.getOutput().size());
        assertEquals(response.getId(), before.getId());
    }

    @Test
    void shouldSerializeWireNames() {
        AgentResponse response = new AgentResponse("s-1").inProgress();
        response.setSequenceNumber(1L);

        Map<String, Object> json = JsonUtil.toMap(response);

        assertEquals("response", json.get("object"));
        assertEquals("in_progress", json.get("status"));
        assertEquals("s-1", json.get("session_id"));
        assertEquals(1, ((Number) json.get("sequence_number")).intValue());
        assertFalse(json.containsKey("error"));
    }

    @Test
    void shouldReportUserExceptionThroughHandlerWrapper() {
        ErrorInfo info = ErrorInfo.of(new HandlerException("wrapped", new IllegalStateException("inner")));

        assertEquals("IllegalStateException", info.getCode());
        assertEquals("inner", info.getMessage());
    }

    @Test
    void shouldBuildStandaloneFailure() {
        AgentResponse failure = AgentResponse.failure("response_x", new ErrorInfo("E", "m"));

        assertEquals("response_x", failure.getId());
        assertEquals(RunStatus.FAILED, failure.getStatus());
    }
}
