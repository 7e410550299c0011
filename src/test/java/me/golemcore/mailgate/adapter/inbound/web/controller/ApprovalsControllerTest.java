package me.golemcore.mailgate.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mailgate.adapter.inbound.web.dto.DecisionReceipt;
import me.golemcore.mailgate.adapter.outbound.approval.PendingApprovalAdapter;
import me.golemcore.mailgate.domain.model.ApprovalRequest;
import me.golemcore.mailgate.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApprovalsControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PendingApprovalAdapter approvalAdapter;
    private ApprovalsController controller;

    @BeforeEach
    void setUp() {
        approvalAdapter = mock(PendingApprovalAdapter.class);
        controller = new ApprovalsController(approvalAdapter);
    }

    @Test
    void shouldListPendingRequests() {
        ApprovalRequest request = new ApprovalRequest("run-1:c1", "run-1",
                Message.ToolCall.builder().id("c1").name("write_email").build(), null, "# Email Draft",
                Instant.parse("2026-03-02T10:00:00Z"));
        when(approvalAdapter.listPending()).thenReturn(List.of(request));

        StepVerifier.create(controller.listPending())
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertNotNull(resp.getBody());
                    assertEquals("run-1:c1", resp.getBody().get(0).requestId());
                })
                .verifyComplete();
    }

    @Test
    void shouldPassDecisionPayloadThrough() throws Exception {
        JsonNode payload = objectMapper.readTree("[{\"type\":\"edit\",\"args\":{\"args\":{\"to\":\"a@x.com\"}}}]");
        when(approvalAdapter.submitDecision("run-1:c1", payload))
                .thenReturn(PendingApprovalAdapter.Delivery.DELIVERED);

        StepVerifier.create(controller.submitDecision("run-1:c1", payload))
                .assertNext(resp -> {
                    DecisionReceipt body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("run-1:c1", body.getRequestId());
                    assertEquals("DELIVERED", body.getDelivery());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequirePayload() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.submitDecision("run-1:c1", null));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        verify(approvalAdapter, never()).submitDecision(anyString(), any());
    }

    @Test
    void shouldRejectRequest() {
        when(approvalAdapter.reject("run-1:c1", "Spam"))
                .thenReturn(PendingApprovalAdapter.Delivery.STORED_FOR_REPLAY);

        StepVerifier.create(controller.reject("run-1:c1", "Spam"))
                .assertNext(resp -> assertEquals("STORED_FOR_REPLAY", resp.getBody().getDelivery()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateUnknownRequest() {
        when(approvalAdapter.reject("missing", null))
                .thenThrow(new IllegalArgumentException("Unknown approval request: missing"));

        assertThrows(IllegalArgumentException.class, () -> controller.reject("missing", null));
    }
}
