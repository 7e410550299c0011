package me.golemcore.mailgate.adapter.outbound.approval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mailgate.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mailgate.domain.exception.ApprovalRejectedException;
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.model.ApprovalRequest;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.ToolPolicy;
import me.golemcore.mailgate.infrastructure.config.AutoConfiguration;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PendingApprovalAdapterTest {

    private static final String REQUEST_ID = "run-1:call-1";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    private GateProperties properties;
    private LocalStorageAdapter storage;
    private PendingApprovalAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GateProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new PendingApprovalAdapter(storage, objectMapper, properties);
    }

    @Test
    void shouldDeliverDecisionToWaitingRun() throws Exception {
        CompletableFuture<JsonNode> future = adapter.requestApproval(request());
        assertFalse(future.isDone());
        assertEquals(1, adapter.listPending().size());

        JsonNode payload = objectMapper.readTree("[{\"type\":\"accept\"}]");
        assertEquals(PendingApprovalAdapter.Delivery.DELIVERED, adapter.submitDecision(REQUEST_ID, payload));

        assertEquals(payload, future.get(5, TimeUnit.SECONDS));
        assertTrue(adapter.listPending().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> adapter.submitDecision(REQUEST_ID, payload));
    }

    @Test
    void shouldRestorePublishedRequestFromDisk() {
        adapter.requestApproval(request());

        List<ApprovalRequest> pending = adapter.listPending();

        assertEquals(1, pending.size());
        ApprovalRequest stored = pending.get(0);
        assertEquals(REQUEST_ID, stored.requestId());
        assertEquals("write_email", stored.toolCall().getName());
        assertEquals(MemoryNamespace.of("email_assistant", "response_preferences"),
                stored.policy().getMemoryNamespace());
        assertEquals("# Email Draft", stored.description());
    }

    @Test
    void shouldDeliverDecisionSubmittedWhileRequestIsBeingPublished() throws Exception {
        JsonNode payload = objectMapper.readTree("[{\"type\":\"accept\"}]");
        AtomicReference<PendingApprovalAdapter> target = new AtomicReference<>();
        AtomicReference<PendingApprovalAdapter.Delivery> delivery = new AtomicReference<>();
        LocalStorageAdapter submittingStorage = new LocalStorageAdapter(properties) {
            @Override
            public CompletableFuture<Void> putTextAtomic(String directory, String path, String content,
                    boolean backup) {
                CompletableFuture<Void> written = super.putTextAtomic(directory, path, content, backup);
                written.join();
                if (path.equals("run-1_call-1.json") && delivery.get() == null) {
                    // The reviewer answers as soon as the request file is visible.
                    delivery.set(target.get().submitDecision(REQUEST_ID, payload));
                }
                return written;
            }
        };
        submittingStorage.init();
        PendingApprovalAdapter racing = new PendingApprovalAdapter(submittingStorage, objectMapper, properties);
        target.set(racing);

        CompletableFuture<JsonNode> future = racing.requestApproval(request());

        assertEquals(PendingApprovalAdapter.Delivery.DELIVERED, delivery.get());
        assertEquals(payload, future.get(5, TimeUnit.SECONDS));
        assertFalse(Files.exists(tempDir.resolve("approvals").resolve("run-1_call-1.decision.json")));
    }

    @Test
    void shouldReportStorageFailureInsteadOfWaiting() {
        LocalStorageAdapter failingStorage = new LocalStorageAdapter(properties) {
            @Override
            public CompletableFuture<Void> putTextAtomic(String directory, String path, String content,
                    boolean backup) {
                return CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full")));
            }
        };
        failingStorage.init();
        PendingApprovalAdapter broken = new PendingApprovalAdapter(failingStorage, objectMapper, properties);

        StoreUnavailableException error = assertThrows(StoreUnavailableException.class,
                () -> broken.requestApproval(request()));

        assertInstanceOf(UncheckedIOException.class, error.getCause());
        assertTrue(broken.listPending().isEmpty());
    }

    @Test
    void shouldFailFutureOnRejection() {
        CompletableFuture<JsonNode> future = adapter.requestApproval(request());

        adapter.reject(REQUEST_ID, "Not relevant");

        CompletionException error = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(ApprovalRejectedException.class, error.getCause());
        assertEquals("Not relevant", error.getCause().getMessage());
    }

    @Test
    void shouldStoreDecisionForRunThatIsNotWaiting() throws Exception {
        adapter.requestApproval(request());
        // Simulates a restart: a fresh adapter only sees what is on disk.
        PendingApprovalAdapter restarted = new PendingApprovalAdapter(storage, objectMapper, properties);
        JsonNode payload = objectMapper.readTree("{\"type\":\"response\",\"args\":\"Shorter\"}");

        assertEquals(PendingApprovalAdapter.Delivery.STORED_FOR_REPLAY, restarted.submitDecision(REQUEST_ID, payload));

        CompletableFuture<JsonNode> replayed = restarted.requestApproval(request());
        assertTrue(replayed.isDone());
        assertEquals(payload, replayed.join());
        assertFalse(Files.exists(tempDir.resolve("approvals").resolve("run-1_call-1.decision.json")));
    }

    @Test
    void shouldReplayStoredRejection() {
        adapter.requestApproval(request());
        PendingApprovalAdapter restarted = new PendingApprovalAdapter(storage, objectMapper, properties);

        restarted.reject(REQUEST_ID, null);

        CompletionException error = assertThrows(CompletionException.class,
                () -> restarted.requestApproval(request()).join());
        assertEquals("Rejected by reviewer", error.getCause().getMessage());
    }

    @Test
    void shouldRejectDecisionForUnknownRequest() throws Exception {
        JsonNode payload = objectMapper.readTree("[{\"type\":\"accept\"}]");

        assertThrows(IllegalArgumentException.class, () -> adapter.submitDecision("nope", payload));
        assertThrows(IllegalArgumentException.class, () -> adapter.reject("nope", "x"));
    }

    @Test
    void shouldTimeOutWhenConfigured() {
        properties.getApproval().setTimeout(Duration.ofMillis(50));
        PendingApprovalAdapter impatient = new PendingApprovalAdapter(storage, objectMapper, properties);

        CompletionException error = assertThrows(CompletionException.class,
                () -> impatient.requestApproval(request()).join());
        assertInstanceOf(TimeoutException.class, error.getCause());
    }

    private static ApprovalRequest request() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("call-1")
                .name("write_email")
                .arguments(Map.of("to", "bob@x.com"))
                .build();
        ToolPolicy policy = ToolPolicy.builder()
                .toolName("write_email")
                .requiresApproval(true)
                .allowAccept(true)
                .allowEdit(true)
                .allowIgnore(true)
                .allowRespond(true)
                .memoryNamespace(MemoryNamespace.of("email_assistant", "response_preferences"))
                .subject("email draft")
                .build();
        return new ApprovalRequest(REQUEST_ID, "run-1", call, policy, "# Email Draft",
                Instant.parse("2026-03-02T10:00:00Z"));
    }
}
