package me.golemcore.mailgate.adapter.outbound.storage;

import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "preferences";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GateProperties properties = new GateProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsStorageDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("preferences")));
        assertTrue(Files.isDirectory(tempDir.resolve("approvals")));
        assertTrue(Files.isDirectory(tempDir.resolve("runs")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "email_assistant/triage_preferences.md", "Ignore newsletters", false)
                .get();

        assertEquals("Ignore newsletters",
                storageAdapter.getText(TEST_DIR, "email_assistant/triage_preferences.md").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.md").get());
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "profile.md", "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "profile.md", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, "profile.md").get());
        assertEquals("v1", Files.readString(tempDir.resolve(TEST_DIR).resolve("profile.md.bak")));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("profile.md.tmp")));
    }

    @Test
    void putTextAtomic_withoutBackup() throws Exception {
        storageAdapter.putTextAtomic("runs", "run-1.json", "{}", false).get();
        storageAdapter.putTextAtomic("runs", "run-1.json", "{\"a\":1}", false).get();

        assertFalse(Files.exists(tempDir.resolve("runs").resolve("run-1.json.bak")));
    }

    @Test
    void exists_and_deleteObject() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("approvals", "r1.json", "{}", false).get();
        assertTrue(storageAdapter.exists("approvals", "r1.json").get());

        storageAdapter.deleteObject("approvals", "r1.json").get();

        assertFalse(storageAdapter.exists("approvals", "r1.json").get());
    }

    @Test
    void listObjects_returnsRelativePathsFilteredByPrefix() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "email_assistant/cal_preferences.md", "a", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "email_assistant/triage_preferences.md", "b", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "other/x.md", "c", false).get();

        List<String> files = storageAdapter.listObjects(TEST_DIR, "email_assistant/").get();

        assertEquals(List.of("email_assistant/cal_preferences.md", "email_assistant/triage_preferences.md"), files);
    }

    @Test
    void resolvePath_blocksTraversal() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").get());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
