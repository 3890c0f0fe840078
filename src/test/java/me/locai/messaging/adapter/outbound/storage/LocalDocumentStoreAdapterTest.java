package me.locai.messaging.adapter.outbound.storage;

import me.locai.messaging.infrastructure.config.MessagingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalDocumentStoreAdapterTest {

    @TempDir
    Path tempDir;

    private MessagingProperties properties;
    private LocalDocumentStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        store = new LocalDocumentStoreAdapter(properties);
        store.init();
    }

    @Test
    void shouldCreateCollectionDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
    }

    @Test
    void shouldWriteReadAndDeleteDocument() {
        store.putDocument("conversations", "tenant-a:+5511999990000", "{\"stage\":\"DISCOVERY\"}").join();

        assertEquals("{\"stage\":\"DISCOVERY\"}",
                store.getDocument("conversations", "tenant-a:+5511999990000").join());

        store.deleteDocument("conversations", "tenant-a:+5511999990000").join();
        assertNull(store.getDocument("conversations", "tenant-a:+5511999990000").join());
    }

    @Test
    void shouldReplaceExistingDocumentWithoutLeavingTempFiles() throws Exception {
        store.putDocument("sessions", "tenant-a", "{\"v\":1}").join();
        store.putDocument("sessions", "tenant-a", "{\"v\":2}").join();

        assertEquals("{\"v\":2}", store.getDocument("sessions", "tenant-a").join());
        try (Stream<Path> files = Files.list(tempDir.resolve("sessions"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldKeepLastSubmittedWriteUnderConcurrentWritesToSameDocument() throws Exception {
        for (int round = 0; round < 20; round++) {
            List<CompletableFuture<Void>> writes = new ArrayList<>();
            for (int turn = 0; turn < 8; turn++) {
                writes.add(store.putDocument("conversations", "t:c", "{\"round\":" + round + ",\"turn\":" + turn + "}"));
            }

            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

            assertEquals("{\"round\":" + round + ",\"turn\":7}", store.getDocument("conversations", "t:c").join());
        }
        try (Stream<Path> files = Files.list(tempDir.resolve("conversations"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldOrderDeleteAfterPendingWrite() {
        CompletableFuture<Void> write = store.putDocument("sessions", "tenant-b", "{\"v\":1}");
        CompletableFuture<Void> delete = store.deleteDocument("sessions", "tenant-b");

        CompletableFuture.allOf(write, delete).join();

        assertNull(store.getDocument("sessions", "tenant-b").join());
    }

    @Test
    void shouldRunLaterOperationsAfterFailedWrite() {
        assertThrows(CompletionException.class,
                () -> store.putDocument("sessions", "tenant-c", null).join());

        store.putDocument("sessions", "tenant-c", "{\"v\":2}").join();

        assertEquals("{\"v\":2}", store.getDocument("sessions", "tenant-c").join());
    }

    @Test
    void shouldReturnNullForMissingDocument() {
        assertNull(store.getDocument("sessions", "nobody").join());
    }

    @Test
    void shouldEncodeSeparatorsInIds() {
        assertEquals("tenant-a%003a%002b5511", LocalDocumentStoreAdapter.encodeId("tenant-a:+5511"));
        assertNotEquals(LocalDocumentStoreAdapter.encodeId("a:b"), LocalDocumentStoreAdapter.encodeId("a%003ab"));
    }

    @Test
    void shouldBlockTraversalThroughCollection() {
        assertThrows(CompletionException.class, () -> store.getDocument("../outside", "x").join());
    }

    @Test
    void shouldSkipEverythingWhenDisabled() {
        properties.getStorage().setEnabled(false);

        store.putDocument("sessions", "tenant-a", "{}").join();

        assertNull(store.getDocument("sessions", "tenant-a").join());
        assertFalse(Files.exists(tempDir.resolve("sessions").resolve("tenant-a.json")));
    }
}
