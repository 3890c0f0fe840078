package me.locai.messaging.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.DocumentStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Local filesystem implementation of {@link DocumentStorePort}.
 *
 * <p>
 * Each document is one JSON file, {@code <basePath>/<collection>/<id>.json}.
 * Writes go to a uniquely named temporary file first and are then moved into
 * place, so a crash never leaves a half-written document behind. Operations on
 * one document run one at a time in submission order, so the file always
 * holds the last write submitted.
 *
 * <p>
 * Base path configured via {@code locai.storage.base-path}, defaults to
 * {@code ${user.home}/.locai/messaging}. With {@code locai.storage.enabled=false}
 * every read returns nothing and writes are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalDocumentStoreAdapter implements DocumentStorePort {

    private static final String EXTENSION = ".json";

    private final MessagingProperties properties;

    private Path basePath;

    /** Last operation submitted per document path. */
    private final Map<Path, CompletableFuture<?>> pending = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        if (!properties.getStorage().isEnabled()) {
            log.info("Document storage disabled");
            return;
        }
        try {
            Files.createDirectories(basePath);
            for (String dir : List.of("sessions", "conversations")) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("Document storage initialized at: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize document storage at " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getDocument(String collection, String id) {
        if (!properties.getStorage().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        return inOrder(collection, id, filePath -> {
            try {
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read document: " + collection + "/" + id, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putDocument(String collection, String id, String json) {
        if (!properties.getStorage().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        return inOrder(collection, id, targetPath -> {
            writeAtomically(targetPath, json);
            log.debug("[Storage] Wrote {}/{}", collection, id);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteDocument(String collection, String id) {
        if (!properties.getStorage().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        return inOrder(collection, id, filePath -> {
            try {
                Files.deleteIfExists(filePath);
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete document: " + collection + "/" + id, e);
            }
        });
    }

    /**
     * Runs {@code operation} after every operation already submitted for the
     * same document, whether those succeeded or failed. Operations on different
     * documents still run in parallel.
     */
    private <T> CompletableFuture<T> inOrder(String collection, String id, Function<Path, T> operation) {
        Path path;
        try {
            path = resolvePath(collection, id);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        AtomicReference<CompletableFuture<T>> submitted = new AtomicReference<>();
        pending.compute(path, (key, previous) -> {
            CompletableFuture<?> after = previous != null ? previous : CompletableFuture.completedFuture(null);
            CompletableFuture<T> chained = after.handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> operation.apply(path));
            submitted.set(chained);
            return chained;
        });
        CompletableFuture<T> next = submitted.get();
        next.whenComplete((ignored, error) -> pending.remove(path, next));
        return next;
    }

    private void writeAtomically(Path targetPath, String json) {
        byte[] content = json.getBytes(StandardCharsets.UTF_8);
        Path tempPath = null;
        try {
            Path parent = targetPath.getParent();
            Files.createDirectories(parent);
            tempPath = Files.createTempFile(parent, targetPath.getFileName().toString() + ".", ".tmp");
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC)) {
                os.write(content);
            }
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tempPath != null) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
            }
            throw new UncheckedIOException("Failed to write document: " + targetPath.getFileName(), e);
        }
    }

    private Path resolvePath(String collection, String id) {
        Path resolved = basePath.resolve(collection).resolve(encodeId(id) + EXTENSION).normalize();
        if (!resolved.startsWith(basePath.resolve(collection))) {
            throw new IllegalArgumentException("Path traversal blocked: " + collection + "/" + id);
        }
        return resolved;
    }

    /**
     * Ids may contain phone numbers and separators; keep file names portable.
     */
    static String encodeId(String id) {
        StringBuilder sb = new StringBuilder(id.length());
        for (char c : id.toCharArray()) {
            if (c < 128 && (Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
                sb.append(c);
            } else {
                sb.append(String.format("%%%04x", (int) c));
            }
        }
        return sb.toString();
    }
}
