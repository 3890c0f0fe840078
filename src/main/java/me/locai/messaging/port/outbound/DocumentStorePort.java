package me.locai.messaging.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for JSON document persistence, organized by collection ("sessions",
 * "conversations").
 */
public interface DocumentStorePort {

    /**
     * Reads a document.
     *
     * @return JSON text, or {@code null} if the document does not exist
     */
    CompletableFuture<String> getDocument(String collection, String id);

    /**
     * Writes a document atomically, replacing any previous version.
     */
    CompletableFuture<Void> putDocument(String collection, String id, String json);

    CompletableFuture<Void> deleteDocument(String collection, String id);
}
