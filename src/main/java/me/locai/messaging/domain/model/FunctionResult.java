package me.locai.messaging.domain.model;

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

/**
 * Outcome of a business function execution.
 *
 * @param message
 *            user-facing text appended to the reply on success
 */
public record FunctionResult(String name, boolean success, String message, Object data, String error) {

    public static FunctionResult success(String name, String message, Object data) {
        return new FunctionResult(name, true, message, data, null);
    }

    public static FunctionResult failure(String name, String error) {
        return new FunctionResult(name, false, null, null, error);
    }
}
