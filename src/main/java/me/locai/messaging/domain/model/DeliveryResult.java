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
 * Result of one routing strategy.
 *
 * @param reason
 *            failure reason such as {@code not_configured}, {@code timeout},
 *            {@code unavailable} or {@code send_failed}; {@code null} on success
 * @param replySent
 *            whether an outbound reply was sent by this strategy
 */
public record DeliveryResult(String strategy, boolean success, String reason, boolean replySent) {

    public static DeliveryResult delivered(String strategy, boolean replySent) {
        return new DeliveryResult(strategy, true, null, replySent);
    }

    public static DeliveryResult failed(String strategy, String reason) {
        return new DeliveryResult(strategy, false, reason, false);
    }
}
