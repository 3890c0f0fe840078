package me.locai.messaging.adapter.outbound.channel;

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
 * Normalizes client phone numbers to the {@code +<digits>} form the channel
 * microservice expects.
 */
public final class PhoneNumberFormatter {

    private static final String DEFAULT_COUNTRY_CODE = "55";

    private PhoneNumberFormatter() {
    }

    /**
     * Strips everything but digits and prefixes a {@code +}. Ten and eleven
     * digit numbers without a country code are Brazilian local numbers and get
     * {@code 55} prepended.
     */
    public static String format(String phoneNumber) {
        if (phoneNumber == null) {
            throw new IllegalArgumentException("phone number is required");
        }
        String digits = phoneNumber.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("phone number has no digits");
        }
        if ((digits.length() == 10 || digits.length() == 11) && !digits.startsWith(DEFAULT_COUNTRY_CODE)) {
            digits = DEFAULT_COUNTRY_CODE + digits;
        }
        return "+" + digits;
    }
}
