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

package me.golemcore.agent.domain.model;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Tracing identifiers threaded through callbacks. A root span is created per
 * run; a child span per model call and per tool call. Pure values, no owned
 * resources.
 */
public record SpanContext(String traceId, String spanId, String parentSpanId) {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    public static SpanContext root() {
        return new SpanContext(randomHex(16), randomHex(8), null);
    }

    public SpanContext child() {
        return new SpanContext(traceId, randomHex(8), spanId);
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
