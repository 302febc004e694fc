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

package me.golemcore.agent.domain.system;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.TokenUsage;
import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relays a provider chunk stream to a {@link StreamListener}.
 *
 * <p>
 * The returned stream emits the same chunks. Usage snapshots replace each
 * other; the latest one is handed to {@code onEnd}. {@code onEnd} fires exactly
 * once, before a terminal error is propagated to the subscriber.
 */
@Slf4j
public final class StreamRelay {

    private StreamRelay() {
    }

    public static Flux<LlmChunk> relay(Flux<LlmChunk> source, StreamListener listener) {
        return Flux.defer(() -> {
            AtomicReference<TokenUsage> usage = new AtomicReference<>();
            AtomicBoolean ended = new AtomicBoolean(false);
            Runnable end = () -> {
                if (ended.compareAndSet(false, true)) {
                    listener.onEnd(usage.get());
                }
            };
            return source
                    .doOnNext(chunk -> {
                        if (chunk.getUsage() != null) {
                            usage.set(chunk.getUsage());
                        }
                        if (chunk.hasText()) {
                            listener.onChunk(chunk.getText());
                        }
                    })
                    .doOnComplete(end)
                    .doOnError(error -> {
                        log.debug("[Stream] Stream failed: {}", error.getMessage());
                        end.run();
                    })
                    .doOnCancel(end);
        });
    }
}
