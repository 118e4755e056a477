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

package me.golemcore.relay.adapter.outbound.backend;

import me.golemcore.relay.port.outbound.BackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Checks backend reachability once the application is ready. The result is
 * only logged; an unreachable backend does not stop the bot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackendHealthProbe {

    private final BackendPort backendPort;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        check();
    }

    CompletableFuture<Void> check() {
        return backendPort.health()
                .thenAccept(health -> log.info("[Backend] Connected to wrapper service (status={}, version={})",
                        health.getStatus(), health.getVersion()))
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.error("[Backend] Wrapper service health check failed: {} (bot will retry on commands)",
                            cause.getMessage());
                    return null;
                });
    }
}
