package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Model-chat collaborator: sends the transcript and tool list, returns the
 * assistant reply (text and/or tool calls).
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai-compatible").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response. Transport
     * and protocol failures complete the future exceptionally.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the current or default model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
