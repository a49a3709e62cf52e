package me.golemcore.agent.adapter.outbound.llm;

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
 * Failure of a model-chat call. Completes the future returned by
 * {@link me.golemcore.agent.port.outbound.LlmPort#chat}.
 */
public class LlmCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        TRANSPORT, TIMEOUT, HTTP_STATUS, DECODE
    }

    private final Kind kind;
    private final int status;

    public LlmCallException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public LlmCallException(Kind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP status for {@link Kind#HTTP_STATUS}, otherwise -1.
     */
    public int getStatus() {
        return status;
    }
}
