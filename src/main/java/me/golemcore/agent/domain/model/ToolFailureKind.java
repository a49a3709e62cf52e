package me.golemcore.agent.domain.model;

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

public enum ToolFailureKind {

    /**
     * The tool is not part of the current tool context; no call was made.
     */
    NOT_IN_CONTEXT,

    /**
     * The transport failed (connection refused, timeout, undecodable body, auth).
     */
    TRANSPORT_FAILED,

    /**
     * The server answered with a JSON-RPC error envelope.
     */
    PROTOCOL_ERROR,

    /**
     * The tool ran and reported its own failure (isError).
     */
    TOOL_ERROR
}
