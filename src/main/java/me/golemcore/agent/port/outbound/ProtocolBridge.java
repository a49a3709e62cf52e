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

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.Map;

/**
 * Sends one JSON-RPC 2.0 call over a concrete transport and returns its
 * {@code result}.
 *
 * <p>
 * Implementations assign a monotonically increasing request id (starting at 1)
 * per bridge instance, map transport failures to {@link McpErrorCodes} and
 * surface a well-formed {@code error} envelope verbatim. No retry is ever
 * performed.
 */
public interface ProtocolBridge extends Closeable {

    /**
     * Sends {@code method} with {@code params} and blocks until the response
     * arrives or the fixed timeout elapses.
     *
     * @return the {@code result} member of the response (never null; an absent
     *         result is returned as an empty object)
     * @throws McpTransportException
     *             when the transport fails
     * @throws McpException
     *             when the server answers with an error envelope
     */
    JsonNode send(String method, Map<String, Object> params) throws McpException;

    /**
     * Short transport name used in logs ("http", "stdio").
     */
    String transportName();

    @Override
    void close();
}
