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

/**
 * JSON-RPC error codes used by the bridges. Codes in the -32000..-32099 range
 * are transport failures mapped by this client.
 */
public final class McpErrorCodes {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    public static final int CONFIGURATION_ERROR = -32000;
    public static final int AUTH_FAILED = -32001;
    public static final int ENDPOINT_NOT_FOUND = -32002;
    public static final int CONNECTION_FAILED = -32003;
    public static final int TIMEOUT = -32004;
    public static final int HTTP_ERROR = -32005;
    public static final int DECODE_FAILED = -32006;

    private McpErrorCodes() {
    }
}
