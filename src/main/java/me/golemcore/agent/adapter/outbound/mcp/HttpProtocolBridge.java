package me.golemcore.agent.adapter.outbound.mcp;

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

import me.golemcore.agent.port.outbound.McpErrorCodes;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * JSON-RPC over HTTP: one POST per call to a fixed endpoint, bearer token on
 * every request, one fixed call timeout.
 *
 * <p>
 * Failure mapping:
 * <ul>
 * <li>connection refused / unreachable → {@link McpErrorCodes#CONNECTION_FAILED}
 * <li>timeout → {@link McpErrorCodes#TIMEOUT}
 * <li>HTTP 401 → {@link McpErrorCodes#AUTH_FAILED}
 * <li>HTTP 404 → {@link McpErrorCodes#ENDPOINT_NOT_FOUND}
 * <li>other non-2xx → {@link McpErrorCodes#HTTP_ERROR}
 * <li>body that is not JSON → {@link McpErrorCodes#DECODE_FAILED}
 * </ul>
 * Status codes are checked before the body is parsed.
 */
@Slf4j
public class HttpProtocolBridge extends AbstractProtocolBridge {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String apiKey;

    public HttpProtocolBridge(OkHttpClient baseHttpClient, ObjectMapper objectMapper, String endpoint,
            String apiKey, Duration timeout) {
        super(objectMapper);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
        log.info("[MCP:http] Bridge to {}", endpoint);
    }

    @Override
    public String transportName() {
        return "http";
    }

    @Override
    protected JsonNode exchange(int id, ObjectNode request) throws McpException {
        JsonNode response = forward(request);
        if (response == null) {
            throw new McpTransportException(McpErrorCodes.DECODE_FAILED, "Empty response from server");
        }
        JsonNode responseId = response.get("id");
        boolean anonymousError = (responseId == null || responseId.isNull()) && response.hasNonNull("error");
        if (!anonymousError && (responseId == null || !responseId.canConvertToInt() || responseId.asInt() != id)) {
            log.warn("[MCP:http] Response id {} does not match request id {}", responseId, id);
            throw new McpTransportException(McpErrorCodes.DECODE_FAILED,
                    "Response id " + responseId + " does not match request id " + id);
        }
        return response;
    }

    /**
     * Posts an already built envelope as is (the caller's id is kept) and returns
     * the decoded response envelope, or {@code null} when the server answered
     * with an empty body.
     */
    public JsonNode forward(JsonNode envelope) throws McpException {
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .header("Content-Type", "application/json")
                .post(RequestBody.create(serialize(envelope), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            log.debug("[MCP:http] Response status: {}", response.code());
            if (response.code() == 401) {
                throw new McpTransportException(McpErrorCodes.AUTH_FAILED,
                        "Authentication failed. Check your API key.");
            }
            if (response.code() == 404) {
                throw new McpTransportException(McpErrorCodes.ENDPOINT_NOT_FOUND,
                        "MCP endpoint not found: " + endpoint);
            }
            if (!response.isSuccessful()) {
                throw new McpTransportException(McpErrorCodes.HTTP_ERROR,
                        "HTTP error: " + response.code());
            }
            return decode(response.body());
        } catch (InterruptedIOException e) {
            throw new McpTransportException(McpErrorCodes.TIMEOUT, "Request timed out", e);
        } catch (IOException e) {
            throw new McpTransportException(McpErrorCodes.CONNECTION_FAILED,
                    "Failed to connect to " + endpoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        // Connections belong to the shared OkHttp pool
    }

    private JsonNode decode(ResponseBody body) throws IOException, McpTransportException {
        String text = body != null ? body.string() : "";
        if (text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (!node.isObject()) {
                throw new McpTransportException(McpErrorCodes.DECODE_FAILED,
                        "Invalid JSON-RPC response from server");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new McpTransportException(McpErrorCodes.DECODE_FAILED, "Invalid JSON response from server", e);
        }
    }
}
