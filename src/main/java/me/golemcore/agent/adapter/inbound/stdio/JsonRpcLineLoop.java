package me.golemcore.agent.adapter.inbound.stdio;

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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Line-delimited JSON-RPC loop shared by the stdio relay and the local tool
 * server.
 *
 * <p>
 * A reader thread feeds input lines into a bounded channel. {@link #run()}
 * takes one line at a time and moves through READING → DISPATCHING →
 * RESPONDING until end of input or {@link #close()}. Blank lines are ignored;
 * a line that is not JSON gets a parse-error envelope with a null id and the
 * loop keeps reading. A handler returning {@code null} (notifications) writes
 * nothing.
 */
@Slf4j
public class JsonRpcLineLoop implements AutoCloseable {

    /**
     * Produces the response envelope for one request, or {@code null}.
     */
    @FunctionalInterface
    public interface Handler {
        JsonNode handle(ObjectNode request);
    }

    public enum State {
        READING, DISPATCHING, RESPONDING, CLOSED
    }

    private static final int CHANNEL_CAPACITY = 64;
    private static final String END_OF_INPUT = "\u0000EOF";
    private static final long CLOSE_CHECK_MILLIS = 200;

    private final String name;
    private final InputStream input;
    private final PrintStream output;
    private final ObjectMapper objectMapper;
    private final Handler handler;
    private final BlockingQueue<String> channel = new ArrayBlockingQueue<>(CHANNEL_CAPACITY);

    private final AtomicReference<State> state = new AtomicReference<>(State.READING);
    private volatile Thread readerThread;

    public JsonRpcLineLoop(String name, InputStream input, OutputStream output, ObjectMapper objectMapper,
            Handler handler) {
        this.name = name;
        this.input = input;
        this.output = new PrintStream(output, true, StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.handler = handler;
    }

    /**
     * Blocks until end of input or {@link #close()}.
     */
    public void run() {
        readerThread = new Thread(this::readLoop, "jsonrpc-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();
        log.info("[{}] Ready, reading JSON-RPC from stdin", name);

        try {
            while (transition(State.READING)) {
                String line = channel.poll(CLOSE_CHECK_MILLIS, TimeUnit.MILLISECONDS);
                if (line == null) {
                    continue;
                }
                if (END_OF_INPUT.equals(line)) {
                    break;
                }
                if (line.isBlank()) {
                    continue;
                }
                if (!transition(State.DISPATCHING)) {
                    break;
                }
                JsonNode response = dispatch(line.trim());
                if (response != null && transition(State.RESPONDING)) {
                    write(response);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(State.CLOSED);
            log.info("[{}] Stopped", name);
        }
    }

    public State getState() {
        return state.get();
    }

    /**
     * Stops the loop. A dispatch in progress completes; its response is not
     * written.
     */
    @Override
    public void close() {
        state.set(State.CLOSED);
        if (readerThread != null) {
            readerThread.interrupt();
        }
    }

    /**
     * Moves to {@code next} unless the loop was closed in the meantime.
     */
    private boolean transition(State next) {
        return state.getAndUpdate(current -> current == State.CLOSED ? State.CLOSED : next) != State.CLOSED;
    }

    private JsonNode dispatch(String line) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Parse error: {}", name, e.getOriginalMessage());
            return error(objectMapper, null, McpErrorCodes.PARSE_ERROR, "Parse error");
        }
        if (!(node instanceof ObjectNode request)) {
            return error(objectMapper, null, McpErrorCodes.INVALID_REQUEST, "Invalid Request");
        }
        log.debug("[{}] → {}", name, request.path("method").asText(""));
        try {
            return handler.handle(request);
        } catch (RuntimeException e) {
            log.warn("[{}] Handler failed: {}", name, e.getMessage());
            return error(objectMapper, request.get("id"), McpErrorCodes.INTERNAL_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private void write(JsonNode response) {
        try {
            String json = objectMapper.writeValueAsString(response);
            synchronized (output) {
                output.println(json);
                output.flush();
            }
        } catch (JsonProcessingException e) {
            log.error("[{}] Failed to serialize response", name, e);
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (state.get() != State.CLOSED && (line = reader.readLine()) != null) {
                channel.put(line);
            }
        } catch (IOException e) {
            log.warn("[{}] Input error: {}", name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            channel.put(END_OF_INPUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static ObjectNode result(ObjectMapper objectMapper, JsonNode id, JsonNode result) {
        ObjectNode envelope = envelope(objectMapper, id);
        envelope.set("result", result);
        return envelope;
    }

    public static ObjectNode error(ObjectMapper objectMapper, JsonNode id, int code, String message) {
        ObjectNode envelope = envelope(objectMapper, id);
        ObjectNode error = envelope.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return envelope;
    }

    private static ObjectNode envelope(ObjectMapper objectMapper, JsonNode id) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("jsonrpc", "2.0");
        if (id == null) {
            envelope.putNull("id");
        } else {
            envelope.set("id", id);
        }
        return envelope;
    }
}
