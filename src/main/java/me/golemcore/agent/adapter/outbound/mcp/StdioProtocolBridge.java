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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * JSON-RPC over a line-oriented subprocess stream.
 *
 * <p>
 * One call writes one serialized envelope line to the child's stdin and then
 * waits for the response line with the same id on its stdout. A reader thread
 * moves stdout lines into a bounded queue; the caller blocks on that queue for
 * at most the configured timeout. Malformed lines, notifications and responses
 * for other ids are logged and skipped.
 */
@Slf4j
public class StdioProtocolBridge extends AbstractProtocolBridge {

    private static final int LINE_QUEUE_CAPACITY = 64;
    private static final String END_OF_STREAM = "\u0000EOF";

    private final String name;
    private final BufferedWriter writer;
    private final BlockingQueue<String> lines = new ArrayBlockingQueue<>(LINE_QUEUE_CAPACITY);
    private final Duration timeout;
    private final Runnable onClose;
    private final Thread readerThread;

    private volatile boolean running = true;
    private volatile boolean outputClosed;

    public StdioProtocolBridge(String name, InputStream serverOutput, OutputStream serverInput,
            ObjectMapper objectMapper, Duration timeout, Runnable onClose) {
        super(objectMapper);
        this.name = name;
        this.timeout = timeout;
        this.onClose = onClose;
        this.writer = new BufferedWriter(new OutputStreamWriter(serverInput, StandardCharsets.UTF_8));

        this.readerThread = new Thread(() -> readLoop(serverOutput), "mcp-stdio-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();
    }

    /**
     * Starts the server process through the shell and attaches a bridge to its
     * standard streams. Stderr is drained to the DEBUG log.
     */
    public static StdioProtocolBridge launch(String command, Map<String, String> env, ObjectMapper objectMapper,
            Duration timeout) throws IOException {
        log.info("[MCP:stdio] Starting server: {}", command);

        ProcessBuilder pb = new ProcessBuilder(List.of("/bin/sh", "-c", command));
        pb.redirectErrorStream(false);
        if (env != null) {
            pb.environment().putAll(env);
        }
        Process process = pb.start();

        Thread stderrThread = new Thread(() -> drainStderr(process), "mcp-stdio-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();

        return new StdioProtocolBridge(command, process.getInputStream(), process.getOutputStream(), objectMapper,
                timeout, () -> destroy(process));
    }

    @Override
    public String transportName() {
        return "stdio";
    }

    @Override
    protected JsonNode exchange(int id, ObjectNode request) throws McpException {
        if (outputClosed) {
            throw new McpTransportException(McpErrorCodes.CONNECTION_FAILED, "Server process closed its output");
        }
        writeLine(serialize(request));

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            String line = pollLine(deadline);
            if (END_OF_STREAM.equals(line)) {
                outputClosed = true;
                throw new McpTransportException(McpErrorCodes.CONNECTION_FAILED, "Server process closed its output");
            }
            JsonNode message = parseLine(line);
            if (message == null) {
                continue;
            }
            JsonNode idNode = message.get("id");
            if (idNode == null || idNode.isNull()) {
                String method = message.path("method").asText("unknown");
                log.debug("[MCP:stdio] Server notification: {}", method);
                continue;
            }
            if (!idNode.canConvertToInt() || idNode.asInt() != id) {
                log.warn("[MCP:stdio] Skipping response for unexpected id: {} (waiting for {})", idNode, id);
                continue;
            }
            return message;
        }
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        log.info("[MCP:stdio] Closing bridge {}", name);
        running = false;
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("[MCP:stdio] Error closing writer: {}", e.getMessage());
        }
        readerThread.interrupt();
        if (onClose != null) {
            onClose.run();
        }
    }

    private void writeLine(String json) throws McpTransportException {
        try {
            synchronized (writer) {
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            throw new McpTransportException(McpErrorCodes.CONNECTION_FAILED,
                    "Failed to write to server process: " + e.getMessage(), e);
        }
    }

    private String pollLine(long deadlineNanos) throws McpTransportException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new McpTransportException(McpErrorCodes.TIMEOUT, "Request timed out");
        }
        try {
            String line = lines.poll(remaining, TimeUnit.NANOSECONDS);
            if (line == null) {
                throw new McpTransportException(McpErrorCodes.TIMEOUT, "Request timed out");
            }
            return line;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpTransportException(McpErrorCodes.CONNECTION_FAILED, "Interrupted while waiting for response",
                    e);
        }
    }

    private JsonNode parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        log.debug("[MCP:stdio] ← {}", trimmed);
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (!node.isObject()) {
                log.warn("[MCP:stdio] Skipping non-object line: {}", trimmed);
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            log.warn("[MCP:stdio] Skipping malformed line: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void readLoop(InputStream serverOutput) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(serverOutput, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                lines.put(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:stdio] Reader error: {}", e.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            lines.put(END_OF_STREAM);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void drainStderr(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:stdio] stderr: {}", line);
            }
        } catch (IOException e) {
            log.debug("[MCP:stdio] Stderr drain ended: {}", e.getMessage());
        }
    }

    private static void destroy(Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
