package me.golemcore.agent.adapter.inbound.stdio;

import me.golemcore.agent.port.outbound.McpErrorCodes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonRpcLineLoopTest {

    private static final String PARSE_ERROR_LINE = "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final JsonRpcLineLoop.Handler echoHandler = request -> JsonRpcLineLoop.result(objectMapper,
            request.get("id"), request.path("params"));

    @Test
    void shouldAnswerMalformedLineAndKeepReading() throws Exception {
        List<String> out = run(echoHandler,
                "this is not json",
                "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"echo\",\"params\":{\"x\":1}}");

        assertEquals(2, out.size());
        assertEquals(PARSE_ERROR_LINE, out.get(0));
        JsonNode second = objectMapper.readTree(out.get(1));
        assertEquals(7, second.get("id").asInt());
        assertEquals(1, second.path("result").path("x").asInt());
    }

    @Test
    void shouldIgnoreBlankLines() {
        List<String> out = run(echoHandler, "", "   ", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"m\"}");

        assertEquals(1, out.size());
    }

    @Test
    void shouldRejectNonObjectJson() throws Exception {
        List<String> out = run(echoHandler, "[1,2,3]");

        JsonNode response = objectMapper.readTree(out.get(0));
        assertTrue(response.get("id").isNull());
        assertEquals(McpErrorCodes.INVALID_REQUEST, response.path("error").path("code").asInt());
    }

    @Test
    void shouldTurnHandlerExceptionIntoInternalError() throws Exception {
        JsonRpcLineLoop.Handler failing = request -> {
            throw new IllegalStateException("boom");
        };

        List<String> out = run(failing, "{\"jsonrpc\":\"2.0\",\"id\":\"req-1\",\"method\":\"m\"}");

        JsonNode response = objectMapper.readTree(out.get(0));
        assertEquals("req-1", response.get("id").asText());
        assertEquals(McpErrorCodes.INTERNAL_ERROR, response.path("error").path("code").asInt());
        assertEquals("boom", response.path("error").path("message").asText());
    }

    @Test
    void shouldWriteNothingWhenHandlerReturnsNull() {
        List<String> out = run(request -> null, "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

        assertTrue(out.isEmpty());
    }

    @Test
    void shouldBeClosedAfterEndOfInput() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        JsonRpcLineLoop loop = new JsonRpcLineLoop("test", input(), output, objectMapper, echoHandler);

        loop.run();

        assertEquals(JsonRpcLineLoop.State.CLOSED, loop.getState());
    }

    @Test
    void shouldFinishAfterEndOfInputWhenChannelBacksUp() throws Exception {
        String[] lines = new String[200];
        for (int i = 0; i < lines.length; i++) {
            lines[i] = "{\"jsonrpc\":\"2.0\",\"id\":" + i + ",\"method\":\"m\"}";
        }
        JsonRpcLineLoop.Handler slowHandler = request -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return echoHandler.handle(request);
        };
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        JsonRpcLineLoop loop = new JsonRpcLineLoop("test", input(lines), output, objectMapper, slowHandler);

        Thread loopThread = new Thread(loop::run, "line-loop-test");
        loopThread.start();
        loopThread.join(10_000);

        assertFalse(loopThread.isAlive());
        assertEquals(200, nonEmptyLines(output).size());
    }

    @Test
    void shouldStopOnCloseWhileWaitingForInput() throws Exception {
        PipedOutputStream host = new PipedOutputStream();
        PipedInputStream input = new PipedInputStream(host);
        JsonRpcLineLoop loop = new JsonRpcLineLoop("test", input, new ByteArrayOutputStream(), objectMapper,
                echoHandler);

        Thread loopThread = new Thread(loop::run, "line-loop-test");
        loopThread.start();
        Thread.sleep(100);
        loop.close();
        loopThread.join(5_000);

        assertFalse(loopThread.isAlive());
        assertEquals(JsonRpcLineLoop.State.CLOSED, loop.getState());
        host.close();
    }

    @Test
    void shouldStayClosedWhenClosedDuringDispatch() throws Exception {
        PipedOutputStream host = new PipedOutputStream();
        PipedInputStream input = new PipedInputStream(host);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        JsonRpcLineLoop[] holder = new JsonRpcLineLoop[1];
        JsonRpcLineLoop.Handler closingHandler = request -> {
            holder[0].close();
            return echoHandler.handle(request);
        };
        holder[0] = new JsonRpcLineLoop("test", input, output, objectMapper, closingHandler);

        Thread loopThread = new Thread(holder[0]::run, "line-loop-test");
        loopThread.start();
        host.write("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"m\"}\n".getBytes(StandardCharsets.UTF_8));
        host.flush();
        loopThread.join(5_000);

        assertFalse(loopThread.isAlive());
        assertEquals(JsonRpcLineLoop.State.CLOSED, holder[0].getState());
        assertTrue(nonEmptyLines(output).isEmpty());
        host.close();
    }

    private List<String> run(JsonRpcLineLoop.Handler handler, String... lines) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (JsonRpcLineLoop loop = new JsonRpcLineLoop("test", input(lines), output, objectMapper, handler)) {
            loop.run();
        }
        return nonEmptyLines(output);
    }

    static ByteArrayInputStream input(String... lines) {
        String text = lines.length == 0 ? "" : String.join("\n", lines) + "\n";
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    static List<String> nonEmptyLines(ByteArrayOutputStream output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.toString(StandardCharsets.UTF_8).split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
