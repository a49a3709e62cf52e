package me.golemcore.agent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolSearchResultParserTest {

    private final ToolSearchResultParser parser = new ToolSearchResultParser(new ObjectMapper());

    @Test
    void shouldReadToolsMemberOfSearchResult() {
        List<Map<String, Object>> tools = parser.parse("""
                {"query":"math","total_found":1,"tools":[
                  {"name":"calculator","description":"Math","inputSchema":{"type":"object"},
                   "_metadata":{"category":"utilities","score":3}}]}
                """);

        assertEquals(1, tools.size());
        assertEquals("calculator", tools.get(0).get("name"));
        assertTrue(tools.get(0).containsKey("_metadata"));
    }

    @Test
    void shouldAcceptBareArray() {
        List<Map<String, Object>> tools = parser.parse("[{\"name\":\"a\"},{\"name\":\"b\"},42]");

        assertEquals(2, tools.size());
    }

    @Test
    void shouldReadEachLineWhenSeveralBlocksWereJoined() {
        List<Map<String, Object>> tools = parser.parse("{\"tools\":[{\"name\":\"a\"}]}\n{\"tools\":[{\"name\":\"b\"}]}");

        assertEquals(2, tools.size());
        assertEquals("b", tools.get(1).get("name"));
    }

    @Test
    void shouldYieldNothingForUnparseableText() {
        assertTrue(parser.parse("Found these tools: calculator, echo").isEmpty());
        assertTrue(parser.parse("{\"query\":\"x\"}").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
