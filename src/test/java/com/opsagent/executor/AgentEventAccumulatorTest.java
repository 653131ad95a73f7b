package com.opsagent.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentEventAccumulatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AgentEventAccumulator accumulator;

    @BeforeEach
    void setUp() {
        accumulator = new AgentEventAccumulator();
    }

    private AgentEvent event(String json) throws Exception {
        return objectMapper.readValue(json, AgentEvent.class);
    }

    @Test
    void testAgentMessagesBecomeOutput() throws Exception {
        assertTrue(accumulator.fold(event("{\"type\":\"item.completed\",\"item\":{\"type\":\"agent_message\",\"text\":\"first\"}}")));
        assertTrue(accumulator.fold(event("{\"type\":\"item.completed\",\"item\":{\"type\":\"agent_message\",\"text\":\"second\"}}")));

        assertEquals("first\nsecond", accumulator.finalOutput());
        assertTrue(accumulator.progressLog().contains("📝 Response ready (5 chars)"));
    }

    @Test
    void testReasoningIsFallbackOutput() throws Exception {
        accumulator.fold(event("{\"type\":\"item.completed\",\"item\":{\"type\":\"reasoning\",\"text\":\"thinking hard\"}}"));

        assertEquals("thinking hard", accumulator.finalOutput());
        assertEquals("🤔 thinking hard", accumulator.progressLog());
    }

    @Test
    void testCommandExecutionLines() throws Exception {
        accumulator.fold(event("{\"type\":\"item.completed\",\"item\":{\"type\":\"command_execution\","
                + "\"command\":\"uptime\",\"aggregated_output\":\"up 3 days\",\"status\":\"completed\"}}"));
        accumulator.fold(event("{\"type\":\"item.completed\",\"item\":{\"type\":\"command_execution\","
                + "\"command\":\"false\",\"status\":\"failed\"}}"));

        String progress = accumulator.progressLog();
        assertTrue(progress.contains("✅ Ran: uptime\nOutput:\nup 3 days"));
        assertTrue(progress.contains("❌ Failed: false"));
    }

    @Test
    void testErrorsAreCollected() throws Exception {
        assertFalse(accumulator.fold(event("{\"type\":\"error\",\"message\":\"quota exceeded\"}")));

        assertEquals(1, accumulator.errorMessages().size());
        assertEquals("quota exceeded", accumulator.errorMessages().get(0));
        assertTrue(accumulator.progressLog().contains("❌ Error: quota exceeded"));
    }

    @Test
    void testUsageAndThreadId() throws Exception {
        accumulator.fold(event("{\"type\":\"thread.started\",\"thread_id\":\"abc-123\"}"));
        accumulator.fold(event("{\"type\":\"turn.completed\",\"usage\":{\"input_tokens\":100,\"cached_input_tokens\":40,\"output_tokens\":20}}"));
        accumulator.fold(event("{\"type\":\"turn.completed\",\"usage\":{\"input_tokens\":200,\"output_tokens\":30}}"));

        assertEquals("abc-123", accumulator.threadId());
        assertEquals(230, accumulator.tokensUsed());
        assertEquals(3, accumulator.eventCount());
    }

    @Test
    void testUnknownEventsAreIgnored() throws Exception {
        assertFalse(accumulator.fold(event("{\"type\":\"turn.started\"}")));
        assertFalse(accumulator.fold(event("{\"item\":{\"type\":\"agent_message\",\"text\":\"no type\"}}")));

        assertEquals("", accumulator.finalOutput());
        assertEquals("", accumulator.progressLog());
    }
}
