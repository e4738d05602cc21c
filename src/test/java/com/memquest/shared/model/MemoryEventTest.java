package com.memquest.shared.model;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEventTest {

    @Test
    void generateIdIsDeterministic() {
        var a = MemoryEvent.generateId("t1", "u1", "a1", 1700000000.5, "abc");
        var b = MemoryEvent.generateId("t1", "u1", "a1", 1700000000.5, "abc");
        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    void timestampIsRenderedAsPlainDecimal() {
        assertEquals("1760000000.5", MemoryEvent.formatTs(1760000000.5));
        assertEquals("1760000000.0", MemoryEvent.formatTs(1760000000.0));
        assertEquals("1.25", MemoryEvent.formatTs(1.25));
        assertEquals("da954626cb922dc82ef5ae87b1c3ab2780925f58196e4881691d16f9fbdc2792",
                MemoryEvent.generateId("t1", "u1", "a1", 1760000000.5, "h"));
    }

    @Test
    void generateIdChangesWithEveryInput() {
        var base = MemoryEvent.generateId("t1", "u1", "a1", 1.0, "h");
        assertNotEquals(base, MemoryEvent.generateId("t2", "u1", "a1", 1.0, "h"));
        assertNotEquals(base, MemoryEvent.generateId("t1", "u2", "a1", 1.0, "h"));
        assertNotEquals(base, MemoryEvent.generateId("t1", "u1", "a2", 1.0, "h"));
        assertNotEquals(base, MemoryEvent.generateId("t1", "u1", "a1", 2.0, "h"));
        assertNotEquals(base, MemoryEvent.generateId("t1", "u1", "a1", 1.0, "g"));
    }

    @Test
    void contentHashIsSha256Hex() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                MemoryEvent.contentHash("hello"));
    }

    @Test
    void parsesWireFormat() throws IOException {
        var event = MemoryEvent.fromJson("""
            {"id": "e1", "agent_id": "a", "user_id": "u", "tenant_id": "t", "ts": 1700000000,
             "text": "I prefer tea", "tool_outputs": {"k": 1}, "tags": ["preference"], "pii_suspected": true}
            """);
        assertEquals("e1", event.id());
        assertEquals("a", event.agentId());
        assertEquals("u", event.userId());
        assertEquals("t", event.tenantId());
        assertEquals(1700000000.0, event.ts());
        assertEquals("I prefer tea", event.text());
        assertEquals("{\"k\":1}", event.toolOutputs());
        assertEquals(List.of("preference"), event.tags());
        assertTrue(event.piiSuspected());
    }

    @Test
    void missingOptionalFieldsTakeDefaults() throws IOException {
        double before = System.currentTimeMillis() / 1000.0;
        var event = MemoryEvent.fromJson("{\"text\": \"hello there\"}");
        assertEquals("", event.id());
        assertNull(event.toolOutputs());
        assertTrue(event.tags().isEmpty());
        assertFalse(event.piiSuspected());
        assertTrue(event.ts() >= before);
    }

    @Test
    void rejectsNonObjectPayloads() {
        assertThrows(IOException.class, () -> MemoryEvent.fromJson("[1,2,3]"));
        assertThrows(IOException.class, () -> MemoryEvent.fromJson("not json"));
    }

    @Test
    void toJsonIsReadBack() throws IOException {
        var event = MemoryEvent.of("a", "u", "t", "My favourite colour is green", List.of("fact"));
        var parsed = MemoryEvent.fromJson(event.toJson());
        assertEquals(event, parsed);
    }
}
