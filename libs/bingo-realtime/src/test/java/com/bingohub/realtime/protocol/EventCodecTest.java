package com.bingohub.realtime.protocol;

import com.bingohub.realtime.protocol.payload.NumberCalledPayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class EventCodecTest {

    @Test
    void encodedEnvelopeDecodesWithTypedPayload() {
        String raw = EventCodec.encode(EventEnvelope.of(EventType.NUMBER_CALLED, "s1",
                new NumberCalledPayload(23, List.of(7, 23), "s1", 99L, 1L), 99L));

        EventEnvelope env = EventCodec.decode(raw).orElseThrow();
        assertSame(EventType.NUMBER_CALLED, env.eventType());
        assertEquals("s1", env.getSessionId());
        NumberCalledPayload p = env.payloadAs(NumberCalledPayload.class);
        assertEquals(23, p.getNumber());
        assertEquals(List.of(7, 23), p.getCalledNumbers());
        assertEquals(1L, p.getGeneration());
    }

    @Test
    void junkIsDropped() {
        assertFalse(EventCodec.decode(null).isPresent());
        assertFalse(EventCodec.decode("  ").isPresent());
        assertFalse(EventCodec.decode("{oops").isPresent());
        assertFalse(EventCodec.decode("{\"v\":2,\"type\":\"heartbeat\",\"sessionId\":\"s1\",\"ts\":1}").isPresent());
        assertFalse(EventCodec.decode("{\"v\":1,\"type\":\"fireworks\",\"sessionId\":\"s1\",\"ts\":1}").isPresent());
    }
}
