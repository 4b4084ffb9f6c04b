package io.jobs4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PayloadCodecTest {

    public static class Campaign {
        public String campaignId;
        public List<String> channels;
    }

    private final PayloadCodec codec = new PayloadCodec(new ObjectMapper());

    @Test
    void toStoredShouldProducePlainValues() {
        Campaign c = new Campaign();
        c.campaignId = "c-42";
        c.channels = List.of("email", "sms");

        Object stored = codec.toStored(c);

        assertEquals(Map.of("campaignId", "c-42", "channels", List.of("email", "sms")), stored);
    }

    @Test
    void fromStoredShouldBindToPayloadType() {
        Campaign c = codec.fromStored(Map.of("campaignId", "c-7", "channels", List.of("push")), Campaign.class);

        assertEquals("c-7", c.campaignId);
        assertEquals(List.of("push"), c.channels);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fromStoredShouldCopyForObjectType() {
        Map<String, Object> stored = new HashMap<>();
        stored.put("cursor", "page-1");
        stored.put("ids", new ArrayList<>(List.of(1, 2)));

        Map<String, Object> bound = (Map<String, Object>) codec.fromStored(stored, Object.class);
        assertEquals(stored, bound);
        assertNotSame(stored, bound);

        bound.put("cursor", "page-99");
        ((List<Object>) bound.get("ids")).add(3);

        assertEquals("page-1", stored.get("cursor"));
        assertEquals(List.of(1, 2), stored.get("ids"));
        assertNull(codec.fromStored(null, Campaign.class));
    }

    @Test
    void mismatchedShapeShouldBeInvalidPayload() {
        assertThrows(InvalidPayloadException.class, () -> codec.fromStored("not-an-object", Campaign.class));
        assertThrows(InvalidPayloadException.class, () -> codec.fromStored(Map.of("unknownField", 1), Campaign.class));
    }
}
