package admit.java.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitResponsesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testBody_carriesCodeAndSeconds() {
        RejectionBody body = RateLimitResponses.body(42L);

        assertEquals("RATE_LIMITED", body.error());
        assertEquals(42L, body.retryAfterSeconds());
        assertTrue(body.message().contains("42s"));
        assertTrue(body.message().contains("too fast"));
    }

    @Test
    void testJson_hasExactlyThreeFields() throws Exception {
        JsonNode json = mapper.readTree(RateLimitResponses.toJson(RateLimitResponses.body(7L)));

        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);

        assertEquals(List.of("error", "message", "retryAfterSeconds"), fields);
        assertEquals("RATE_LIMITED", json.get("error").asText());
        assertEquals(7L, json.get("retryAfterSeconds").asLong());
        assertTrue(json.get("retryAfterSeconds").isIntegralNumber());
        assertTrue(json.get("message").asText().contains("7s"));
    }

    @Test
    void testBody_rejectsNegativeSeconds() {
        assertThrows(IllegalArgumentException.class, () -> RateLimitResponses.body(-1L));
    }
}
