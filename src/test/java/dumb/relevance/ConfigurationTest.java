package dumb.relevance;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigurationTest {

    @Test
    void bundledResourceMatchesDefaults() {
        assertEquals(Configuration.defaults(), Configuration.load());
    }

    @Test
    void missingKeysTakeDefaults() {
        var c = Configuration.load("relevance-partial.json");
        assertEquals(LogicSystem.E, c.defaultSystem());
        assertEquals(7, c.proofMaxDepth());
        assertEquals(0.5, c.relevanceThreshold());
        assertEquals(2000, c.proofMaxFormulas());
        assertEquals(1 << 16, c.assignmentLimit());
    }

    @Test
    void unreadableResourceFallsBackToDefaults() {
        assertEquals(Configuration.defaults(), Configuration.load("no-such-config.json"));
        assertEquals(Configuration.defaults(), Configuration.load("relevance-invalid.json"));
    }

    @Test
    void boundsAreChecked() {
        assertThrows(IllegalArgumentException.class, () -> new Configuration(LogicSystem.R, 1.5, 20, 2000, 10, 8, 5, 16));
        assertThrows(IllegalArgumentException.class, () -> new Configuration(LogicSystem.R, 0.5, 0, 2000, 10, 8, 5, 16));
        assertThrows(IllegalArgumentException.class, () -> new Configuration(LogicSystem.R, 0.5, 20, 2000, 10, 1, 5, 16));
    }

    @Test
    void jsonRoundTrip() throws JsonProcessingException {
        var c = Configuration.defaults().withDefaultSystem(LogicSystem.T);
        var json = c.toJson();
        assertEquals("T", json.get("defaultSystem").asText());
        assertEquals(c, Json.obj(json.toString(), Configuration.class));
    }
}
