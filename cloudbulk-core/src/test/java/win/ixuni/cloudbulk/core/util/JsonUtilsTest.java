package win.ixuni.cloudbulk.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    @DisplayName("Pretty JSON writes instants as ISO-8601 strings")
    void testPrettyJson_IsoInstants() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("startedAt", Instant.parse("2024-05-01T10:15:30Z"));
        report.put("objects", 42);

        String json = JsonUtils.toPrettyJson(report);

        assertTrue(json.contains("\"startedAt\" : \"2024-05-01T10:15:30Z\""), json);
        assertTrue(json.contains("\"objects\" : 42"), json);
        assertTrue(json.lines().count() > 1, "expected indented output");
    }
}
