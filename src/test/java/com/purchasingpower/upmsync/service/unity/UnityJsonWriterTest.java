package com.purchasingpower.upmsync.service.unity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Unity JSON Writer Tests")
class UnityJsonWriterTest {

    @Test
    @DisplayName("Should write two-space indented JSON with LF endings and compact empty containers")
    void write_unityFormat() {
        // Given
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("name", "Acme.Lib");
        content.put("references", List.of());
        content.put("allowUnsafeCode", false);
        content.put("keywords", List.of("a", "b"));
        content.put("dependencies", Map.of());

        // When
        String json = new UnityJsonWriter().write(content);

        // Then
        assertEquals("{\n"
                + "  \"name\": \"Acme.Lib\",\n"
                + "  \"references\": [],\n"
                + "  \"allowUnsafeCode\": false,\n"
                + "  \"keywords\": [\n"
                + "    \"a\",\n"
                + "    \"b\"\n"
                + "  ],\n"
                + "  \"dependencies\": {}\n"
                + "}\n", json);
    }
}
