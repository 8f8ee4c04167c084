package com.purchasingpower.upmsync.service.unity;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Writes package.json / .asmdef content the way Unity itself formats them:
 * two-space indentation, {@code "key": value}, empty containers as {@code []} and
 * {@code {}}, LF line endings on every platform and a trailing newline.
 */
@Component
public class UnityJsonWriter {

    private final ObjectWriter writer = new ObjectMapper().writer(new UnityPrettyPrinter());

    public String write(Map<String, Object> content) {
        try {
            return writer.writeValueAsString(content) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content is not serializable as JSON", e);
        }
    }

    static final class UnityPrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        UnityPrettyPrinter() {
            indentObjectsWith(INDENTER);
            indentArraysWith(INDENTER);
            _objectFieldValueSeparatorWithSpaces = ": ";
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new UnityPrettyPrinter();
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (nrOfEntries == 0) {
                _nesting--;
                g.writeRaw('}');
                return;
            }
            super.writeEndObject(g, nrOfEntries);
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues == 0) {
                _nesting--;
                g.writeRaw(']');
                return;
            }
            super.writeEndArray(g, nrOfValues);
        }
    }
}
