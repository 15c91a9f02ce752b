package com.ivyintel.tracker.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ivyintel.tracker.scrape.extract.ExtractionRecord;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of extraction records as stored in {@code extracted_data.data_json}.
 */
@Component
public class SnapshotPayloads {
    private final ObjectMapper objectMapper;

    public SnapshotPayloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ExtractionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode extraction record " + record.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses a stored payload; text that is not a JSON object comes back as {@code {"raw": text}}.
     */
    public JsonNode decode(String payload) {
        if (payload != null) {
            try {
                JsonNode node = objectMapper.readTree(payload);
                if (node != null && node.isObject()) {
                    return node;
                }
            } catch (JsonProcessingException ignored) {
                // Fall through to the opaque-text form.
            }
        }
        ObjectNode raw = objectMapper.createObjectNode();
        raw.put("raw", payload);
        return raw;
    }
}
