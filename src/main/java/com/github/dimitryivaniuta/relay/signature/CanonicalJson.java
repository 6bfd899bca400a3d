package com.github.dimitryivaniuta.relay.signature;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Serializer shared by signer and verifier: sorted object keys, sorted map entries, no whitespace,
 * ISO-8601 dates. Two JSON values that are equal as trees produce the same string.
 */
@Component
public class CanonicalJson {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .serializationInclusion(JsonInclude.Include.ALWAYS)
            .build();

    public String write(Object value) {
        try {
            // Tree round-trip sorts nested maps inside POJOs and JsonNodes too.
            Object tree = mapper.readValue(mapper.writeValueAsBytes(value), Object.class);
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable", e);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to canonicalize payload", e);
        }
    }

    /** Re-serializes raw JSON text canonically. */
    public String normalize(String json) {
        try {
            return write(mapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON", e);
        }
    }
}
