package com.acme.compute.eventlog.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared JSON writer for event lines and metrics lines.
 *
 * <p>Non-ASCII characters are escaped so driver messages in any encoding keep
 * the emitted lines plain ASCII.</p>
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
        .build();

    private JsonCodec() {
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }
}
