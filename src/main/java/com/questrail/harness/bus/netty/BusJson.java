package com.questrail.harness.bus.netty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.questrail.harness.bus.BusMessage;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON body encoding of {@link BusMessage} frames.
 */
final class BusJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private BusJson() {
    }

    static byte[] write(BusMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return MAPPER.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bus message " + message.type(), e);
        }
    }

    static BusMessage read(byte[] body) {
        Objects.requireNonNull(body, "body");
        try {
            return MAPPER.readValue(body, BusMessage.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed bus message", e);
        }
    }
}
