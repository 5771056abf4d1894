package com.dataplatform.acquisition.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON encoding of cached values, gzip-compressed above a size threshold.
 */
public class PayloadCodec {

    public record Encoded(byte[] bytes, boolean compressed) {}

    private final ObjectMapper objectMapper;
    private final int compressionThresholdBytes;

    public PayloadCodec(ObjectMapper objectMapper, int compressionThresholdBytes) {
        this.objectMapper = objectMapper;
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    public Encoded encode(JsonNode value) {
        byte[] raw;
        try {
            raw = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serialisable", e);
        }
        if (raw.length <= compressionThresholdBytes) {
            return new Encoded(raw, false);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length / 4);
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip failed", e);
        }
        return new Encoded(out.toByteArray(), true);
    }

    public JsonNode decode(byte[] bytes, boolean compressed) {
        try {
            if (!compressed) {
                return objectMapper.readTree(bytes);
            }
            try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
                return objectMapper.readTree(gzip);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt cache payload", e);
        }
    }
}
