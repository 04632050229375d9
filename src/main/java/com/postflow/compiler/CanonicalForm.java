package com.postflow.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Serializes normalized rule documents to a canonical JSON string and hashes it.
 * Map keys are written in sorted order, so input key ordering never affects the output.
 */
public final class CanonicalForm {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);

    private CanonicalForm() {
    }

    public static String write(Map<String, Object> normalizedDocument) {
        try {
            return MAPPER.writeValueAsString(normalizedDocument);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Normalized rule document is not serializable", e);
        }
    }

    public static String sha256(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
