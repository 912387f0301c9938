package com.clinical.phenotype.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.MapperFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content key of one task computation: SHA-256 over the canonical JSON of
 * (task, resolved parameters, scope). Map keys are sorted before hashing, so two
 * equal inputs always produce the same fingerprint regardless of insertion order.
 */
public record Fingerprint(String hex) {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public Fingerprint {
        Objects.requireNonNull(hex, "hex");
    }

    /**
     * Fingerprints a tree of maps, lists and scalars.
     */
    public static Fingerprint of(Object canonicalInput) {
        try {
            byte[] json = CANONICAL.writeValueAsBytes(canonicalInput);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new Fingerprint(HexFormat.of().formatHex(digest.digest(json)));
        } catch (JsonProcessingException e) {
            throw new CacheException("Cannot serialize fingerprint input", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String shortHex() {
        return hex.substring(0, Math.min(12, hex.length()));
    }

    @Override
    public String toString() {
        return shortHex();
    }
}
