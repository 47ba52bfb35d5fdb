package com.jarvis.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;

/**
 * HMAC-SHA256 signing over the canonical JSON of a payload: map keys sorted,
 * no insignificant whitespace. Only the payload is covered.
 */
public class EnvelopeSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final ObjectMapper canonicalMapper;

    public EnvelopeSigner(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Signing secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.canonicalMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
    }

    public String canonicalJson(Map<String, ?> payload) {
        try {
            return canonicalMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    public String sign(Map<String, ?> payload) {
        return HexFormat.of().formatHex(hmac(canonicalJson(payload)));
    }

    /**
     * Constant-time check of {@code signature} against the payload. A missing,
     * malformed or non-hex signature is simply invalid.
     */
    public boolean verify(Map<String, ?> payload, String signature) {
        if (signature == null || signature.isEmpty() || (signature.length() % 2) != 0) {
            return false;
        }
        byte[] presented;
        try {
            presented = HexFormat.of().parseHex(signature.toLowerCase());
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] expected;
        try {
            expected = hmac(canonicalJson(payload));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(expected, presented);
    }

    private byte[] hmac(String canonical) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
