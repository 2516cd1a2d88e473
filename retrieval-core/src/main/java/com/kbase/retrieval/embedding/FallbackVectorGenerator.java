package com.kbase.retrieval.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces stand-in vectors when no embedding model is reachable. The values are pseudo-random
 * in [-1, 1), seeded from the SHA-256 of the text so the same text always gets the same vector.
 * Such vectors carry no meaning; chunks stored with them are flagged as degraded.
 */
public class FallbackVectorGenerator {

    public List<Float> generate(String text, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Fallback vector needs a positive dimension, got " + dimensions);
        }
        Random rand = new Random(seedOf(text));
        List<Float> vector = new ArrayList<>(dimensions);
        for (int i = 0; i < dimensions; i++) {
            vector.add(rand.nextFloat() * 2 - 1);
        }
        return vector;
    }

    private long seedOf(String text) {
        String value = text != null ? text : "";
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return byteArrayToLong(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            return value.hashCode();
        }
    }

    private long byteArrayToLong(byte[] bytes) {
        long value = 0;
        for (int i = 0; i < Math.min(bytes.length, 8); i++) {
            value = (value << 8) + (bytes[i] & 0xff);
        }
        return value;
    }
}
