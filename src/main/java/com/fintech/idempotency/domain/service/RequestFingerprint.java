package com.fintech.idempotency.domain.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of a serialized request body.
 *
 * Works on the exact bytes it is given: two serializations of the same logical
 * payload (field order, whitespace) produce different fingerprints. Callers that
 * need canonical comparison must canonicalize before hashing.
 */
public class RequestFingerprint {

    private static final String ALGORITHM = "SHA-256";
    private static final byte[] EMPTY = new byte[0];

    public String of(byte[] rawBody) {
        MessageDigest digest = newDigest();
        return HexFormat.of().formatHex(digest.digest(rawBody == null ? EMPTY : rawBody));
    }

    public String of(String rawBody) {
        return of(rawBody == null ? EMPTY : rawBody.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
