package com.library.lending.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Compares credential secrets the way the directory stores them: verbatim after trimming
 * surrounding whitespace from both sides.
 */
final class CredentialMatcher {

    private CredentialMatcher() {}

    static boolean matches(String stored, String supplied) {
        if (stored == null || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
            stored.trim().getBytes(StandardCharsets.UTF_8),
            supplied.trim().getBytes(StandardCharsets.UTF_8));
    }
}
