package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hashing and constant-time comparison of caller credentials.
 */
public final class OwnerHashSupport {

    private static final String ALGORITHM = "SHA-256";

    private OwnerHashSupport() {
    }

    /**
     * Lower-case hex SHA-256 of the credential.
     */
    public static String hash(String credential) {
        if (credential == null) {
            throw new IllegalArgumentException("credential is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(credential.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Whether {@code credential} hashes to {@code storedHash}. Compares in
     * constant time.
     */
    public static boolean matches(String storedHash, String credential) {
        if (storedHash == null || credential == null) {
            return false;
        }
        byte[] expected = storedHash.getBytes(StandardCharsets.UTF_8);
        byte[] provided = hash(credential).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, provided);
    }

    public static boolean hasCredential(String credential) {
        return credential != null && !credential.isBlank();
    }
}
