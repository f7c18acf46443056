package me.wargame.mcp.domain.service;

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

/**
 * SHA-256 helpers for document fingerprints and identifiers.
 */
public final class HashSupport {

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final int SHORT_HASH_LEN = 12;

    private HashSupport() {
    }

    public static byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String value) {
        byte[] hash = sha256(value == null ? "" : value);
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            int v = b & 0xFF;
            builder.append(HEX[v >>> 4]).append(HEX[v & 0x0F]);
        }
        return builder.toString();
    }

    public static String shortHash(String value) {
        return sha256Hex(value).substring(0, SHORT_HASH_LEN);
    }

    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) ? Character.toLowerCase(c) : '-');
        }
        return sb.toString().replaceAll("-{2,}", "-").replaceAll("^-|-$", "");
    }
}
