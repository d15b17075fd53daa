// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.authguard.plugin.password;

import org.mindrot.jbcrypt.BCrypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Optional;

/**
 * Password hashing utility supporting multiple algorithms.
 *
 * <p>Stored hashes carry their algorithm in a prefix:
 * <ul>
 *   <li>BCrypt - {@code $2a$}, {@code $2b$} or {@code $2y$} (default)</li>
 *   <li>SHA-256 - {@code {SHA256}} followed by the base64 digest</li>
 *   <li>PLAIN - {@code {PLAIN}} followed by the password, for tests only</li>
 * </ul>
 */
public final class PasswordHasher {

    private static final int BCRYPT_LOG_ROUNDS = 10;

    /**
     * Hash algorithm enumeration.
     */
    public enum Algorithm {
        BCRYPT("$2") {
            @Override
            String encode(String plainPassword) {
                return BCrypt.hashpw(plainPassword, BCrypt.gensalt(BCRYPT_LOG_ROUNDS));
            }

            @Override
            boolean matches(String plainPassword, String hashedPassword) {
                try {
                    return BCrypt.checkpw(plainPassword, hashedPassword);
                } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
                    // malformed or truncated salt
                    return false;
                }
            }
        },
        SHA256("{SHA256}") {
            @Override
            String encode(String plainPassword) {
                return prefix() + sha256(plainPassword);
            }

            @Override
            boolean matches(String plainPassword, String hashedPassword) {
                return constantTimeEquals(encode(plainPassword), hashedPassword);
            }
        },
        PLAIN("{PLAIN}") {
            @Override
            String encode(String plainPassword) {
                return prefix() + plainPassword;
            }

            @Override
            boolean matches(String plainPassword, String hashedPassword) {
                return constantTimeEquals(encode(plainPassword), hashedPassword);
            }
        };

        private final String prefix;

        Algorithm(String prefix) {
            this.prefix = prefix;
        }

        String prefix() {
            return prefix;
        }

        abstract String encode(String plainPassword);

        abstract boolean matches(String plainPassword, String hashedPassword);
    }

    private PasswordHasher() {
    }

    /**
     * Hash a password with BCrypt.
     *
     * @param plainPassword plain text password
     * @return hashed password with algorithm prefix
     */
    public static String hash(String plainPassword) {
        return hash(plainPassword, Algorithm.BCRYPT);
    }

    /**
     * Hash a password with the given algorithm.
     *
     * @param plainPassword plain text password
     * @param algorithm hashing algorithm
     * @return hashed password with algorithm prefix
     */
    public static String hash(String plainPassword, Algorithm algorithm) {
        if (plainPassword == null) {
            throw new IllegalArgumentException("plainPassword cannot be null");
        }
        return algorithm.encode(plainPassword);
    }

    /**
     * Detect the algorithm of a stored hash.
     *
     * @param hashedPassword stored hash
     * @return the algorithm, or empty if the format is unknown
     */
    public static Optional<Algorithm> detectAlgorithm(String hashedPassword) {
        if (hashedPassword != null) {
            for (Algorithm algorithm : Algorithm.values()) {
                if (hashedPassword.startsWith(algorithm.prefix())) {
                    return Optional.of(algorithm);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Verify a password against a stored hash.
     *
     * @param plainPassword plain text password
     * @param hashedPassword stored hash with algorithm prefix
     * @return true if the password matches; false for null input or an unknown hash format
     */
    public static boolean verify(String plainPassword, String hashedPassword) {
        if (plainPassword == null) {
            return false;
        }
        return detectAlgorithm(hashedPassword)
                .map(algorithm -> algorithm.matches(plainPassword, hashedPassword))
                .orElse(false);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
