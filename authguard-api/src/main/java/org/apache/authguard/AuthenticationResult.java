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

package org.apache.authguard;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single authentication attempt, produced by an authentication adapter.
 *
 * <p>The result is classified by an integer code. Positive codes mean success, zero and negative
 * codes mean failure. The built-in codes are exposed as constants, but the set is open: adapters
 * may return their own (typically negative) codes, and consumers are expected to degrade
 * gracefully when they meet a code they do not know.
 *
 * <p>Use the static factory methods to create instances:
 * <pre>{@code
 * // Success
 * return AuthenticationResult.success(principal);
 *
 * // Failure
 * return AuthenticationResult.failure(AuthenticationResult.FAILURE_CREDENTIAL_INVALID,
 *         identity, "Supplied credential is invalid");
 * }</pre>
 */
public final class AuthenticationResult {

    /** General failure. */
    public static final int FAILURE = 0;

    /** Failure due to identity not being found. */
    public static final int FAILURE_IDENTITY_NOT_FOUND = -1;

    /** Failure due to identity being ambiguous. */
    public static final int FAILURE_IDENTITY_AMBIGUOUS = -2;

    /** Failure due to invalid credential being supplied. */
    public static final int FAILURE_CREDENTIAL_INVALID = -3;

    /** Failure due to uncategorized reasons. */
    public static final int FAILURE_UNCATEGORIZED = -4;

    /** Authentication success. */
    public static final int SUCCESS = 1;

    private final int code;
    private final String identity;
    private final Principal principal;
    private final List<String> messages;

    private AuthenticationResult(int code, String identity, Principal principal, String[] messages) {
        this.code = code;
        this.identity = identity;
        this.principal = principal;
        this.messages = messages == null || messages.length == 0
                ? Collections.emptyList()
                : Collections.unmodifiableList(Arrays.asList(messages.clone()));
    }

    /**
     * Creates a successful authentication result.
     *
     * @param principal the authenticated principal
     * @param messages optional diagnostic messages
     * @return success result
     * @throws NullPointerException if principal is null
     */
    public static AuthenticationResult success(Principal principal, String... messages) {
        Objects.requireNonNull(principal, "principal is required for success");
        return new AuthenticationResult(SUCCESS, principal.getName(), principal, messages);
    }

    /**
     * Creates a failure result.
     *
     * @param code failure code, {@link #FAILURE} or below
     * @param identity the identity that failed to authenticate, may be null
     * @param messages optional diagnostic messages
     * @return failure result
     * @throws IllegalArgumentException if code denotes success
     */
    public static AuthenticationResult failure(int code, String identity, String... messages) {
        if (code > FAILURE) {
            throw new IllegalArgumentException("Failure result requires a code <= " + FAILURE + ", got: " + code);
        }
        return new AuthenticationResult(code, identity, null, messages);
    }

    /**
     * Creates a general failure result.
     *
     * @param identity the identity that failed to authenticate, may be null
     * @param message the diagnostic message
     * @return failure result with code {@link #FAILURE}
     */
    public static AuthenticationResult failure(String identity, String message) {
        return failure(FAILURE, identity, message);
    }

    /**
     * Returns the result code.
     *
     * @return the code, positive for success
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the identity used in the authentication attempt.
     *
     * @return the identity, or null if none was supplied
     */
    public String getIdentity() {
        return identity;
    }

    /**
     * Returns the principal as an Optional; present only on success.
     *
     * @return optional principal
     */
    public Optional<Principal> principal() {
        return Optional.ofNullable(principal);
    }

    /**
     * Returns diagnostic messages supplied by the adapter.
     *
     * @return immutable list of messages, empty if none
     */
    public List<String> getMessages() {
        return messages;
    }

    /**
     * Checks if authentication was successful.
     *
     * @return true if the code is positive
     */
    public boolean isValid() {
        return code > 0;
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "AuthenticationResult{SUCCESS, principal=" + principal.getName() + "}";
        }
        return "AuthenticationResult{FAILURE, code=" + code
                + ", identity=" + identity
                + (messages.isEmpty() ? "" : ", messages=" + messages)
                + "}";
    }
}
