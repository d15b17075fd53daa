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

import org.apache.authguard.AuthenticationException;
import org.apache.authguard.AuthenticationResult;
import org.apache.authguard.BasicPrincipal;
import org.apache.authguard.spi.AbstractValidatableAdapter;

import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Password authentication adapter.
 *
 * <p>Authenticates identities against password hashes held in memory (see {@link PasswordHasher}
 * for the supported formats). Outcomes:
 * <ul>
 *   <li>{@link AuthenticationResult#FAILURE_IDENTITY_NOT_FOUND} - no stored identity matches</li>
 *   <li>{@link AuthenticationResult#FAILURE_IDENTITY_AMBIGUOUS} - case-insensitive matching found
 *       more than one stored identity</li>
 *   <li>{@link AuthenticationResult#FAILURE_CREDENTIAL_INVALID} - empty or wrong credential</li>
 *   <li>{@link AuthenticationResult#SUCCESS} - principal named after the stored identity</li>
 * </ul>
 *
 * <p>Configuration properties, for {@link #fromProperties(Map)}:
 * <ul>
 *   <li><b>user.&lt;identity&gt;</b> - stored password hash of the identity</li>
 *   <li><b>identity.case_insensitive</b> - match identities ignoring case, default: false</li>
 * </ul>
 */
public class PasswordAdapter extends AbstractValidatableAdapter {

    private static final Logger LOG = LogManager.getLogger(PasswordAdapter.class);

    private static final String ADAPTER_NAME = "password";

    // Configuration keys
    static final String CONFIG_USER_PREFIX = "user.";
    static final String CONFIG_CASE_INSENSITIVE = "identity.case_insensitive";

    static final String ATTRIBUTE_HASH_ALGORITHM = "hash.algorithm";

    private final Map<String, String> passwordHashes;
    private final boolean caseInsensitiveIdentity;

    public PasswordAdapter(Map<String, String> passwordHashes) {
        this(passwordHashes, false);
    }

    /**
     * Create an adapter.
     *
     * @param passwordHashes identity to stored password hash
     * @param caseInsensitiveIdentity whether identities are matched ignoring case
     */
    public PasswordAdapter(Map<String, String> passwordHashes, boolean caseInsensitiveIdentity) {
        Objects.requireNonNull(passwordHashes, "passwordHashes");
        this.passwordHashes = Collections.unmodifiableMap(new LinkedHashMap<>(passwordHashes));
        this.caseInsensitiveIdentity = caseInsensitiveIdentity;
    }

    /**
     * Create an adapter from configuration properties.
     *
     * @param properties adapter properties
     * @return configured adapter
     * @throws AuthenticationException if a stored hash has an unknown format
     */
    public static PasswordAdapter fromProperties(Map<String, String> properties) throws AuthenticationException {
        Map<String, String> hashes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            if (!entry.getKey().startsWith(CONFIG_USER_PREFIX)) {
                continue;
            }
            String identity = entry.getKey().substring(CONFIG_USER_PREFIX.length());
            if (identity.isEmpty()) {
                throw new AuthenticationException("Empty identity in property: " + entry.getKey());
            }
            if (!PasswordHasher.detectAlgorithm(entry.getValue()).isPresent()) {
                throw new AuthenticationException("Unsupported password hash format for identity: " + identity);
            }
            hashes.put(identity, entry.getValue());
        }
        boolean caseInsensitive = Boolean.parseBoolean(properties.get(CONFIG_CASE_INSENSITIVE));
        LOG.info("Loaded {} password identities (case insensitive: {})", hashes.size(), caseInsensitive);
        return new PasswordAdapter(hashes, caseInsensitive);
    }

    @Override
    public String name() {
        return ADAPTER_NAME;
    }

    public boolean isCaseInsensitiveIdentity() {
        return caseInsensitiveIdentity;
    }

    @Override
    public AuthenticationResult authenticate() throws AuthenticationException {
        String identity = getIdentity();
        if (Strings.isNullOrEmpty(identity)) {
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_IDENTITY_NOT_FOUND, identity,
                    "Identity is required");
        }

        List<String> matches = findIdentities(identity);
        if (matches.isEmpty()) {
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_IDENTITY_NOT_FOUND, identity,
                    "Identity not found: " + identity);
        }
        if (matches.size() > 1) {
            LOG.warn("Identity '{}' matches {} stored identities", identity, matches.size());
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_IDENTITY_AMBIGUOUS, identity,
                    "More than one stored identity matches: " + identity);
        }

        String storedIdentity = matches.get(0);
        String storedHash = passwordHashes.get(storedIdentity);
        PasswordHasher.Algorithm algorithm = PasswordHasher.detectAlgorithm(storedHash)
                .orElseThrow(() -> new AuthenticationException(
                        "Unsupported password hash format for identity: " + storedIdentity));

        String credential = getCredential();
        if (Strings.isNullOrEmpty(credential)) {
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_CREDENTIAL_INVALID, identity,
                    "Credential is required");
        }
        if (!PasswordHasher.verify(credential, storedHash)) {
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_CREDENTIAL_INVALID, identity,
                    "Supplied credential is invalid");
        }

        if (algorithm != PasswordHasher.Algorithm.BCRYPT) {
            LOG.info("Password of identity '{}' is stored as {}, consider rehashing with BCRYPT",
                    storedIdentity, algorithm);
        }
        return AuthenticationResult.success(BasicPrincipal.builder()
                .name(storedIdentity)
                .authenticator(name())
                .attribute(ATTRIBUTE_HASH_ALGORITHM, algorithm.name())
                .build());
    }

    private List<String> findIdentities(String identity) {
        if (!caseInsensitiveIdentity) {
            return passwordHashes.containsKey(identity)
                    ? Collections.singletonList(identity)
                    : Collections.emptyList();
        }
        String wanted = identity.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String stored : passwordHashes.keySet()) {
            if (stored.toLowerCase(Locale.ROOT).equals(wanted)) {
                matches.add(stored);
            }
        }
        return matches;
    }
}
