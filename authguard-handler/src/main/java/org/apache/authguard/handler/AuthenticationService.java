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

package org.apache.authguard.handler;

import org.apache.authguard.AuthenticationException;
import org.apache.authguard.AuthenticationResult;
import org.apache.authguard.AuthenticationRuntimeException;
import org.apache.authguard.Principal;
import org.apache.authguard.spi.AuthenticationAdapter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Authentication service - holds the current adapter and the authenticated identity.
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Keep a current {@link AuthenticationAdapter} that callers can share</li>
 *   <li>Run an authentication attempt through an adapter</li>
 *   <li>Replace the stored identity with the outcome of the latest attempt</li>
 * </ol>
 *
 * <p>The service never interprets result codes; a failed attempt simply leaves the storage empty.
 */
public class AuthenticationService {

    private static final Logger LOG = LogManager.getLogger(AuthenticationService.class);

    private AuthenticationAdapter adapter;
    private IdentityStorage storage;

    /**
     * Create a service with in-memory storage and no adapter.
     */
    public AuthenticationService() {
        this(new NonPersistentStorage(), null);
    }

    /**
     * Create a service.
     *
     * @param storage the identity storage
     * @param adapter the current adapter, may be null
     */
    public AuthenticationService(IdentityStorage storage, AuthenticationAdapter adapter) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.adapter = adapter;
    }

    public AuthenticationAdapter getAdapter() {
        return adapter;
    }

    public void setAdapter(AuthenticationAdapter adapter) {
        this.adapter = adapter;
    }

    public IdentityStorage getStorage() {
        return storage;
    }

    public void setStorage(IdentityStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * Authenticate using the current adapter.
     *
     * @return authentication result
     * @throws AuthenticationException if the adapter fails internally
     * @throws AuthenticationRuntimeException if no adapter is set
     */
    public AuthenticationResult authenticate() throws AuthenticationException {
        if (adapter == null) {
            throw new AuthenticationRuntimeException(
                    "An adapter must be set or passed prior to calling authenticate()");
        }
        return authenticate(adapter);
    }

    /**
     * Authenticate using the given adapter and store the resulting identity.
     *
     * <p>Once the adapter returns, any previously stored identity is cleared, so a failed attempt
     * leaves no identity. If the adapter throws, the stored identity is kept.
     *
     * @param adapter the adapter to authenticate with
     * @return authentication result, as returned by the adapter
     * @throws AuthenticationException if the adapter fails internally
     */
    public AuthenticationResult authenticate(AuthenticationAdapter adapter) throws AuthenticationException {
        Objects.requireNonNull(adapter, "adapter");
        AuthenticationResult result = adapter.authenticate();

        if (hasIdentity()) {
            clearIdentity();
        }

        if (result.isValid()) {
            Principal principal = result.principal().orElseThrow(() -> new AuthenticationException(
                    "Adapter " + adapter.name() + " reported success without a principal"));
            storage.write(principal);
            LOG.info("Stored identity '{}' authenticated by {}", principal.getName(), principal.getAuthenticator());
        } else {
            LOG.debug("Authentication through {} failed with code {}", adapter.name(), result.getCode());
        }
        return result;
    }

    /**
     * Check whether an identity is stored.
     *
     * @return true if an identity is available
     */
    public boolean hasIdentity() {
        return !storage.isEmpty();
    }

    /**
     * Get the stored identity.
     *
     * @return optional principal
     */
    public Optional<Principal> getIdentity() {
        return storage.isEmpty() ? Optional.empty() : Optional.ofNullable(storage.read());
    }

    /**
     * Remove the stored identity.
     */
    public void clearIdentity() {
        storage.clear();
        LOG.info("Cleared stored identity");
    }
}
