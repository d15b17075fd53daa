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

package org.apache.authguard.spi;

import org.apache.authguard.AuthenticationException;
import org.apache.authguard.AuthenticationResult;

/**
 * Authentication adapter interface.
 *
 * <p>An adapter performs the actual identity/credential check against some backing store.
 * All adapters (password table, directory, remote service etc.) implement this interface;
 * adapters that accept an identity and credential from the caller additionally implement
 * {@link ValidatableAdapter}.
 */
public interface AuthenticationAdapter {

    /**
     * Adapter name, used as the authenticator of the principals it produces.
     *
     * @return adapter name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Performs an authentication attempt.
     *
     * @return authentication result, carrying a failure code when the attempt failed
     * @throws AuthenticationException for internal adapter errors (e.g. misconfiguration,
     *         unreachable store). Expected failures (e.g. invalid credentials) are returned as a
     *         failed {@link AuthenticationResult} instead.
     */
    AuthenticationResult authenticate() throws AuthenticationException;
}
