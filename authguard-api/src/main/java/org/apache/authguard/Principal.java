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

import java.util.Collections;
import java.util.Map;

/**
 * Represents an authenticated principal (user identity).
 *
 * <p>The Principal represents WHO the user is. It is produced by an authentication adapter on
 * success and kept by the authentication service as the current identity.
 */
public interface Principal {

    /**
     * Returns the name of this principal, typically the identity that was authenticated.
     *
     * @return the name of this principal
     */
    String getName();

    /**
     * Returns the name of the adapter that authenticated this principal.
     *
     * @return the authenticator name (e.g., "password")
     */
    String getAuthenticator();

    /**
     * Returns additional attributes about the principal.
     *
     * @return map of attribute names to values
     */
    default Map<String, String> getAttributes() {
        return Collections.emptyMap();
    }
}
