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

import org.apache.authguard.Principal;

/**
 * Storage for the identity authenticated by an {@link AuthenticationService}.
 */
public interface IdentityStorage {

    /**
     * Returns true if no identity is stored.
     *
     * @return true if storage is empty
     */
    boolean isEmpty();

    /**
     * Returns the stored identity.
     *
     * @return the principal, or null if storage is empty
     */
    Principal read();

    /**
     * Replaces the stored identity.
     *
     * @param principal the principal to store
     */
    void write(Principal principal);

    /**
     * Removes the stored identity.
     */
    void clear();
}
