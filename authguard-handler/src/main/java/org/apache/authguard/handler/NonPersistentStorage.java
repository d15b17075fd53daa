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
 * In-memory {@link IdentityStorage} that lives as long as the owning service.
 */
public class NonPersistentStorage implements IdentityStorage {

    private volatile Principal principal;

    @Override
    public boolean isEmpty() {
        return principal == null;
    }

    @Override
    public Principal read() {
        return principal;
    }

    @Override
    public void write(Principal principal) {
        this.principal = principal;
    }

    @Override
    public void clear() {
        principal = null;
    }
}
