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

package org.apache.authguard.validator;

import org.apache.authguard.AuthenticationResult;
import org.apache.authguard.BasicPrincipal;
import org.apache.authguard.spi.AbstractValidatableAdapter;
import org.apache.authguard.spi.AuthenticationAdapter;

/**
 * Adapters with fixed outcomes, used by validator tests.
 */
final class AdapterFixtures {

    private AdapterFixtures() {
    }

    /**
     * Validatable adapter that returns a preset result code and counts its calls.
     */
    static class FixedCodeAdapter extends AbstractValidatableAdapter {

        private final int code;
        private int calls;

        FixedCodeAdapter() {
            this(AuthenticationResult.SUCCESS);
        }

        FixedCodeAdapter(int code) {
            this.code = code;
        }

        @Override
        public AuthenticationResult authenticate() {
            calls++;
            if (code > 0) {
                return AuthenticationResult.success(BasicPrincipal.builder()
                        .name(getIdentity())
                        .authenticator(name())
                        .build());
            }
            return AuthenticationResult.failure(code, getIdentity(), "Fixed failure " + code);
        }

        int getCalls() {
            return calls;
        }
    }

    /**
     * Adapter without identity/credential support; always succeeds.
     */
    static class SuccessAdapter implements AuthenticationAdapter {

        @Override
        public AuthenticationResult authenticate() {
            return AuthenticationResult.success(BasicPrincipal.builder()
                    .name("anonymous")
                    .authenticator(name())
                    .build());
        }
    }
}
