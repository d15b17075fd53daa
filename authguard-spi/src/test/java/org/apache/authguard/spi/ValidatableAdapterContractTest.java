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

import org.apache.authguard.AuthenticationResult;
import org.apache.authguard.BasicPrincipal;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Contract tests for {@link ValidatableAdapter} implementations built on
 * {@link AbstractValidatableAdapter}.
 */
@DisplayName("ValidatableAdapter Contract Tests")
class ValidatableAdapterContractTest {

    private EchoAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new EchoAdapter();
    }

    @Test
    @DisplayName("UT-SPI-VA-001: Adapter name defaults to the simple class name")
    void testDefaultName() {
        Assertions.assertEquals("EchoAdapter", adapter.name());
    }

    @Test
    @DisplayName("UT-SPI-VA-002: Identity and credential start unset")
    void testInitialState() {
        Assertions.assertNull(adapter.getIdentity());
        Assertions.assertNull(adapter.getCredential());
    }

    @Test
    @DisplayName("UT-SPI-VA-003: Identity and credential are used by the next attempt")
    void testAuthenticateUsesSuppliedValues() throws Exception {
        // Given
        adapter.setIdentity("alice");
        adapter.setCredential("secret");

        // When
        AuthenticationResult result = adapter.authenticate();

        // Then
        Assertions.assertTrue(result.isValid());
        Assertions.assertEquals("alice", result.getIdentity());
    }

    @Test
    @DisplayName("UT-SPI-VA-004: Values can be replaced between attempts")
    void testValuesReplaced() throws Exception {
        adapter.setIdentity("alice");
        adapter.setCredential("secret");
        adapter.authenticate();

        adapter.setIdentity("bob");
        adapter.setCredential("wrong");
        AuthenticationResult result = adapter.authenticate();

        Assertions.assertFalse(result.isValid());
        Assertions.assertEquals(AuthenticationResult.FAILURE_CREDENTIAL_INVALID, result.getCode());
        Assertions.assertEquals("bob", result.getIdentity());
    }

    /**
     * Accepts any identity whose credential is "secret".
     */
    private static class EchoAdapter extends AbstractValidatableAdapter {

        @Override
        public AuthenticationResult authenticate() {
            if ("secret".equals(getCredential())) {
                return AuthenticationResult.success(BasicPrincipal.builder()
                        .name(getIdentity())
                        .authenticator(name())
                        .build());
            }
            return AuthenticationResult.failure(AuthenticationResult.FAILURE_CREDENTIAL_INVALID, getIdentity());
        }
    }
}
