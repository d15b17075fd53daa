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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the exception types of the API module.
 */
@DisplayName("Authentication Exception Unit Tests")
class AuthenticationExceptionTest {

    @Test
    @DisplayName("UT-API-AE-001: Checked exception keeps message and cause")
    void testAuthenticationException_WithMessageAndCause() {
        // Given
        Throwable cause = new RuntimeException("Connection timeout");

        // When
        AuthenticationException exception = new AuthenticationException("Credential store unavailable", cause);

        // Then
        Assertions.assertInstanceOf(Exception.class, exception);
        Assertions.assertFalse(RuntimeException.class.isInstance(exception));
        Assertions.assertEquals("Credential store unavailable", exception.getMessage());
        Assertions.assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("UT-API-AE-002: Runtime exception is unchecked")
    void testAuthenticationRuntimeException() {
        AuthenticationRuntimeException exception =
                new AuthenticationRuntimeException("Identity must be set prior to validation");

        Assertions.assertInstanceOf(RuntimeException.class, exception);
        Assertions.assertEquals("Identity must be set prior to validation", exception.getMessage());
        Assertions.assertNull(exception.getCause());
    }

    @Test
    @DisplayName("UT-API-AE-003: Incompatible adapter names required and actual types")
    void testIncompatibleAdapterException() {
        IncompatibleAdapterException exception =
                new IncompatibleAdapterException(CharSequence.class, Integer.class);

        Assertions.assertInstanceOf(AuthenticationRuntimeException.class, exception);
        Assertions.assertEquals("java.lang.CharSequence", exception.getRequiredType());
        Assertions.assertEquals("java.lang.Integer", exception.getActualType());
        Assertions.assertEquals(
                "Adapter must be an instance of java.lang.CharSequence; java.lang.Integer given",
                exception.getMessage());
    }

    @Test
    @DisplayName("UT-API-AE-005: Incompatible adapter rejects null types by name")
    void testIncompatibleAdapterException_NullTypes() {
        NullPointerException required = Assertions.assertThrows(NullPointerException.class, () ->
                new IncompatibleAdapterException(null, Integer.class));
        Assertions.assertEquals("requiredType", required.getMessage());

        NullPointerException actual = Assertions.assertThrows(NullPointerException.class, () ->
                new IncompatibleAdapterException(CharSequence.class, null));
        Assertions.assertEquals("actualType", actual.getMessage());
    }

    @Test
    @DisplayName("UT-API-AE-004: Invalid option is an IllegalArgumentException")
    void testInvalidOptionException() {
        InvalidOptionException exception = new InvalidOptionException("bad option");

        Assertions.assertInstanceOf(IllegalArgumentException.class, exception);
        Assertions.assertEquals("bad option", exception.getMessage());
    }
}
