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

import java.util.Objects;

/**
 * Raised when an adapter does not provide the capability a caller requires.
 */
public class IncompatibleAdapterException extends AuthenticationRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String requiredType;
    private final String actualType;

    /**
     * Creates the exception.
     *
     * @param requiredType the capability the caller needs
     * @param actualType the type of the adapter that was found
     */
    public IncompatibleAdapterException(Class<?> requiredType, Class<?> actualType) {
        super("Adapter must be an instance of " + Objects.requireNonNull(requiredType, "requiredType").getName()
                + "; " + Objects.requireNonNull(actualType, "actualType").getName() + " given");
        this.requiredType = requiredType.getName();
        this.actualType = actualType.getName();
    }

    public String getRequiredType() {
        return requiredType;
    }

    public String getActualType() {
        return actualType;
    }
}
