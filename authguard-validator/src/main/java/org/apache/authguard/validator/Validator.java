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

import java.util.Map;

/**
 * A validator checks a value, optionally against a context of related values, and reports the
 * reasons of a failed check as messages keyed by message key.
 */
public interface Validator {

    /**
     * Validates a value without context.
     *
     * @param value the value to validate, may be null
     * @return true if the value is valid
     */
    boolean isValid(Object value);

    /**
     * Validates a value within a context, for example the other fields of a submitted form.
     *
     * @param value the value to validate, may be null
     * @param context related values keyed by name, may be null
     * @return true if the value is valid
     */
    boolean isValid(Object value, Map<String, ?> context);

    /**
     * Returns the messages of the last failed validation.
     *
     * @return message key to message text, empty after a successful validation
     */
    Map<String, String> getMessages();
}
