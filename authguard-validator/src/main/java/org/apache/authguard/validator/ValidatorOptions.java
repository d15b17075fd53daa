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

import org.apache.authguard.InvalidOptionException;
import org.apache.authguard.handler.AuthenticationService;
import org.apache.authguard.spi.ValidatableAdapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Option names understood by validators, and a builder for option maps.
 *
 * <p>Options may come from code or from a properties source, in which case values are strings:
 * <pre>{@code
 * Map<String, Object> options = ValidatorOptions.builder()
 *     .adapter(adapter)
 *     .identity("alice")
 *     .codeMapEntry(-999, "account_locked")
 *     .message("account_locked", "Account is locked")
 *     .build();
 * AuthenticationValidator validator = new AuthenticationValidator(options);
 * }</pre>
 */
public final class ValidatorOptions {

    public static final String ADAPTER = "adapter";
    public static final String SERVICE = "service";
    public static final String IDENTITY = "identity";
    public static final String CREDENTIAL = "credential";
    public static final String CODE_MAP = "code_map";
    public static final String MESSAGES = "messages";
    public static final String MESSAGE_LENGTH = "message_length";

    /** Read-only option exposing the current message templates. */
    public static final String MESSAGE_TEMPLATES = "messageTemplates";

    private ValidatorOptions() {
    }

    /**
     * Reads an optional, typed option value.
     *
     * @param options the option map
     * @param name the option name
     * @param type the expected type
     * @return the value, or null if absent
     * @throws InvalidOptionException if the value has another type
     */
    static <T> T get(Map<String, ?> options, String name, Class<T> type) {
        Object value = options.get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new InvalidOptionException("Option '" + name + "' must be of type " + type.getName()
                    + "; " + value.getClass().getName() + " given");
        }
        return type.cast(value);
    }

    /**
     * Converts an option value to an int, accepting numbers and decimal strings.
     *
     * @param name the option name, for error messages
     * @param value the raw value
     * @return the int value
     * @throws InvalidOptionException if the value is not an integer
     */
    static int toInt(String name, Object value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Number) {
            long longValue = ((Number) value).longValue();
            if (longValue == ((Number) value).doubleValue()
                    && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                return (int) longValue;
            }
        } else if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidOptionException(name + " must be an integer; '" + value + "' given", e);
            }
        }
        throw new InvalidOptionException(name + " must be an integer; " + value + " given");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for validator option maps.
     */
    public static final class Builder {
        private final Map<String, Object> options = new LinkedHashMap<>();
        private final Map<Integer, String> codeMap = new LinkedHashMap<>();
        private final Map<String, String> messages = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder adapter(ValidatableAdapter adapter) {
            options.put(ADAPTER, adapter);
            return this;
        }

        public Builder service(AuthenticationService service) {
            options.put(SERVICE, service);
            return this;
        }

        public Builder identity(String identity) {
            options.put(IDENTITY, identity);
            return this;
        }

        public Builder credential(String credential) {
            options.put(CREDENTIAL, credential);
            return this;
        }

        public Builder codeMapEntry(int code, String messageKey) {
            codeMap.put(code, messageKey);
            return this;
        }

        public Builder codeMap(Map<Integer, String> codeMap) {
            this.codeMap.putAll(codeMap);
            return this;
        }

        public Builder message(String messageKey, String template) {
            messages.put(messageKey, template);
            return this;
        }

        public Builder messageLength(int messageLength) {
            options.put(MESSAGE_LENGTH, messageLength);
            return this;
        }

        public Map<String, Object> build() {
            Map<String, Object> built = new LinkedHashMap<>(options);
            if (!codeMap.isEmpty()) {
                built.put(CODE_MAP, new LinkedHashMap<>(codeMap));
            }
            if (!messages.isEmpty()) {
                built.put(MESSAGES, new LinkedHashMap<>(messages));
            }
            return Collections.unmodifiableMap(built);
        }
    }
}
