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

import org.apache.authguard.AuthenticationException;
import org.apache.authguard.AuthenticationResult;
import org.apache.authguard.AuthenticationRuntimeException;
import org.apache.authguard.IncompatibleAdapterException;
import org.apache.authguard.InvalidOptionException;
import org.apache.authguard.handler.AuthenticationService;
import org.apache.authguard.spi.AuthenticationAdapter;
import org.apache.authguard.spi.ValidatableAdapter;

import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validator that authenticates an identity/credential pair through an authentication adapter.
 *
 * <p>The adapter is either configured directly or taken from an {@link AuthenticationService}.
 * The adapter's result code is mapped to a message key through the code map; an unmapped failure
 * code is reported under {@link #UNCATEGORIZED}.
 *
 * <p>Supported options (see {@link ValidatorOptions}):
 * <ul>
 *   <li><b>adapter</b> - the {@link ValidatableAdapter} to use</li>
 *   <li><b>service</b> - the service whose adapter is used when no adapter is set</li>
 *   <li><b>identity</b> / <b>credential</b> - preset values to validate</li>
 *   <li><b>code_map</b> - result code to message key entries merged into the defaults;
 *       unknown message keys get the {@link #GENERAL} template</li>
 *   <li><b>messages</b> - message key to template overrides</li>
 *   <li><b>message_length</b> - maximum rendered message length</li>
 * </ul>
 *
 * <p>When validating within a context, the context values under {@code username} and
 * {@code password} take precedence over the preset identity and credential for that call only.
 *
 * <p>Instances are not thread-safe.
 */
public class AuthenticationValidator extends AbstractValidator {

    private static final Logger LOG = LogManager.getLogger(AuthenticationValidator.class);

    // Message keys
    public static final String GENERAL = "general";
    public static final String IDENTITY_NOT_FOUND = "identity_not_found";
    public static final String IDENTITY_AMBIGUOUS = "identity_ambiguous";
    public static final String CREDENTIAL_INVALID = "credential_invalid";
    public static final String UNCATEGORIZED = "uncategorized";

    // Context keys
    public static final String CONTEXT_IDENTITY = "username";
    public static final String CONTEXT_CREDENTIAL = "password";

    private static final Map<Integer, String> DEFAULT_CODE_MAP;

    static {
        Map<Integer, String> codeMap = new LinkedHashMap<>();
        codeMap.put(AuthenticationResult.FAILURE, GENERAL);
        codeMap.put(AuthenticationResult.FAILURE_IDENTITY_NOT_FOUND, IDENTITY_NOT_FOUND);
        codeMap.put(AuthenticationResult.FAILURE_IDENTITY_AMBIGUOUS, IDENTITY_AMBIGUOUS);
        codeMap.put(AuthenticationResult.FAILURE_CREDENTIAL_INVALID, CREDENTIAL_INVALID);
        codeMap.put(AuthenticationResult.FAILURE_UNCATEGORIZED, UNCATEGORIZED);
        DEFAULT_CODE_MAP = Collections.unmodifiableMap(codeMap);
    }

    private final Map<Integer, String> codeMap = new LinkedHashMap<>(DEFAULT_CODE_MAP);

    private ValidatableAdapter adapter;
    private AuthenticationService service;
    private String identity;
    private String credential;

    public AuthenticationValidator() {
        this(Collections.emptyMap());
    }

    /**
     * Create a validator from an option map.
     *
     * @param options option name to value, see {@link ValidatorOptions}
     * @throws InvalidOptionException if an option value is malformed
     */
    public AuthenticationValidator(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        addMessageTemplate(GENERAL, "Authentication failed");
        addMessageTemplate(IDENTITY_NOT_FOUND, "Invalid identity");
        addMessageTemplate(IDENTITY_AMBIGUOUS, "Identity is ambiguous");
        addMessageTemplate(CREDENTIAL_INVALID, "Invalid password");
        addMessageTemplate(UNCATEGORIZED, "Authentication failed");

        adapter = ValidatorOptions.get(options, ValidatorOptions.ADAPTER, ValidatableAdapter.class);
        service = ValidatorOptions.get(options, ValidatorOptions.SERVICE, AuthenticationService.class);
        identity = ValidatorOptions.get(options, ValidatorOptions.IDENTITY, String.class);
        credential = ValidatorOptions.get(options, ValidatorOptions.CREDENTIAL, String.class);

        Map<?, ?> codeMapOption = ValidatorOptions.get(options, ValidatorOptions.CODE_MAP, Map.class);
        if (codeMapOption != null) {
            setCodeMap(codeMapOption);
        }
        // after code_map, so templates registered there can be overridden
        applyCommonOptions(options);
    }

    public ValidatableAdapter getAdapter() {
        return adapter;
    }

    public void setAdapter(ValidatableAdapter adapter) {
        this.adapter = adapter;
    }

    public AuthenticationService getService() {
        return service;
    }

    public void setService(AuthenticationService service) {
        this.service = service;
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public String getCredential() {
        return credential;
    }

    public void setCredential(String credential) {
        this.credential = credential;
    }

    /**
     * Returns the result code to message key map.
     *
     * @return unmodifiable view of the code map
     */
    public Map<Integer, String> getCodeMap() {
        return Collections.unmodifiableMap(codeMap);
    }

    /**
     * Merges entries into the code map.
     *
     * <p>Result codes may be integers or decimal strings. Each message key not yet known gets a
     * template copied from {@link #GENERAL}. Nothing is changed if any entry is malformed.
     *
     * @param entries result code to message key
     * @throws InvalidOptionException if a code is not an integer or a message key is not a
     *         non-empty string
     */
    public void setCodeMap(Map<?, ?> entries) {
        Map<Integer, String> merged = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            int code = ValidatorOptions.toInt("Result code in code_map option", entry.getKey());
            Object messageKey = entry.getValue();
            if (!(messageKey instanceof String) || Strings.isNullOrEmpty((String) messageKey)) {
                throw new InvalidOptionException("Message key in code_map option must be a non-empty string");
            }
            merged.put(code, (String) messageKey);
        }

        codeMap.putAll(merged);
        for (String messageKey : merged.values()) {
            if (!hasMessageTemplate(messageKey)) {
                addMessageTemplate(messageKey, getMessageTemplate(GENERAL));
            }
        }
    }

    /**
     * Validates the preset identity and credential.
     *
     * @return true if authentication succeeded
     */
    public boolean isValid() {
        return isValid(null, null);
    }

    /**
     * Authenticates the identity and credential through the resolved adapter.
     *
     * <p>Messages of the previous call are discarded first, also when this call throws.
     *
     * @param value the credential to use instead of the preset one, may be null
     * @param context values under {@code username} and {@code password} override the identity
     *        and credential for this call, may be null
     * @return true if authentication succeeded
     * @throws AuthenticationRuntimeException if the identity is not set, no adapter can be
     *         resolved, or the adapter fails internally
     * @throws IncompatibleAdapterException if the service's adapter is not a
     *         {@link ValidatableAdapter}
     */
    @Override
    public boolean isValid(Object value, Map<String, ?> context) {
        clearMessages();
        if (identity == null) {
            throw new AuthenticationRuntimeException("Identity must be set prior to validation");
        }
        ValidatableAdapter validatable = resolveAdapter();

        String currentIdentity = identity;
        String currentCredential = value != null ? String.valueOf(value) : credential;
        if (context != null) {
            Object contextIdentity = context.get(CONTEXT_IDENTITY);
            if (contextIdentity != null) {
                currentIdentity = String.valueOf(contextIdentity);
            }
            Object contextCredential = context.get(CONTEXT_CREDENTIAL);
            if (contextCredential != null) {
                currentCredential = String.valueOf(contextCredential);
            }
        }

        validatable.setIdentity(currentIdentity);
        validatable.setCredential(currentCredential);

        AuthenticationResult result = authenticate(validatable);
        if (result.isValid()) {
            LOG.debug("Identity '{}' validated by {}", currentIdentity, validatable.name());
            return true;
        }

        String messageKey = codeMap.get(result.getCode());
        if (messageKey == null) {
            LOG.warn("No message key mapped for result code {}, reporting '{}'", result.getCode(), UNCATEGORIZED);
            messageKey = UNCATEGORIZED;
        }
        LOG.debug("Identity '{}' rejected by {} with code {} ({})",
                currentIdentity, validatable.name(), result.getCode(), messageKey);
        error(messageKey);
        return false;
    }

    @Override
    protected Object getCustomOption(String name) {
        switch (name) {
            case ValidatorOptions.ADAPTER:
                return adapter;
            case ValidatorOptions.SERVICE:
                return service;
            case ValidatorOptions.IDENTITY:
                return identity;
            case ValidatorOptions.CREDENTIAL:
                return credential;
            case ValidatorOptions.CODE_MAP:
                return getCodeMap();
            default:
                return super.getCustomOption(name);
        }
    }

    private ValidatableAdapter resolveAdapter() {
        if (adapter != null) {
            return adapter;
        }
        if (service == null) {
            throw new AuthenticationRuntimeException("AuthenticationService must be set prior to validation");
        }
        AuthenticationAdapter current = service.getAdapter();
        if (current == null) {
            throw new AuthenticationRuntimeException("Adapter must be set prior to validation");
        }
        if (!(current instanceof ValidatableAdapter)) {
            throw new IncompatibleAdapterException(ValidatableAdapter.class, current.getClass());
        }
        LOG.debug("Using adapter {} of the authentication service", current.name());
        return (ValidatableAdapter) current;
    }

    private AuthenticationResult authenticate(ValidatableAdapter validatable) {
        try {
            return service != null ? service.authenticate(validatable) : validatable.authenticate();
        } catch (AuthenticationException e) {
            throw new AuthenticationRuntimeException(
                    "Authentication adapter " + validatable.name() + " failed: " + e.getMessage(), e);
        }
    }
}
