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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for validators: owns the message templates, the messages of the last validation
 * and the options shared by all validators ({@code messages}, {@code message_length}).
 *
 * <p>Messages are rendered from templates verbatim. The only transformation applied is the
 * optional length limit, which cuts longer messages and marks the cut with {@code "..."}.
 */
public abstract class AbstractValidator implements Validator {

    /** No limit on rendered message length. */
    public static final int UNLIMITED_MESSAGE_LENGTH = -1;

    private static final String TRUNCATION_MARK = "...";

    private final Map<String, String> messageTemplates = new LinkedHashMap<>();
    private final Map<String, String> messages = new LinkedHashMap<>();
    private int messageLength = UNLIMITED_MESSAGE_LENGTH;

    @Override
    public boolean isValid(Object value) {
        return isValid(value, null);
    }

    @Override
    public Map<String, String> getMessages() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(messages));
    }

    /**
     * Returns a snapshot of the message templates.
     *
     * @return message key to template text
     */
    public Map<String, String> getMessageTemplates() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(messageTemplates));
    }

    public boolean hasMessageTemplate(String messageKey) {
        return messageTemplates.containsKey(messageKey);
    }

    /**
     * Overrides the template of an existing message key.
     *
     * @param messageKey the message key
     * @param template the new template text
     * @throws InvalidOptionException if no template exists for the key
     */
    public void setMessage(String messageKey, String template) {
        if (!messageTemplates.containsKey(messageKey)) {
            throw new InvalidOptionException("No message template exists for key '" + messageKey + "'");
        }
        if (template == null) {
            throw new InvalidOptionException("Message template for key '" + messageKey + "' must not be null");
        }
        messageTemplates.put(messageKey, template);
    }

    /**
     * Overrides several templates at once.
     *
     * @param templates message key to template text
     * @throws InvalidOptionException if a key is unknown or a template is not a string
     */
    public void setMessages(Map<String, ?> templates) {
        for (Map.Entry<String, ?> entry : templates.entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new InvalidOptionException("Message template for key '" + entry.getKey()
                        + "' must be a string");
            }
            setMessage(entry.getKey(), (String) entry.getValue());
        }
    }

    public int getMessageLength() {
        return messageLength;
    }

    /**
     * Sets the maximum length of rendered messages.
     *
     * @param messageLength {@link #UNLIMITED_MESSAGE_LENGTH} or a length greater than 3
     */
    public void setMessageLength(int messageLength) {
        if (messageLength != UNLIMITED_MESSAGE_LENGTH && messageLength <= TRUNCATION_MARK.length()) {
            throw new InvalidOptionException("message_length must be " + UNLIMITED_MESSAGE_LENGTH
                    + " or greater than " + TRUNCATION_MARK.length() + "; " + messageLength + " given");
        }
        this.messageLength = messageLength;
    }

    /**
     * Returns the current value of an option.
     *
     * @param name the option name
     * @return the option value, may be null
     * @throws InvalidOptionException if the option is unknown
     */
    public Object getOption(String name) {
        switch (name) {
            case ValidatorOptions.MESSAGE_TEMPLATES:
            case ValidatorOptions.MESSAGES:
                return getMessageTemplates();
            case ValidatorOptions.MESSAGE_LENGTH:
                return messageLength;
            default:
                return getCustomOption(name);
        }
    }

    /**
     * Returns the value of a validator-specific option.
     *
     * @param name the option name
     * @return the option value
     * @throws InvalidOptionException if the option is unknown
     */
    protected Object getCustomOption(String name) {
        throw new InvalidOptionException("Invalid option '" + name + "'");
    }

    /**
     * Applies the options shared by all validators. Subclasses call this after registering
     * their own templates so that {@code messages} can override them.
     *
     * @param options the option map
     */
    protected void applyCommonOptions(Map<String, ?> options) {
        Object templates = options.get(ValidatorOptions.MESSAGES);
        if (templates != null) {
            setMessages(toStringKeyedMap(ValidatorOptions.MESSAGES, templates));
        }
        Object length = options.get(ValidatorOptions.MESSAGE_LENGTH);
        if (length != null) {
            setMessageLength(ValidatorOptions.toInt(ValidatorOptions.MESSAGE_LENGTH, length));
        }
    }

    protected void addMessageTemplate(String messageKey, String template) {
        messageTemplates.put(messageKey, template);
    }

    protected String getMessageTemplate(String messageKey) {
        return messageTemplates.get(messageKey);
    }

    /**
     * Records a failure message for the given key.
     *
     * @param messageKey the message key, must have a template
     */
    protected void error(String messageKey) {
        messages.put(messageKey, createMessage(messageKey));
    }

    protected void clearMessages() {
        messages.clear();
    }

    private String createMessage(String messageKey) {
        String message = messageTemplates.get(messageKey);
        if (message == null) {
            throw new IllegalStateException("No message template exists for key '" + messageKey + "'");
        }
        if (messageLength != UNLIMITED_MESSAGE_LENGTH && message.length() > messageLength) {
            message = message.substring(0, messageLength - TRUNCATION_MARK.length()) + TRUNCATION_MARK;
        }
        return message;
    }

    private static Map<String, Object> toStringKeyedMap(String name, Object value) {
        if (!(value instanceof Map)) {
            throw new InvalidOptionException("Option '" + name + "' must be a map; "
                    + value.getClass().getName() + " given");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new InvalidOptionException("Keys of option '" + name + "' must be strings; "
                        + entry.getKey() + " given");
            }
            copy.put((String) entry.getKey(), entry.getValue());
        }
        return copy;
    }
}
