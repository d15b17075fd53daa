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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Basic implementation of {@link Principal}.
 *
 * <pre>{@code
 * Principal principal = BasicPrincipal.builder()
 *     .name("alice")
 *     .authenticator("password")
 *     .attribute("email", "alice@example.com")
 *     .build();
 * }</pre>
 */
public final class BasicPrincipal implements Principal {

    private final String name;
    private final String authenticator;
    private final Map<String, String> attributes;

    private BasicPrincipal(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.authenticator = Objects.requireNonNull(builder.authenticator, "authenticator is required");
        this.attributes = Collections.unmodifiableMap(new HashMap<>(builder.attributes));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getAuthenticator() {
        return authenticator;
    }

    @Override
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BasicPrincipal that = (BasicPrincipal) o;
        return Objects.equals(name, that.name)
                && Objects.equals(authenticator, that.authenticator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, authenticator);
    }

    @Override
    public String toString() {
        return "BasicPrincipal{name='" + name + "', authenticator='" + authenticator + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link BasicPrincipal}.
     */
    public static final class Builder {
        private String name;
        private String authenticator;
        private final Map<String, String> attributes = new HashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder authenticator(String authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder attribute(String key, String value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public BasicPrincipal build() {
            return new BasicPrincipal(this);
        }
    }
}
