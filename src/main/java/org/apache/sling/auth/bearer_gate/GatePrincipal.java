/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sling.auth.bearer_gate;

import java.security.Principal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identity resolved for a request carrying a bearer token.
 *
 * <p>The name of the principal is the client identifier. Claims are copied on construction, nested
 * lists, maps and dates included, and every read hands out a fresh read-only copy, so a principal never
 * shares mutable state with the claims it was built from. The principal lives as long as the request
 * and is never persisted.</p>
 */
public final class GatePrincipal implements Principal {

    private final String clientId;
    private final String authenticationScheme;
    private final Map<String, Object> claims;

    public GatePrincipal(@NotNull String clientId, @NotNull String authenticationScheme) {
        this(clientId, authenticationScheme, Collections.emptyMap());
    }

    public GatePrincipal(
            @NotNull String clientId, @NotNull String authenticationScheme, @NotNull Map<String, Object> claims) {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalArgumentException("Client id must not be empty");
        }
        if (authenticationScheme == null || authenticationScheme.isEmpty()) {
            throw new IllegalArgumentException("Authentication scheme must not be empty");
        }
        this.clientId = clientId;
        this.authenticationScheme = authenticationScheme;
        this.claims = copyClaims(claims);
    }

    @Override
    public @NotNull String getName() {
        return clientId;
    }

    public @NotNull String getClientId() {
        return clientId;
    }

    public @NotNull String getAuthenticationScheme() {
        return authenticationScheme;
    }

    public @NotNull Map<String, Object> getClaims() {
        return copyClaims(claims);
    }

    public @Nullable Object getClaim(@NotNull String name) {
        return copyValue(claims.get(name));
    }

    /**
     * Returns a copy of this principal labelled with another authentication scheme.
     *
     * @param scheme the scheme label
     * @return this instance if the scheme is unchanged, a relabelled copy otherwise
     */
    public @NotNull GatePrincipal withAuthenticationScheme(@NotNull String scheme) {
        if (authenticationScheme.equals(scheme)) {
            return this;
        }
        return new GatePrincipal(clientId, scheme, claims);
    }

    private static Map<String, Object> copyClaims(Map<String, ?> claims) {
        Map<String, Object> copy = new HashMap<>();
        for (Map.Entry<String, ?> claim : claims.entrySet()) {
            copy.put(claim.getKey(), copyValue(claim.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(copyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new HashMap<>();
            for (Map.Entry<?, ?> member : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(member.getKey()), copyValue(member.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GatePrincipal)) {
            return false;
        }
        GatePrincipal other = (GatePrincipal) o;
        return clientId.equals(other.clientId)
                && authenticationScheme.equals(other.authenticationScheme)
                && claims.equals(other.claims);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clientId, authenticationScheme, claims);
    }

    @Override
    public String toString() {
        // claims may carry the username and scopes, keep them out of logs
        return "GatePrincipal[clientId=" + clientId + ", scheme=" + authenticationScheme + "]";
    }
}
