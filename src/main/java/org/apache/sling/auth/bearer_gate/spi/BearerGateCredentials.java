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
package org.apache.sling.auth.bearer_gate.spi;

import javax.jcr.Credentials;

import java.util.Map;

import org.apache.sling.auth.bearer_gate.GatePrincipal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Repository credentials for a principal resolved from a bearer token.
 *
 * <p>Handed to the resource resolver factory with the authentication info. The repository needs a
 * login module that accepts these credentials, the token itself is already verified and is not
 * carried.</p>
 */
public class BearerGateCredentials implements Credentials {

    private static final long serialVersionUID = 1L;

    private final transient GatePrincipal principal;

    public BearerGateCredentials(@NotNull GatePrincipal principal) {
        this.principal = principal;
    }

    @NotNull
    public String getUserId() {
        return principal.getClientId();
    }

    @NotNull
    public String getAuthenticationScheme() {
        return principal.getAuthenticationScheme();
    }

    @NotNull
    public GatePrincipal getPrincipal() {
        return principal;
    }

    @NotNull
    public Map<String, Object> getAttributes() {
        return principal.getClaims();
    }

    @Nullable
    public Object getAttribute(@NotNull String name) {
        return principal.getClaim(name);
    }
}
