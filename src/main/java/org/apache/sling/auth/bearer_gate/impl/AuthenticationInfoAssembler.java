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
package org.apache.sling.auth.bearer_gate.impl;

import org.apache.sling.auth.bearer_gate.AuthenticationOutcome;
import org.apache.sling.auth.bearer_gate.GatePrincipal;
import org.apache.sling.auth.bearer_gate.spi.BearerGateCredentials;
import org.apache.sling.auth.core.spi.AuthenticationInfo;
import org.apache.sling.jcr.resource.api.JcrResourceConstants;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps an {@link AuthenticationOutcome} onto the Sling authentication handler contract.
 */
final class AuthenticationInfoAssembler {

    /** Attribute holding the resolved {@link GatePrincipal}. */
    static final String PRINCIPAL_ATTRIBUTE = "bearer_gate.principal";

    /** Attribute holding the claims of the resolved principal. */
    static final String CLAIMS_ATTRIBUTE = "bearer_gate.claims";

    private AuthenticationInfoAssembler() {}

    /**
     * @param outcome the outcome of the gate
     * @return {@code null} for no result so that Sling tries other handlers, {@link AuthenticationInfo#FAIL_AUTH}
     *      for an explicit failure, and the credentials of the principal on success
     */
    @Nullable
    static AuthenticationInfo assemble(@NotNull AuthenticationOutcome outcome) {
        switch (outcome.getStatus()) {
            case SUCCESS:
                GatePrincipal principal = outcome.getPrincipal();
                AuthenticationInfo authInfo =
                        new AuthenticationInfo(principal.getAuthenticationScheme(), principal.getName());
                // the resource resolver logs in with these instead of user name and password
                authInfo.put(JcrResourceConstants.AUTHENTICATION_INFO_CREDENTIALS, new BearerGateCredentials(principal));
                authInfo.put(PRINCIPAL_ATTRIBUTE, principal);
                authInfo.put(CLAIMS_ATTRIBUTE, principal.getClaims());
                return authInfo;
            case FAILURE:
                return AuthenticationInfo.FAIL_AUTH;
            case NO_RESULT:
            default:
                return null;
        }
    }
}
