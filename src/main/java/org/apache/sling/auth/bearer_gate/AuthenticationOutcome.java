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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a single bearer authentication attempt.
 *
 * <p>{@link Status#NO_RESULT} means the gate has no opinion about the request and other
 * authentication handlers (or anonymous access) may still apply. It is not a rejection.</p>
 */
public final class AuthenticationOutcome {

    public enum Status {
        SUCCESS,
        NO_RESULT,
        FAILURE
    }

    private static final AuthenticationOutcome NO_RESULT = new AuthenticationOutcome(Status.NO_RESULT, null, null);

    private final Status status;
    private final GatePrincipal principal;
    private final String reason;

    private AuthenticationOutcome(@NotNull Status status, @Nullable GatePrincipal principal, @Nullable String reason) {
        this.status = status;
        this.principal = principal;
        this.reason = reason;
    }

    public static @NotNull AuthenticationOutcome success(@NotNull GatePrincipal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("A successful outcome requires a principal");
        }
        return new AuthenticationOutcome(Status.SUCCESS, principal, null);
    }

    public static @NotNull AuthenticationOutcome noResult() {
        return NO_RESULT;
    }

    public static @NotNull AuthenticationOutcome failure(@NotNull String reason) {
        return new AuthenticationOutcome(Status.FAILURE, null, reason);
    }

    public @NotNull Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * @return the resolved principal, only set for {@link Status#SUCCESS}
     */
    public @Nullable GatePrincipal getPrincipal() {
        return principal;
    }

    /**
     * @return the rejection reason, only set for {@link Status#FAILURE}
     */
    public @Nullable String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return "AuthenticationOutcome[SUCCESS, " + principal + "]";
            case FAILURE:
                return "AuthenticationOutcome[FAILURE, " + reason + "]";
            default:
                return "AuthenticationOutcome[NO_RESULT]";
        }
    }
}
