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

import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Extracts the bearer token from an <code>Authorization</code> header value and decides which
 * verification path applies to it. Internal-format tokens are recognised by their length only.
 */
class BearerTokenClassifier {

    static final String BEARER_SCHEME = "Bearer";

    enum TokenFormat {
        INTERNAL,
        EXTERNAL
    }

    private final int internalTokenLength;

    BearerTokenClassifier(int internalTokenLength) {
        if (internalTokenLength <= 0) {
            throw new IllegalArgumentException(
                    "Internal token length must be a positive number, got " + internalTokenLength);
        }
        this.internalTokenLength = internalTokenLength;
    }

    /**
     * Extracts the token of a <code>Bearer</code> credential.
     *
     * @param authorizationHeader the raw header value, may be null
     * @return the trimmed token, or empty when the header is absent, uses another scheme or carries no token
     */
    @NotNull
    Optional<String> extract(@Nullable String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }

        int schemeLength = BEARER_SCHEME.length();
        // scheme names are case-insensitive, the scheme is separated from the token by a space (RFC 7235)
        if (authorizationHeader.length() <= schemeLength
                || !authorizationHeader.regionMatches(true, 0, BEARER_SCHEME, 0, schemeLength)
                || authorizationHeader.charAt(schemeLength) != ' ') {
            return Optional.empty();
        }

        String token = authorizationHeader.substring(schemeLength).trim();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    @NotNull
    TokenFormat classify(@NotNull String token) {
        return token.length() == internalTokenLength ? TokenFormat.INTERNAL : TokenFormat.EXTERNAL;
    }

    int internalTokenLength() {
        return internalTokenLength;
    }
}
