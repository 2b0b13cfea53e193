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

import javax.servlet.http.HttpServletRequest;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.apache.sling.auth.bearer_gate.GatePrincipal;
import org.jetbrains.annotations.NotNull;

/**
 * Resolves the principal behind an internal-format (legacy session) token.
 *
 * <p>Implementations are published as OSGi services. They read whatever they need from the request,
 * usually the same <code>Authorization</code> header, and look the session up in the identity source
 * they front. Any caching is the implementation's own concern.</p>
 */
public interface PrincipalProvider {

    /**
     * Looks up the principal for the caller of the given request.
     *
     * @param request the request being authenticated
     * @return a future completing with the principal, or with an empty optional when the session is
     *      unknown or expired
     */
    @NotNull
    CompletableFuture<Optional<GatePrincipal>> getCurrentPrincipal(@NotNull HttpServletRequest request);
}
