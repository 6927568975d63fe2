//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.redirector.client.api;

import java.util.concurrent.CompletableFuture;

/**
 * <p>The capability of sending one HTTP request and receiving its response.</p>
 * <p>Implementations must send exactly the method, URI, version, headers and
 * content of the given {@link HopRequest}, and must not follow redirects
 * themselves: a redirect response is a regular response at this level.</p>
 * <p>Cancelling the returned future should abort the exchange.</p>
 */
@FunctionalInterface
public interface HttpTransport
{
    /**
     * @param request the request to send
     * @return a future completed with the response, or completed exceptionally
     * if the exchange fails
     */
    CompletableFuture<HopResponse> send(HopRequest request);
}
