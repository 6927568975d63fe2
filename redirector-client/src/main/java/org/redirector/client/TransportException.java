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

package org.redirector.client;

/**
 * <p>Signals that the underlying {@link org.redirector.client.api.HttpTransport} failed to
 * send a request or to receive its response.</p>
 * <p>The original failure is available via {@link #getCause()}.</p>
 */
public class TransportException extends RedirectException
{
    public TransportException(Throwable cause)
    {
        super(String.valueOf(cause), cause);
    }
}
