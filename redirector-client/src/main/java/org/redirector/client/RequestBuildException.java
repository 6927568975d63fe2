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
 * Signals that the request for the next hop could not be built from the current state.
 */
public class RequestBuildException extends RedirectException
{
    public RequestBuildException(String message)
    {
        super(message);
    }

    public RequestBuildException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
