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
 * <p>Base class of the failures that terminate a redirect conversation.</p>
 * <p>Every failure is terminal: the conversation is not retried and no
 * partial redirect chain is reported.
 * Reaching the redirect limit, or receiving a redirect without a
 * {@code Location} header, is not a failure: the last response is
 * returned to the application instead.</p>
 */
public abstract class RedirectException extends RuntimeException
{
    protected RedirectException(String message)
    {
        super(message);
    }

    protected RedirectException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
