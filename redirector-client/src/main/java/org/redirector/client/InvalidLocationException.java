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
 * <p>Signals that the {@code Location} header of a redirect response could not be
 * resolved to an absolute URI.</p>
 * <p>A malformed redirect target is never ignored: it fails the whole conversation.</p>
 */
public class InvalidLocationException extends RedirectException
{
    private final String location;

    public InvalidLocationException(String location, String reason)
    {
        super(String.format("Invalid 'Location' header: %s (%s)", location, reason));
        this.location = location;
    }

    public InvalidLocationException(String location, Throwable cause)
    {
        super(String.format("Invalid 'Location' header: %s", location), cause);
        this.location = location;
    }

    /**
     * @return the raw value of the offending {@code Location} header
     */
    public String getLocation()
    {
        return location;
    }
}
