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

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Objects;

import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.util.BufferUtil;

/**
 * <p>An immutable request, ready to be handed to an {@link HttpTransport}.</p>
 * <p>The content is fully buffered, so the same {@code HopRequest} (or another
 * one sharing its content) may be sent any number of times.</p>
 */
public class HopRequest
{
    private final String method;
    private final URI uri;
    private final HttpVersion version;
    private final HttpFields headers;
    private final String contentType;
    private final ByteBuffer content;

    public HopRequest(String method, URI uri, HttpVersion version, HttpFields headers, String contentType, ByteBuffer content)
    {
        this.method = Objects.requireNonNull(method);
        this.uri = Objects.requireNonNull(uri);
        this.version = Objects.requireNonNull(version);
        this.headers = headers == null ? HttpFields.EMPTY : HttpFields.build(headers).asImmutable();
        this.contentType = contentType;
        this.content = content == null ? BufferUtil.EMPTY_BUFFER : content.asReadOnlyBuffer();
    }

    public String getMethod()
    {
        return method;
    }

    public URI getURI()
    {
        return uri;
    }

    public HttpVersion getVersion()
    {
        return version;
    }

    public HttpFields getHeaders()
    {
        return headers;
    }

    /**
     * @return the media type of the content, or null if unknown
     */
    public String getContentType()
    {
        return contentType;
    }

    /**
     * @return a read-only view of the content, with its own position and limit
     */
    public ByteBuffer getContent()
    {
        return content.slice();
    }

    public int getContentLength()
    {
        return content.remaining();
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s %s %s]@%x", HopRequest.class.getSimpleName(), getMethod(), getURI(), getVersion(), hashCode());
    }
}
