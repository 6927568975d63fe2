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

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.util.BufferUtil;

/**
 * <p>An immutable, fully buffered response to a {@link HopRequest}.</p>
 * <p>{@link #getRequest()} returns the request that produced this response,
 * so the final response of a redirect chain tells where the chain ended.</p>
 */
public class HopResponse
{
    private final HopRequest request;
    private final HttpVersion version;
    private final int status;
    private final String reason;
    private final HttpFields headers;
    private final ByteBuffer content;

    public HopResponse(HopRequest request, int status, HttpFields headers)
    {
        this(request, HttpVersion.HTTP_1_1, status, null, headers, null);
    }

    public HopResponse(HopRequest request, HttpVersion version, int status, String reason, HttpFields headers, ByteBuffer content)
    {
        this.request = Objects.requireNonNull(request);
        this.version = version == null ? request.getVersion() : version;
        this.status = status;
        this.reason = reason == null ? HttpStatus.getMessage(status) : reason;
        this.headers = headers == null ? HttpFields.EMPTY : HttpFields.build(headers).asImmutable();
        this.content = content == null ? BufferUtil.EMPTY_BUFFER : content.asReadOnlyBuffer();
    }

    public HopRequest getRequest()
    {
        return request;
    }

    public HttpVersion getVersion()
    {
        return version;
    }

    public int getStatus()
    {
        return status;
    }

    public String getReason()
    {
        return reason;
    }

    public HttpFields getHeaders()
    {
        return headers;
    }

    /**
     * @return the raw value of the {@code Location} header, or null if absent
     */
    public String getLocation()
    {
        return headers.get(HttpHeader.LOCATION);
    }

    public ByteBuffer getContent()
    {
        return content.slice();
    }

    public String getContentAsString()
    {
        return getContentAsString(StandardCharsets.UTF_8);
    }

    public String getContentAsString(Charset charset)
    {
        return BufferUtil.toString(getContent(), charset);
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s %d %s]@%x", HopResponse.class.getSimpleName(), getVersion(), getStatus(), getReason(), hashCode());
    }
}
