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
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpVersion;

/**
 * <p>The request an application hands to a {@link org.redirector.client.RedirectClient}.</p>
 * <p>The URI may be relative while the request is being built, but it must be
 * absolute by the time the request is sent.
 * The body is a streaming {@link Request.Content} that is consumed exactly once.</p>
 * <p>Sending a {@code ClientRequest} transfers its headers and body to the
 * redirect conversation: afterwards the request has no headers and no body.</p>
 * <pre>
 * ClientRequest request = new ClientRequest("http://host/upload")
 *     .method(HttpMethod.POST)
 *     .header(HttpHeader.AUTHORIZATION, "Bearer token")
 *     .body(new StringRequestContent("text/plain", "hello"));
 * CompletableFuture&lt;HopResponse&gt; response = client.request(request);
 * </pre>
 */
public class ClientRequest
{
    private final URI uri;
    private String method = HttpMethod.GET.asString();
    private HttpVersion version = HttpVersion.HTTP_1_1;
    private HttpFields.Mutable headers = HttpFields.build();
    private Request.Content body;

    public ClientRequest(String uri)
    {
        this(URI.create(uri));
    }

    public ClientRequest(URI uri)
    {
        this.uri = Objects.requireNonNull(uri);
    }

    public URI getURI()
    {
        return uri;
    }

    public String getMethod()
    {
        return method;
    }

    public ClientRequest method(HttpMethod method)
    {
        return method(method.asString());
    }

    public ClientRequest method(String method)
    {
        this.method = Objects.requireNonNull(method).toUpperCase(Locale.ENGLISH);
        return this;
    }

    public HttpVersion getVersion()
    {
        return version;
    }

    public ClientRequest version(HttpVersion version)
    {
        this.version = Objects.requireNonNull(version);
        return this;
    }

    public HttpFields getHeaders()
    {
        return headers;
    }

    /**
     * @param name the name of the header
     * @param value the value of the header, or null to remove all headers with that name
     * @return this request object
     */
    public ClientRequest header(String name, String value)
    {
        if (value == null)
            headers.remove(name);
        else
            headers.add(name, value);
        return this;
    }

    public ClientRequest header(HttpHeader header, String value)
    {
        if (value == null)
            headers.remove(header);
        else
            headers.add(header, value);
        return this;
    }

    /**
     * @param consumer a consumer that modifies the headers of this request
     * @return this request object
     */
    public ClientRequest headers(Consumer<HttpFields.Mutable> consumer)
    {
        consumer.accept(headers);
        return this;
    }

    public Request.Content getBody()
    {
        return body;
    }

    public ClientRequest body(Request.Content body)
    {
        this.body = body;
        return this;
    }

    /**
     * <p>Moves the headers out of this request, leaving it with no headers.</p>
     *
     * @return the headers this request had
     */
    public HttpFields.Mutable takeHeaders()
    {
        HttpFields.Mutable result = headers;
        headers = HttpFields.build();
        return result;
    }

    /**
     * <p>Moves the body out of this request, leaving it with no body.</p>
     *
     * @return the body this request had, or null if it had none
     */
    public Request.Content takeBody()
    {
        Request.Content result = body;
        body = null;
        return result;
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s %s %s]@%x", ClientRequest.class.getSimpleName(), getMethod(), getURI(), getVersion(), hashCode());
    }
}
