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

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.eclipse.jetty.client.util.ByteBufferRequestContent;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.redirector.client.api.ClientRequest;
import org.redirector.client.api.HopRequest;
import org.redirector.client.api.HopResponse;
import org.redirector.client.api.HttpTransport;

/**
 * <p>An HTTP client that follows redirects on top of an {@link HttpTransport}.</p>
 * <p>The 5 redirect codes of HTTP/1.1 are followed: the permanent ones
 * ({@code 301} and {@code 308}) and the temporary ones ({@code 302}, {@code 303}
 * and {@code 307}).
 * A {@code 303 See Other} redirect changes the method to {@code GET} and drops the
 * request content; the other codes resend the same method and content.
 * To make that possible the request content is buffered in memory before the
 * first request is sent.</p>
 * <p>Both absolute and relative {@code Location} values are supported.
 * When the {@code Location} header is missing, or when the max number of redirects
 * has been reached, the redirect response itself is returned: applications detect
 * these cases by checking the status code of the response.</p>
 * <p>Authentication and cookie headers are removed when following a redirect to a
 * different host or port; redirects to the same host and port keep them.</p>
 * <pre>
 * HttpClient httpClient = new HttpClient();
 * JettyHttpTransport transport = new JettyHttpTransport(httpClient);
 * transport.start();
 *
 * RedirectClient client = RedirectClient.followRedirects(transport);
 * HopResponse response = client.get("http://example.org/").get(5, TimeUnit.SECONDS);
 * </pre>
 * <p>A {@code RedirectClient} is itself an {@link HttpTransport}, and may be used
 * wherever a transport is expected.</p>
 */
@ManagedObject("HTTP client that follows redirects")
public class RedirectClient implements HttpTransport
{
    /**
     * The default max number of redirects followed by a request.
     */
    public static final int DEFAULT_MAX_REDIRECTS = 10;

    private final HttpTransport transport;
    private volatile int maxRedirects;
    private volatile boolean normalizeDefaultPorts;

    public RedirectClient(HttpTransport transport)
    {
        this(transport, DEFAULT_MAX_REDIRECTS);
    }

    public RedirectClient(HttpTransport transport, int maxRedirects)
    {
        this.transport = Objects.requireNonNull(transport);
        setMaxRedirects(maxRedirects);
    }

    /**
     * <p>Creates a client with the same transport and configuration as the given one.</p>
     *
     * @param client the client to copy
     */
    public RedirectClient(RedirectClient client)
    {
        this(client.getTransport(), client.getMaxRedirects());
        setNormalizeDefaultPorts(client.isNormalizeDefaultPorts());
    }

    /**
     * @param transport the transport that sends each request of the redirect chain
     * @return a client that follows up to {@value #DEFAULT_MAX_REDIRECTS} redirects
     */
    public static RedirectClient followRedirects(HttpTransport transport)
    {
        return new RedirectClient(transport);
    }

    /**
     * @param transport the transport that sends each request of the redirect chain
     * @param maxRedirects the max number of redirects to follow
     * @return a client that follows up to {@code maxRedirects} redirects
     */
    public static RedirectClient followRedirects(HttpTransport transport, int maxRedirects)
    {
        return new RedirectClient(transport, maxRedirects);
    }

    public HttpTransport getTransport()
    {
        return transport;
    }

    /**
     * @return the max number of redirects followed by a request
     * @see #setMaxRedirects(int)
     */
    @ManagedAttribute("The max number of redirects followed by a request")
    public int getMaxRedirects()
    {
        return maxRedirects;
    }

    /**
     * @param maxRedirects the max number of redirects followed by a request, zero to follow none
     */
    public void setMaxRedirects(int maxRedirects)
    {
        if (maxRedirects < 0)
            throw new IllegalArgumentException("Invalid max redirects " + maxRedirects);
        this.maxRedirects = maxRedirects;
    }

    /**
     * @return whether a missing port is considered equal to the default port of the scheme
     * when deciding if a redirect leaves the current host and port
     * @see #setNormalizeDefaultPorts(boolean)
     */
    @ManagedAttribute("Whether missing ports are normalized to the scheme's default port")
    public boolean isNormalizeDefaultPorts()
    {
        return normalizeDefaultPorts;
    }

    /**
     * <p>By default ports are compared as written, so a redirect from
     * {@code http://host/} to {@code http://host:80/} is considered to leave
     * the current host and port, and the credentials are removed.</p>
     *
     * @param normalizeDefaultPorts whether a missing port is considered equal to the
     * default port of the scheme
     */
    public void setNormalizeDefaultPorts(boolean normalizeDefaultPorts)
    {
        this.normalizeDefaultPorts = normalizeDefaultPorts;
    }

    /**
     * @param uri the URI to GET
     * @return a future completed with the final response
     */
    public CompletableFuture<HopResponse> get(String uri)
    {
        return get(URI.create(uri));
    }

    /**
     * @param uri the URI to GET
     * @return a future completed with the final response
     */
    public CompletableFuture<HopResponse> get(URI uri)
    {
        return request(new ClientRequest(uri));
    }

    /**
     * <p>Sends the given request, following redirects.</p>
     * <p>The headers and the body of the request are moved into the conversation.</p>
     *
     * @param request the request to send
     * @return a future completed with the final response, or completed exceptionally
     * with a {@link RedirectException}
     */
    public CompletableFuture<HopResponse> request(ClientRequest request)
    {
        return newConversation(request).start();
    }

    /**
     * <p>Sends an already buffered request, following redirects.</p>
     *
     * @param request the request to send
     * @return a future completed with the final response
     */
    @Override
    public CompletableFuture<HopResponse> send(HopRequest request)
    {
        ClientRequest clientRequest = new ClientRequest(request.getURI())
            .method(request.getMethod())
            .version(request.getVersion())
            .headers(headers -> request.getHeaders().forEach(headers::add));
        if (request.getContentLength() > 0)
            clientRequest.body(new ByteBufferRequestContent(request.getContentType() == null ? "application/octet-stream" : request.getContentType(), request.getContent()));
        return request(clientRequest);
    }

    protected RedirectConversation newConversation(ClientRequest request)
    {
        return new RedirectConversation(transport, request, getMaxRedirects(), isNormalizeDefaultPorts());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[maxRedirects=%d,normalizeDefaultPorts=%b,transport=%s]", RedirectClient.class.getSimpleName(), hashCode(), getMaxRedirects(), isNormalizeDefaultPorts(), transport);
    }
}
