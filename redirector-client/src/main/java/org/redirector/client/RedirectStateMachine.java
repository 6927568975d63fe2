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
import java.nio.ByteBuffer;
import java.util.List;

import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpScheme;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.HttpVersion;
import org.redirector.client.api.ClientRequest;
import org.redirector.client.api.HopRequest;
import org.redirector.client.api.HopResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Holds the logical request of a redirect conversation and decides, for each
 * response, whether the redirect must be followed.</p>
 * <table>
 * <caption>Redirect decisions</caption>
 * <tr><th>Status</th><th>Next request</th></tr>
 * <tr><td>301, 302, 307, 308</td><td>same method, same content</td></tr>
 * <tr><td>303</td><td>{@code GET} without content</td></tr>
 * <tr><td>any other</td><td>none, the response is returned</td></tr>
 * </table>
 * <p>A redirect is not followed, and the redirect response is returned, when the
 * redirect budget is exhausted or when the response has no {@code Location} header.
 * When a redirect leaves the current host and port, the credentials carried by the
 * request headers are removed.</p>
 * <p>Instances are not thread-safe; they are owned by a single conversation.</p>
 */
public class RedirectStateMachine
{
    private static final Logger LOG = LoggerFactory.getLogger(RedirectStateMachine.class);
    private static final List<String> SENSITIVE_HEADERS = List.of(
        HttpHeader.AUTHORIZATION.asString(),
        HttpHeader.COOKIE.asString(),
        "Cookie2",
        HttpHeader.WWW_AUTHENTICATE.asString());
    private static final List<HttpHeader> CONTENT_HEADERS = List.of(
        HttpHeader.CONTENT_LENGTH,
        HttpHeader.CONTENT_TYPE,
        HttpHeader.CONTENT_ENCODING,
        HttpHeader.TRANSFER_ENCODING);
    private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

    public enum Decision
    {
        /**
         * The state moved to the next hop, which must be sent.
         */
        CONTINUE,
        /**
         * The response must be returned to the application.
         */
        RETURN
    }

    private final HttpVersion version;
    private final HttpFields.Mutable headers;
    private final boolean normalizeDefaultPorts;
    private String method;
    private URI uri;
    private String contentType;
    // Null while the request content is being buffered.
    private ByteBuffer content;
    private boolean contentSet;
    private int remainingRedirects;

    /**
     * <p>Captures the given request; its headers are moved into this state machine.</p>
     *
     * @param request the request to follow redirects for
     * @param maxRedirects the max number of redirects to follow
     * @param normalizeDefaultPorts whether missing ports default to the scheme's port
     * when comparing origins
     */
    public RedirectStateMachine(ClientRequest request, int maxRedirects, boolean normalizeDefaultPorts)
    {
        if (maxRedirects < 0)
            throw new IllegalArgumentException("Invalid max redirects " + maxRedirects);
        this.method = request.getMethod();
        this.uri = request.getURI();
        this.version = request.getVersion();
        this.headers = request.takeHeaders();
        Request.Content body = request.getBody();
        if (body != null && !headers.contains(HttpHeader.CONTENT_TYPE))
            this.contentType = body.getContentType();
        this.remainingRedirects = maxRedirects;
        this.normalizeDefaultPorts = normalizeDefaultPorts;
    }

    /**
     * @param status the HTTP status code
     * @return whether the status code is one of the redirect codes this class follows
     */
    public static boolean isRedirect(int status)
    {
        switch (status)
        {
            case HttpStatus.MOVED_PERMANENTLY_301:
            case HttpStatus.FOUND_302:
            case HttpStatus.SEE_OTHER_303:
            case HttpStatus.TEMPORARY_REDIRECT_307:
            case HttpStatus.PERMANENT_REDIRECT_308:
                return true;
            default:
                return false;
        }
    }

    /**
     * @param content the buffered request content
     * @throws IllegalStateException if the content has already been set
     */
    public void setContent(ByteBuffer content)
    {
        if (contentSet)
            throw new IllegalStateException("Content already set");
        contentSet = true;
        this.content = content;
    }

    /**
     * @return a request for the current hop
     * @throws RequestBuildException if the current state does not describe a valid request
     */
    public HopRequest newHopRequest() throws RequestBuildException
    {
        if (!uri.isAbsolute())
            throw new RequestBuildException("Not an absolute URI: " + uri);
        String scheme = uri.getScheme();
        if (!HttpScheme.HTTP.is(scheme) && !HttpScheme.HTTPS.is(scheme))
            throw new RequestBuildException("Unsupported scheme: " + uri);
        if (uri.getHost() == null)
            throw new RequestBuildException("Missing host: " + uri);
        if (!isToken(method))
            throw new RequestBuildException("Invalid method: " + method);

        try
        {
            return new HopRequest(method, uri, version, headers, contentType, content);
        }
        catch (RuntimeException x)
        {
            throw new RequestBuildException("Could not build request for " + uri, x);
        }
    }

    /**
     * @param response the response to the current hop
     * @return whether to send the next hop or to return the response
     * @throws InvalidLocationException if the redirect location cannot be resolved
     */
    public Decision onResponse(HopResponse response) throws InvalidLocationException
    {
        int status = response.getStatus();
        switch (status)
        {
            case HttpStatus.MOVED_PERMANENTLY_301:
            case HttpStatus.FOUND_302:
            case HttpStatus.TEMPORARY_REDIRECT_307:
            case HttpStatus.PERMANENT_REDIRECT_308:
            {
                return followRedirect(response);
            }
            case HttpStatus.SEE_OTHER_303:
            {
                method = HttpMethod.GET.asString();
                content = null;
                contentType = null;
                CONTENT_HEADERS.forEach(headers::remove);
                return followRedirect(response);
            }
            default:
            {
                return Decision.RETURN;
            }
        }
    }

    private Decision followRedirect(HopResponse response) throws InvalidLocationException
    {
        if (remainingRedirects == 0)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Max redirects reached, returning {} for {}", response, uri);
            return Decision.RETURN;
        }
        --remainingRedirects;

        String location = response.getLocation();
        if (location == null)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Missing 'Location' header, returning {} for {}", response, uri);
            return Decision.RETURN;
        }

        URI next = LocationResolver.resolve(uri, location);
        if (!LocationResolver.isSameOrigin(uri, next, normalizeDefaultPorts))
            removeSensitiveHeaders(next);
        if (LOG.isDebugEnabled())
            LOG.debug("Redirecting {} {} to {} (Location: {}), {} redirects left", method, uri, next, location, remainingRedirects);
        uri = next;
        return Decision.CONTINUE;
    }

    private void removeSensitiveHeaders(URI next)
    {
        for (String name : SENSITIVE_HEADERS)
        {
            if (headers.contains(name))
            {
                headers.remove(name);
                if (LOG.isDebugEnabled())
                    LOG.debug("Removed '{}' header redirecting from {} to {}", name, uri, next);
            }
        }
    }

    private static boolean isToken(String value)
    {
        if (value == null || value.isEmpty())
            return false;
        for (int i = 0; i < value.length(); ++i)
        {
            char c = value.charAt(i);
            boolean alphanumeric = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alphanumeric && TOKEN_SYMBOLS.indexOf(c) < 0)
                return false;
        }
        return true;
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
     * @return the buffered content, or null if not yet buffered or dropped by a 303 redirect
     */
    public ByteBuffer getContent()
    {
        return content == null ? null : content.slice();
    }

    public int getRemainingRedirects()
    {
        return remainingRedirects;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s %s, remaining=%d]", RedirectStateMachine.class.getSimpleName(), hashCode(), method, uri, remainingRedirects);
    }
}
