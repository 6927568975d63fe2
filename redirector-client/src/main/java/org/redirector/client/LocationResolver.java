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
import java.net.URISyntaxException;
import java.util.Objects;

import org.eclipse.jetty.http.HttpScheme;

/**
 * <p>Resolves the value of a {@code Location} header against the URI of the request
 * that received the redirect, and decides whether two URIs share the same origin.</p>
 * <p>Only the scheme and the authority are inherited from the current URI:
 * the path and the query of the location are taken verbatim and are never
 * merged with the current path.</p>
 * <pre>
 * resolve("http://a.com/p?q", "/x")            -&gt; http://a.com/x
 * resolve("http://a.com/p", "https://b.com/y") -&gt; https://b.com/y
 * resolve("http://a.com:8080/p", "/y")         -&gt; http://a.com:8080/y
 * </pre>
 */
public final class LocationResolver
{
    private LocationResolver()
    {
    }

    /**
     * @param current the absolute URI of the request that received the redirect
     * @param location the raw value of the {@code Location} header
     * @return the absolute URI to redirect to
     * @throws InvalidLocationException if the location cannot be resolved to an absolute URI
     */
    public static URI resolve(URI current, String location) throws InvalidLocationException
    {
        if (current.getScheme() == null || current.getRawAuthority() == null)
            throw new IllegalArgumentException("Not an absolute URI: " + current);
        if (location == null || location.isBlank())
            throw new InvalidLocationException(location, "blank");
        for (int i = 0; i < location.length(); ++i)
        {
            char c = location.charAt(i);
            if (c < 0x20 || c >= 0x7F)
                throw new InvalidLocationException(location, "invalid character at index " + i);
        }

        URI reference;
        try
        {
            reference = new URI(location);
        }
        catch (URISyntaxException x)
        {
            throw new InvalidLocationException(location, x);
        }
        if (reference.isOpaque())
            throw new InvalidLocationException(location, "opaque URI");

        String scheme = reference.getScheme() != null ? reference.getScheme() : current.getScheme();
        String authority = reference.getRawAuthority() != null ? reference.getRawAuthority() : current.getRawAuthority();
        String path = reference.getRawPath();
        if (path == null || path.isEmpty())
            path = "/";
        else if (!path.startsWith("/"))
            throw new InvalidLocationException(location, "relative path");

        StringBuilder builder = new StringBuilder(scheme.length() + authority.length() + path.length() + 8);
        builder.append(scheme).append("://").append(authority).append(path);
        String query = reference.getRawQuery();
        if (query != null)
            builder.append('?').append(query);

        try
        {
            return new URI(builder.toString());
        }
        catch (URISyntaxException x)
        {
            throw new InvalidLocationException(location, x);
        }
    }

    /**
     * <p>Returns whether the given URIs have the same host and port.</p>
     * <p>Hosts are compared literally. When {@code normalizeDefaultPorts} is true,
     * a missing port is replaced by the default port of the scheme before comparing,
     * so that {@code http://host} and {@code http://host:80} share the same origin;
     * otherwise ports are compared as written.</p>
     *
     * @param uri1 the first URI
     * @param uri2 the second URI
     * @param normalizeDefaultPorts whether missing ports default to the scheme's port
     * @return whether the two URIs have the same host and port
     */
    public static boolean isSameOrigin(URI uri1, URI uri2, boolean normalizeDefaultPorts)
    {
        if (!Objects.equals(uri1.getHost(), uri2.getHost()))
            return false;
        return port(uri1, normalizeDefaultPorts) == port(uri2, normalizeDefaultPorts);
    }

    private static int port(URI uri, boolean normalizeDefaultPorts)
    {
        int port = uri.getPort();
        if (port >= 0 || !normalizeDefaultPorts)
            return port;
        return defaultPort(uri.getScheme());
    }

    static int defaultPort(String scheme)
    {
        if (HttpScheme.HTTP.is(scheme) || HttpScheme.WS.is(scheme))
            return 80;
        if (HttpScheme.HTTPS.is(scheme) || HttpScheme.WSS.is(scheme))
            return 443;
        return -1;
    }
}
