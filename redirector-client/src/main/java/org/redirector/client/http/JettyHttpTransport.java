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

package org.redirector.client.http;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.api.Response;
import org.eclipse.jetty.client.api.Result;
import org.eclipse.jetty.client.util.BufferingResponseListener;
import org.eclipse.jetty.client.util.ByteBufferRequestContent;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.component.ContainerLifeCycle;
import org.redirector.client.api.HopRequest;
import org.redirector.client.api.HopResponse;
import org.redirector.client.api.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An {@link HttpTransport} that sends requests with a Jetty {@link HttpClient}.</p>
 * <p>Redirects are never followed by the {@link HttpClient}: each request is sent with
 * {@link Request#followRedirects(boolean) followRedirects(false)} so that a redirect
 * response is returned as is.
 * Response content is buffered up to {@link #getMaxContentLength()} bytes.</p>
 * <p>The {@link HttpClient} is a managed bean: starting and stopping this transport
 * starts and stops the client.</p>
 */
@ManagedObject("Transport over the Jetty HttpClient")
public class JettyHttpTransport extends ContainerLifeCycle implements HttpTransport
{
    private static final Logger LOG = LoggerFactory.getLogger(JettyHttpTransport.class);

    private final HttpClient httpClient;
    private int maxContentLength = 2 * 1024 * 1024;
    private long timeout;

    public JettyHttpTransport(HttpClient httpClient)
    {
        this.httpClient = Objects.requireNonNull(httpClient);
        addBean(httpClient);
    }

    public HttpClient getHttpClient()
    {
        return httpClient;
    }

    /**
     * @return the max length, in bytes, of a buffered response content
     */
    @ManagedAttribute("The max length, in bytes, of a buffered response content")
    public int getMaxContentLength()
    {
        return maxContentLength;
    }

    /**
     * @param maxContentLength the max length, in bytes, of a buffered response content
     */
    public void setMaxContentLength(int maxContentLength)
    {
        if (maxContentLength < 0)
            throw new IllegalArgumentException("Invalid max content length " + maxContentLength);
        this.maxContentLength = maxContentLength;
    }

    /**
     * @return the total timeout, in milliseconds, of each request, or zero for no timeout
     */
    @ManagedAttribute("The total timeout, in milliseconds, of each request")
    public long getTimeout()
    {
        return timeout;
    }

    /**
     * @param timeout the total timeout, in milliseconds, of each request, or zero for no timeout
     */
    public void setTimeout(long timeout)
    {
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<HopResponse> send(HopRequest hop)
    {
        CompletableFuture<HopResponse> completable = new CompletableFuture<>();
        Request request = newRequest(hop);
        completable.whenComplete((response, failure) ->
        {
            if (failure instanceof CancellationException)
                request.abort(failure);
        });

        if (LOG.isDebugEnabled())
            LOG.debug("Sending {} as {}", hop, request);
        request.send(new BufferingResponseListener(getMaxContentLength())
        {
            @Override
            public void onComplete(Result result)
            {
                if (result.isFailed())
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Failed {}", hop, result.getFailure());
                    completable.completeExceptionally(result.getFailure());
                    return;
                }

                Response response = result.getResponse();
                HopResponse hopResponse = new HopResponse(hop,
                    response.getVersion(),
                    response.getStatus(),
                    response.getReason(),
                    response.getHeaders(),
                    ByteBuffer.wrap(getContent()));
                if (LOG.isDebugEnabled())
                    LOG.debug("Received {} for {}", hopResponse, hop);
                completable.complete(hopResponse);
            }
        });
        return completable;
    }

    protected Request newRequest(HopRequest hop)
    {
        Request request = httpClient.newRequest(hop.getURI())
            .method(hop.getMethod())
            .version(hop.getVersion())
            .followRedirects(false)
            .headers(headers ->
            {
                for (HttpField field : hop.getHeaders())
                {
                    // Framing is computed by HttpClient from the content.
                    if (field.getHeader() == HttpHeader.CONTENT_LENGTH || field.getHeader() == HttpHeader.TRANSFER_ENCODING)
                        continue;
                    headers.add(field);
                }
            });
        if (hop.getContentLength() > 0)
            request.body(new ByteBufferRequestContent(hop.getContentType() == null ? "application/octet-stream" : hop.getContentType(), hop.getContent()));
        long timeout = getTimeout();
        if (timeout > 0)
            request.timeout(timeout, TimeUnit.MILLISECONDS);
        return request;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s]", JettyHttpTransport.class.getSimpleName(), hashCode(), httpClient);
    }
}
