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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Drains a {@link Request.Content} into a single, read-only {@link ByteBuffer}.</p>
 * <p>Chunks are demanded one at a time; the buffer waits for the content to produce
 * the next chunk without blocking.
 * The whole content is accumulated before {@link #drain()} completes, so that it
 * can be resent verbatim on every hop of a redirect chain.</p>
 * <p>A {@code ContentBuffer} is one-shot: {@link #drain()} may be invoked only once.</p>
 */
public class ContentBuffer implements Request.Content.Consumer
{
    private static final Logger LOG = LoggerFactory.getLogger(ContentBuffer.class);
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private final AtomicBoolean drained = new AtomicBoolean();
    private final CompletableFuture<ByteBuffer> completable = new CompletableFuture<>();
    private final ByteArrayOutputStream accumulator = new ByteArrayOutputStream();
    private final Request.Content content;
    private final int maxContentLength;
    private volatile Request.Content.Subscription subscription;

    /**
     * @param content the content to drain, or null if there is no content
     */
    public ContentBuffer(Request.Content content)
    {
        this(content, MAX_ARRAY_LENGTH);
    }

    /**
     * @param content the content to drain, or null if there is no content
     * @param maxContentLength the max number of bytes to buffer
     */
    public ContentBuffer(Request.Content content, int maxContentLength)
    {
        if (maxContentLength < 0 || maxContentLength > MAX_ARRAY_LENGTH)
            throw new IllegalArgumentException("Invalid max content length " + maxContentLength);
        this.content = content;
        this.maxContentLength = maxContentLength;
    }

    /**
     * <p>Starts draining the content.</p>
     * <p>Cancelling the returned future fails the subscription to the content.</p>
     *
     * @return a future completed with the whole content, or completed exceptionally
     * with the failure reported by the content
     * @throws IllegalStateException if this method has already been invoked
     */
    public CompletableFuture<ByteBuffer> drain()
    {
        if (!drained.compareAndSet(false, true))
            throw new IllegalStateException("Content already drained: " + this);

        if (content == null)
        {
            completable.complete(BufferUtil.EMPTY_BUFFER);
            return completable;
        }

        long length = content.getLength();
        if (length > maxContentLength)
        {
            completable.completeExceptionally(new IllegalArgumentException("Content too large to buffer: " + length + " > " + maxContentLength));
            return completable;
        }

        completable.whenComplete((result, failure) ->
        {
            Request.Content.Subscription s = subscription;
            if (failure != null && s != null)
                s.fail(failure);
        });
        subscription = content.subscribe(this, true);
        if (completable.isDone())
            subscription.fail(new IllegalStateException("Content buffering already completed"));
        else
            subscription.demand();
        return completable;
    }

    @Override
    public void onContent(ByteBuffer buffer, boolean last, Callback callback)
    {
        if (completable.isDone())
        {
            callback.failed(new IllegalStateException("Content buffering already completed"));
            return;
        }

        int size = buffer.remaining();
        // The length may be unknown up front.
        if ((long)accumulator.size() + size > maxContentLength)
        {
            IllegalArgumentException failure = new IllegalArgumentException("Content too large to buffer: more than " + maxContentLength);
            callback.failed(failure);
            completable.completeExceptionally(failure);
            return;
        }
        if (size > 0)
        {
            byte[] bytes = new byte[size];
            buffer.get(bytes);
            accumulator.write(bytes, 0, size);
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Buffered {} bytes, last={}, total={} for {}", size, last, accumulator.size(), this);
        callback.succeeded();

        if (last)
            completable.complete(ByteBuffer.wrap(accumulator.toByteArray()).asReadOnlyBuffer());
        else
            subscription.demand();
    }

    @Override
    public void onFailure(Throwable failure)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Content failure while buffering {}", this, failure);
        completable.completeExceptionally(failure);
    }

    public int getMaxContentLength()
    {
        return maxContentLength;
    }

    public boolean isDrained()
    {
        return drained.get();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[content=%s]", ContentBuffer.class.getSimpleName(), hashCode(), content);
    }
}
