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

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.jetty.util.IteratingCallback;
import org.redirector.client.api.ClientRequest;
import org.redirector.client.api.HopRequest;
import org.redirector.client.api.HopResponse;
import org.redirector.client.api.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Drives one request through a chain of redirects.</p>
 * <p>A conversation first buffers the request content, then repeatedly builds a
 * request from its {@link RedirectStateMachine}, sends it with the
 * {@link HttpTransport} and feeds the response back to the state machine, until
 * the state machine decides that the response must be returned.</p>
 * <p>Each step starts from the completion of the previous one, so there is at
 * most one outstanding operation; any failure completes the conversation.
 * Hops are driven by an {@link IteratingCallback}, so a transport that completes
 * synchronously does not grow the stack with each redirect.
 * Cancelling the future returned by {@link #start()} cancels the outstanding
 * operation.</p>
 */
public class RedirectConversation
{
    private static final Logger LOG = LoggerFactory.getLogger(RedirectConversation.class);

    public enum State
    {
        IDLE, BUFFERING, REQUESTING, COMPLETED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final CompletableFuture<HopResponse> completable = new CompletableFuture<>();
    private final HopLoop loop = new HopLoop();
    private final HttpTransport transport;
    private final RedirectStateMachine machine;
    private final ContentBuffer buffer;
    private volatile CompletableFuture<?> pending;
    private volatile int sends;

    public RedirectConversation(HttpTransport transport, ClientRequest request, int maxRedirects, boolean normalizeDefaultPorts)
    {
        this.transport = transport;
        this.machine = new RedirectStateMachine(request, maxRedirects, normalizeDefaultPorts);
        this.buffer = new ContentBuffer(request.takeBody());
    }

    /**
     * @return a future completed with the final response of the redirect chain
     * @throws IllegalStateException if the conversation has already been started
     */
    public CompletableFuture<HopResponse> start()
    {
        if (!state.compareAndSet(State.IDLE, State.BUFFERING))
            throw new IllegalStateException("Conversation already started: " + this);

        completable.whenComplete((response, failure) ->
        {
            state.set(State.COMPLETED);
            CompletableFuture<?> operation = pending;
            if (failure != null && operation != null)
                operation.cancel(false);
        });

        if (LOG.isDebugEnabled())
            LOG.debug("Buffering content for {}", this);
        CompletableFuture<ByteBuffer> buffering;
        try
        {
            buffering = buffer.drain();
        }
        catch (Throwable x)
        {
            fail(new ContentReadException(x));
            return completable;
        }
        pending = buffering;
        // Cancelled before the buffering was published.
        if (completable.isDone())
            buffering.cancel(false);
        buffering.whenComplete(this::onContentBuffered);
        return completable;
    }

    private void onContentBuffered(ByteBuffer content, Throwable failure)
    {
        try
        {
            if (failure != null)
            {
                fail(new ContentReadException(unwrap(failure)));
                return;
            }
            if (completable.isDone())
                return;
            machine.setContent(content);
            loop.iterate();
        }
        catch (Throwable x)
        {
            fail(x instanceof RedirectException ? (RedirectException)x : new ContentReadException(x));
        }
    }

    private void succeed(HopResponse response)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Completed {} with {}", this, response);
        completable.complete(response);
    }

    private void fail(RedirectException failure)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Failed {}", this, failure);
        completable.completeExceptionally(failure);
    }

    private static RedirectException toRedirectException(Throwable failure)
    {
        Throwable cause = unwrap(failure);
        return cause instanceof RedirectException ? (RedirectException)cause : new TransportException(cause);
    }

    private static Throwable unwrap(Throwable failure)
    {
        Throwable result = failure;
        while ((result instanceof CompletionException || result instanceof ExecutionException) && result.getCause() != null)
        {
            result = result.getCause();
        }
        return result;
    }

    public State getState()
    {
        return state.get();
    }

    /**
     * @return the number of requests sent so far
     */
    public int getSends()
    {
        return sends;
    }

    public RedirectStateMachine getStateMachine()
    {
        return machine;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s, sends=%d, %s]", RedirectConversation.class.getSimpleName(), hashCode(), state.get(), sends, machine);
    }

    /**
     * <p>Sends one hop per iteration.</p>
     * <p>The outcome of a send is recorded and {@link #succeeded()} is invoked, so that
     * the next iteration handles it; when the send completes synchronously the
     * iteration continues in the same loop rather than in a nested call.</p>
     */
    private class HopLoop extends IteratingCallback
    {
        private HopResponse response;
        private Throwable failure;

        @Override
        protected Action process()
        {
            try
            {
                if (completable.isDone())
                    return Action.SUCCEEDED;

                HopResponse received = response;
                Throwable failed = failure;
                response = null;
                failure = null;

                if (failed != null)
                {
                    fail(toRedirectException(failed));
                    return Action.SUCCEEDED;
                }

                if (received != null && machine.onResponse(received) == RedirectStateMachine.Decision.RETURN)
                {
                    succeed(received);
                    return Action.SUCCEEDED;
                }

                return send();
            }
            catch (Throwable x)
            {
                fail(toRedirectException(x));
                return Action.SUCCEEDED;
            }
        }

        private Action send()
        {
            HopRequest request = machine.newHopRequest();

            state.compareAndSet(State.BUFFERING, State.REQUESTING);
            ++sends;
            if (LOG.isDebugEnabled())
                LOG.debug("Sending #{} {} on {}", sends, request, RedirectConversation.this);

            CompletableFuture<HopResponse> sending = transport.send(request);
            if (sending == null)
                throw new IllegalStateException("Transport returned no future for " + request);
            pending = sending;
            // Cancelled before the send was published.
            if (completable.isDone())
                sending.cancel(false);
            sending.whenComplete(this::onSent);
            return Action.SCHEDULED;
        }

        private void onSent(HopResponse hopResponse, Throwable x)
        {
            if (x != null)
                failure = x;
            else if (hopResponse == null)
                failure = new IllegalStateException("Transport completed with no response");
            else
                response = hopResponse;
            succeeded();
        }

        @Override
        protected void onCompleteFailure(Throwable cause)
        {
            fail(toRedirectException(cause));
        }
    }
}
