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
import java.nio.charset.StandardCharsets;

import org.eclipse.jetty.client.util.BytesRequestContent;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.util.BufferUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.redirector.client.api.ClientRequest;
import org.redirector.client.api.HopRequest;
import org.redirector.client.api.HopResponse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RedirectStateMachineTest
{
    private static final String BODY = "field=value";

    private RedirectStateMachine newPost(String uri, int maxRedirects)
    {
        ClientRequest request = new ClientRequest(uri)
            .method(HttpMethod.POST)
            .version(HttpVersion.HTTP_1_0)
            .header(HttpHeader.AUTHORIZATION, "Basic dXNlcjpwYXNz")
            .header(HttpHeader.COOKIE, "session=1")
            .header("Cookie2", "$Version=1")
            .header(HttpHeader.WWW_AUTHENTICATE, "Basic realm=test")
            .header(HttpHeader.CONTENT_LENGTH, String.valueOf(BODY.length()))
            .header("X-Custom", "kept")
            .body(new BytesRequestContent("application/x-www-form-urlencoded", BODY.getBytes(StandardCharsets.UTF_8)));
        RedirectStateMachine machine = new RedirectStateMachine(request, maxRedirects, false);
        machine.setContent(BufferUtil.toBuffer(BODY, StandardCharsets.UTF_8).asReadOnlyBuffer());
        return machine;
    }

    private static HopResponse redirect(HopRequest request, int status, String location)
    {
        HttpFields.Mutable headers = HttpFields.build();
        if (location != null)
            headers.add(HttpHeader.LOCATION, location);
        return new HopResponse(request, status, headers);
    }

    private static void assertSensitiveHeaders(HttpFields headers, boolean present)
    {
        assertThat(headers.contains(HttpHeader.AUTHORIZATION), is(present));
        assertThat(headers.contains(HttpHeader.COOKIE), is(present));
        assertThat(headers.contains("Cookie2"), is(present));
        assertThat(headers.contains(HttpHeader.WWW_AUTHENTICATE), is(present));
        assertThat(headers.get("X-Custom"), is("kept"));
    }

    @Test
    public void testHeadersAreMovedOutOfTheRequest()
    {
        ClientRequest request = new ClientRequest("http://localhost/")
            .header("X-Custom", "value");

        RedirectStateMachine machine = new RedirectStateMachine(request, 1, false);

        assertThat(request.getHeaders().size(), is(0));
        assertThat(machine.getHeaders().get("X-Custom"), is("value"));
    }

    @Test
    public void testHopRequestCarriesCurrentState()
    {
        RedirectStateMachine machine = newPost("http://localhost:8080/form", 3);

        HopRequest hop = machine.newHopRequest();

        assertThat(hop.getMethod(), is("POST"));
        assertThat(hop.getURI(), is(URI.create("http://localhost:8080/form")));
        assertThat(hop.getVersion(), is(HttpVersion.HTTP_1_0));
        assertThat(hop.getContentType(), is("application/x-www-form-urlencoded"));
        assertThat(BufferUtil.toString(hop.getContent(), StandardCharsets.UTF_8), is(BODY));
        assertThat(hop.getHeaders().get("X-Custom"), is("kept"));
    }

    @Test
    public void testContentDefaultsToEmpty()
    {
        RedirectStateMachine machine = new RedirectStateMachine(new ClientRequest("http://localhost/"), 1, false);

        HopRequest hop = machine.newHopRequest();

        assertThat(hop.getContentLength(), is(0));
        assertThat(hop.getContentType(), nullValue());
    }

    @Test
    public void testSetContentTwiceThrows()
    {
        RedirectStateMachine machine = newPost("http://localhost/", 1);

        assertThrows(IllegalStateException.class, () -> machine.setContent(ByteBuffer.allocate(1)));
    }

    @Test
    public void testNegativeMaxRedirectsThrows()
    {
        assertThrows(IllegalArgumentException.class, () -> new RedirectStateMachine(new ClientRequest("http://localhost/"), -1, false));
    }

    @ParameterizedTest
    @ValueSource(ints = {301, 302, 307, 308})
    public void testRedirectKeepsMethodAndContent(int status)
    {
        RedirectStateMachine machine = newPost("http://localhost/one", 5);

        RedirectStateMachine.Decision decision = machine.onResponse(redirect(machine.newHopRequest(), status, "/two"));

        assertThat(decision, is(RedirectStateMachine.Decision.CONTINUE));
        HopRequest next = machine.newHopRequest();
        assertThat(next.getMethod(), is("POST"));
        assertThat(next.getURI(), is(URI.create("http://localhost/two")));
        assertThat(BufferUtil.toString(next.getContent(), StandardCharsets.UTF_8), is(BODY));
        assertThat(next.getHeaders().get(HttpHeader.CONTENT_LENGTH), is(String.valueOf(BODY.length())));
        assertThat(machine.getRemainingRedirects(), is(4));
    }

    @ParameterizedTest
    @ValueSource(strings = {"POST", "PUT", "DELETE", "PATCH", "GET"})
    public void testSeeOtherForcesGetWithoutContent(String method)
    {
        ClientRequest request = new ClientRequest("http://localhost/form")
            .method(method)
            .header(HttpHeader.CONTENT_TYPE, "text/plain")
            .header(HttpHeader.CONTENT_LENGTH, "4")
            .body(new BytesRequestContent("text/plain", "data".getBytes(StandardCharsets.UTF_8)));
        RedirectStateMachine machine = new RedirectStateMachine(request, 5, false);
        machine.setContent(BufferUtil.toBuffer("data"));

        RedirectStateMachine.Decision decision = machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.SEE_OTHER_303, "/result"));

        assertThat(decision, is(RedirectStateMachine.Decision.CONTINUE));
        assertThat(machine.getContent(), nullValue());
        HopRequest next = machine.newHopRequest();
        assertThat(next.getMethod(), is("GET"));
        assertThat(next.getContentLength(), is(0));
        assertThat(next.getContentType(), nullValue());
        assertFalse(next.getHeaders().contains(HttpHeader.CONTENT_TYPE));
        assertFalse(next.getHeaders().contains(HttpHeader.CONTENT_LENGTH));
        assertThat(next.getURI(), is(URI.create("http://localhost/result")));
    }

    @Test
    public void testSeeOtherThenTemporaryRedirectStaysGet()
    {
        RedirectStateMachine machine = newPost("http://localhost/a", 5);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.SEE_OTHER_303, "/b"));
        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.TEMPORARY_REDIRECT_307, "/c"));

        HopRequest next = machine.newHopRequest();
        assertThat(next.getMethod(), is("GET"));
        assertThat(next.getContentLength(), is(0));
        assertThat(next.getURI().getPath(), is("/c"));
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 202, 204, 300, 304, 305, 306, 400, 404, 500})
    public void testNonRedirectStatusReturns(int status)
    {
        RedirectStateMachine machine = newPost("http://localhost/one", 5);

        RedirectStateMachine.Decision decision = machine.onResponse(redirect(machine.newHopRequest(), status, "/elsewhere"));

        assertThat(decision, is(RedirectStateMachine.Decision.RETURN));
        assertThat(machine.getURI(), is(URI.create("http://localhost/one")));
        assertThat(machine.getMethod(), is("POST"));
        assertThat(machine.getRemainingRedirects(), is(5));
    }

    @Test
    public void testMissingLocationReturns()
    {
        RedirectStateMachine machine = newPost("http://localhost/one", 5);

        RedirectStateMachine.Decision decision = machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, null));

        assertThat(decision, is(RedirectStateMachine.Decision.RETURN));
        assertThat(machine.getURI(), is(URI.create("http://localhost/one")));
        assertThat(machine.getRemainingRedirects(), is(4));
    }

    @Test
    public void testExhaustedBudgetReturns()
    {
        RedirectStateMachine machine = newPost("http://localhost/0", 2);

        assertThat(machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "/1")), is(RedirectStateMachine.Decision.CONTINUE));
        assertThat(machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "/2")), is(RedirectStateMachine.Decision.CONTINUE));
        assertThat(machine.getRemainingRedirects(), is(0));

        assertThat(machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "/3")), is(RedirectStateMachine.Decision.RETURN));
        assertThat(machine.getRemainingRedirects(), is(0));
        assertThat(machine.getURI().getPath(), is("/2"));
    }

    @Test
    public void testZeroBudgetNeverFollows()
    {
        RedirectStateMachine machine = newPost("http://localhost/0", 0);

        assertThat(machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.MOVED_PERMANENTLY_301, "/1")), is(RedirectStateMachine.Decision.RETURN));
        assertThat(machine.getURI().getPath(), is("/0"));
    }

    @Test
    public void testInvalidLocationThrows()
    {
        RedirectStateMachine machine = newPost("http://localhost/one", 5);

        InvalidLocationException x = assertThrows(InvalidLocationException.class,
            () -> machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "http://bad host/")));

        assertThat(x.getLocation(), is("http://bad host/"));
    }

    @Test
    public void testSameHostAndPortKeepsSensitiveHeaders()
    {
        RedirectStateMachine machine = newPost("http://localhost:8080/one", 5);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.TEMPORARY_REDIRECT_307, "http://localhost:8080/two"));
        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.TEMPORARY_REDIRECT_307, "https://localhost:8080/three"));
        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.TEMPORARY_REDIRECT_307, "/four"));

        assertSensitiveHeaders(machine.newHopRequest().getHeaders(), true);
    }

    @Test
    public void testDifferentHostRemovesSensitiveHeaders()
    {
        RedirectStateMachine machine = newPost("http://localhost:8080/one", 5);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.TEMPORARY_REDIRECT_307, "http://127.0.0.1:8080/two"));

        assertSensitiveHeaders(machine.newHopRequest().getHeaders(), false);
    }

    @Test
    public void testDifferentPortRemovesSensitiveHeaders()
    {
        RedirectStateMachine machine = newPost("http://localhost:8080/one", 5);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.PERMANENT_REDIRECT_308, "http://localhost:8081/two"));

        assertSensitiveHeaders(machine.newHopRequest().getHeaders(), false);
    }

    @Test
    public void testSensitiveHeadersMatchedCaseInsensitively()
    {
        ClientRequest request = new ClientRequest("http://a.com/")
            .header("authorization", "Bearer x")
            .header("COOKIE", "a=b")
            .header("cookie2", "c=d")
            .header("www-authenticate", "Bearer");
        RedirectStateMachine machine = new RedirectStateMachine(request, 1, false);
        machine.setContent(BufferUtil.EMPTY_BUFFER);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "http://b.com/"));

        assertThat(machine.getHeaders().size(), is(0));
    }

    @Test
    public void testSensitiveHeadersStayRemovedWhenComingBack()
    {
        RedirectStateMachine machine = newPost("http://localhost:8080/one", 5);

        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "http://example.org:8080/two"));
        machine.onResponse(redirect(machine.newHopRequest(), HttpStatus.FOUND_302, "http://localhost:8080/three"));

        assertSensitiveHeaders(machine.newHopRequest().getHeaders(), false);
    }

    @Test
    public void testDefaultPortNormalization()
    {
        ClientRequest literal = new ClientRequest("http://a.com/").header(HttpHeader.AUTHORIZATION, "x");
        RedirectStateMachine literalMachine = new RedirectStateMachine(literal, 1, false);
        literalMachine.setContent(BufferUtil.EMPTY_BUFFER);
        literalMachine.onResponse(redirect(literalMachine.newHopRequest(), HttpStatus.FOUND_302, "http://a.com:80/next"));
        assertFalse(literalMachine.getHeaders().contains(HttpHeader.AUTHORIZATION));

        ClientRequest normalized = new ClientRequest("http://a.com/").header(HttpHeader.AUTHORIZATION, "x");
        RedirectStateMachine normalizedMachine = new RedirectStateMachine(normalized, 1, true);
        normalizedMachine.setContent(BufferUtil.EMPTY_BUFFER);
        normalizedMachine.onResponse(redirect(normalizedMachine.newHopRequest(), HttpStatus.FOUND_302, "http://a.com:80/next"));
        assertTrue(normalizedMachine.getHeaders().contains(HttpHeader.AUTHORIZATION));
    }

    @Test
    public void testRelativeURICannotBeSent()
    {
        RedirectStateMachine machine = new RedirectStateMachine(new ClientRequest("/relative"), 1, false);

        assertThrows(RequestBuildException.class, machine::newHopRequest);
    }

    @Test
    public void testUnsupportedSchemeCannotBeSent()
    {
        RedirectStateMachine machine = new RedirectStateMachine(new ClientRequest("ftp://localhost/file"), 1, false);

        assertThrows(RequestBuildException.class, machine::newHopRequest);
    }

    @Test
    public void testInvalidMethodCannotBeSent()
    {
        RedirectStateMachine machine = new RedirectStateMachine(new ClientRequest("http://localhost/").method("BAD METHOD"), 1, false);

        assertThrows(RequestBuildException.class, machine::newHopRequest);
    }

    @Test
    public void testIsRedirect()
    {
        for (int status : new int[]{301, 302, 303, 307, 308})
        {
            assertTrue(RedirectStateMachine.isRedirect(status));
        }
        for (int status : new int[]{200, 300, 304, 305, 306, 404})
        {
            assertFalse(RedirectStateMachine.isRedirect(status));
        }
    }
}
