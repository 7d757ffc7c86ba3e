/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.waypoint.server.handlers;

import java.util.Arrays;
import java.util.Collections;

import io.waypoint.WaypointOptions;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.testutils.category.UnitTest;
import io.waypoint.util.StatusCodes;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.xnio.OptionMap;
import org.xnio.Sequence;

@Category(UnitTest.class)
public class TrustedHostMiddlewareTestCase {

    private static final HttpHandler OK = request -> Response.text("ok");

    private static int status(TrustedHostMiddleware middleware, String host) throws Exception {
        Request.Builder builder = Request.builder();
        if (host != null) {
            builder.addHeader("Host", host);
        }
        return middleware.handle(builder.build(), OK).getStatusCode();
    }

    @Test
    public void testExactAndWildcardHosts() throws Exception {
        TrustedHostMiddleware middleware = new TrustedHostMiddleware(Arrays.asList("localhost", "*.myapp.com"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "localhost"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "localhost:8080"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "LocalHost"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "api.myapp.com"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "a.b.myapp.com:443"));
        Assert.assertEquals(StatusCodes.BAD_REQUEST, status(middleware, "myapp.com"));
        Assert.assertEquals(StatusCodes.BAD_REQUEST, status(middleware, "evil.com"));
        Assert.assertEquals(StatusCodes.BAD_REQUEST, status(middleware, "evilmyapp.com"));
        Assert.assertEquals(StatusCodes.BAD_REQUEST, status(middleware, null));
    }

    @Test
    public void testRejectedRequestDoesNotReachHandler() throws Exception {
        TrustedHostMiddleware middleware = new TrustedHostMiddleware(Collections.singletonList("localhost"));
        final boolean[] called = new boolean[1];
        Response response = middleware.handle(Request.builder().addHeader("Host", "other").build(), request -> {
            called[0] = true;
            return Response.text("ok");
        });
        Assert.assertEquals(StatusCodes.BAD_REQUEST, response.getStatusCode());
        Assert.assertFalse(called[0]);
    }

    @Test
    public void testAllowAll() throws Exception {
        Assert.assertEquals(StatusCodes.OK, status(new TrustedHostMiddleware(OptionMap.EMPTY), "anything"));
        Assert.assertEquals(StatusCodes.OK, status(new TrustedHostMiddleware(Collections.singletonList("*")), null));
    }

    @Test
    public void testFromOptions() throws Exception {
        TrustedHostMiddleware middleware = new TrustedHostMiddleware(OptionMap.create(WaypointOptions.ALLOWED_HOSTS, Sequence.of("example.org")));
        Assert.assertEquals(Collections.singletonList("example.org"), middleware.getAllowedHosts());
        Assert.assertEquals(StatusCodes.OK, status(middleware, "example.org"));
        Assert.assertEquals(StatusCodes.BAD_REQUEST, status(middleware, "example.com"));
    }

    @Test
    public void testIpv6Host() throws Exception {
        TrustedHostMiddleware middleware = new TrustedHostMiddleware(Collections.singletonList("[::1]"));
        Assert.assertEquals(StatusCodes.OK, status(middleware, "[::1]:8080"));
    }
}
