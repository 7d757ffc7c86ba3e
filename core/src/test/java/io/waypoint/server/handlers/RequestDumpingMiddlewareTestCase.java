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

import io.waypoint.server.HandlerAdapter;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.server.Router;
import io.waypoint.server.RoutingHandler;
import io.waypoint.testutils.category.UnitTest;
import io.waypoint.util.StatusCodes;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class RequestDumpingMiddlewareTestCase {

    @Test
    public void testResponseIsPassedThrough() throws Exception {
        Router router = new Router();
        router.get("/items/{id:int}", HandlerAdapter.builder().param("id").build(args -> Response.text("item " + args.get("id"))));
        RequestDumpingMiddleware middleware = new RequestDumpingMiddleware();

        Response response = middleware.handle(Request.builder().setPath("/items/3?verbose=true").addHeader("Accept", "*/*").build(), new RoutingHandler(router));
        Assert.assertEquals("item 3", response.getBodyAsString());
    }

    @Test
    public void testExceptionIsRethrown() throws Exception {
        try {
            new RequestDumpingMiddleware().handle(Request.builder().build(), request -> {
                throw new IllegalStateException("broken");
            });
            Assert.fail("expected the exception to propagate");
        } catch (IllegalStateException expected) {
            Assert.assertEquals("broken", expected.getMessage());
        }
    }

    @Test
    public void testResponseCodeHandler() throws Exception {
        Response response = ResponseCodeHandler.HANDLE_403.handleRequest(Request.builder().build());
        Assert.assertEquals(StatusCodes.FORBIDDEN, response.getStatusCode());
        Assert.assertEquals(StatusCodes.FORBIDDEN_STRING, response.getBodyAsString());
        Assert.assertNotSame(response, ResponseCodeHandler.HANDLE_403.handleRequest(Request.builder().build()));
    }
}
