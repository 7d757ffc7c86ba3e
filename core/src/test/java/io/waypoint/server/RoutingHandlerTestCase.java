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

package io.waypoint.server;

import io.waypoint.testutils.category.UnitTest;
import io.waypoint.util.StatusCodes;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class RoutingHandlerTestCase {

    private Router router;
    private RoutingHandler handler;

    @Before
    public void setup() {
        router = new Router();
        router.get("/users/{id:int}", HandlerAdapter.builder()
                .request()
                .param("id", Long.class)
                .build(args -> Response.text("user " + args.getLong("id") + " " + args.getRequest().getPathParameter("id"))));
        router.post("/users", request -> Response.text(StatusCodes.OK, "created " + request.getBodyAsString()));
        router.put("/users", request -> Response.status(StatusCodes.NO_CONTENT));
        handler = new RoutingHandler(router);
    }

    @Test
    public void testDispatch() throws Exception {
        Request request = Request.builder().setPath("/users/12").build();
        Response response = handler.handleRequest(request);
        Assert.assertEquals(StatusCodes.OK, response.getStatusCode());
        Assert.assertEquals("user 12 12", response.getBodyAsString());

        RouteMatch match = request.getAttachment(RouteMatch.ATTACHMENT_KEY);
        Assert.assertNotNull(match);
        Assert.assertEquals("/users/{id:int}", match.getMatchedTemplate());
        Assert.assertEquals(Long.valueOf(12), request.getPathParameters().get("id"));
    }

    @Test
    public void testBody() throws Exception {
        Response response = handler.handleRequest(Request.builder().setMethod("POST").setPath("/users").setBody("bob").build());
        Assert.assertEquals("created bob", response.getBodyAsString());
    }

    @Test
    public void testNotFound() throws Exception {
        Response response = handler.handleRequest(Request.builder().setPath("/accounts").build());
        Assert.assertEquals(StatusCodes.NOT_FOUND, response.getStatusCode());
        Assert.assertEquals(StatusCodes.NOT_FOUND_STRING, response.getBodyAsString());

        //the int conversion fails and no other route matches the path
        response = handler.handleRequest(Request.builder().setPath("/users/abc").build());
        Assert.assertEquals(StatusCodes.NOT_FOUND, response.getStatusCode());
    }

    @Test
    public void testMethodNotAllowed() throws Exception {
        Response response = handler.handleRequest(Request.builder().setMethod("DELETE").setPath("/users").build());
        Assert.assertEquals(StatusCodes.METHOD_NOT_ALLOWED, response.getStatusCode());
        Assert.assertEquals("POST, PUT", response.getHeader("allow"));
    }

    @Test
    public void testReplacedHandlers() throws Exception {
        handler.setFallbackHandler(request -> Response.text(StatusCodes.NOT_FOUND, "nothing at " + request.getPath()));
        handler.setInvalidMethodHandler(request -> Response.text(StatusCodes.BAD_REQUEST, "bad method").setHeader(RoutingHandler.ALLOW, "custom"));

        Assert.assertEquals("nothing at /nowhere", handler.handleRequest(Request.builder().setPath("/nowhere").build()).getBodyAsString());
        Response response = handler.handleRequest(Request.builder().setMethod("PATCH").setPath("/users/").build());
        Assert.assertEquals(StatusCodes.BAD_REQUEST, response.getStatusCode());
        Assert.assertEquals("custom", response.getHeader(RoutingHandler.ALLOW));
    }

    @Test
    public void testRoutesAddedAfterConstructionAreSeen() throws Exception {
        router.get("/late", request -> Response.text("late"));
        Assert.assertEquals("late", handler.handleRequest(Request.builder().setPath("/late").build()).getBodyAsString());
    }
}
