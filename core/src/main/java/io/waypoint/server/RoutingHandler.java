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

import java.util.Set;

import io.waypoint.Handlers;
import io.waypoint.WaypointMessages;
import io.waypoint.server.handlers.ResponseCodeHandler;

/**
 * The terminal handler of an application: dispatches a request to the route it matches.
 * <p>
 * If no route matches the path the fallback handler is invoked, by default answering 404. If a route
 * matches the path but not the method the invalid method handler is invoked, by default answering 405
 * with an {@code Allow} header listing the methods that would have matched.
 */
public class RoutingHandler implements HttpHandler {

    public static final String ALLOW = "Allow";

    private final Router router;

    private volatile HttpHandler fallbackHandler = ResponseCodeHandler.HANDLE_404;
    private volatile HttpHandler invalidMethodHandler = ResponseCodeHandler.HANDLE_405;

    public RoutingHandler(final Router router) {
        if (router == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("router");
        }
        this.router = router;
    }

    @Override
    public Response handleRequest(final Request request) throws Exception {
        final RouteMatch match = router.find(request.getPath(), request.getMethod());
        if (match != null) {
            request.setPathParameters(match.getParameters());
            request.putAttachment(RouteMatch.ATTACHMENT_KEY, match);
            return match.getRoute().handle(request);
        }
        final Set<String> allowed = router.allowedMethods(request.getPath());
        if (allowed.isEmpty()) {
            return fallbackHandler.handleRequest(request);
        }
        final Response response = invalidMethodHandler.handleRequest(request);
        if (response.getHeader(ALLOW) == null) {
            response.setHeader(ALLOW, String.join(", ", allowed));
        }
        return response;
    }

    public Router getRouter() {
        return router;
    }

    public HttpHandler getFallbackHandler() {
        return fallbackHandler;
    }

    /**
     * @param fallbackHandler Handler that will be called when no route matches the path.
     *
     * @return This instance.
     */
    public RoutingHandler setFallbackHandler(final HttpHandler fallbackHandler) {
        Handlers.handlerNotNull(fallbackHandler);
        this.fallbackHandler = fallbackHandler;
        return this;
    }

    public HttpHandler getInvalidMethodHandler() {
        return invalidMethodHandler;
    }

    /**
     * @param invalidMethodHandler Handler that will be called when a route matches the path but not the method.
     *
     * @return This instance.
     */
    public RoutingHandler setInvalidMethodHandler(final HttpHandler invalidMethodHandler) {
        Handlers.handlerNotNull(invalidMethodHandler);
        this.invalidMethodHandler = invalidMethodHandler;
        return this;
    }
}
