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

package io.waypoint;

import java.util.List;

import io.waypoint.server.HttpHandler;
import io.waypoint.server.MiddlewareChain;
import io.waypoint.server.Router;
import io.waypoint.server.RoutingHandler;
import io.waypoint.server.handlers.ExceptionMiddleware;
import io.waypoint.server.handlers.RequestDumpingMiddleware;
import io.waypoint.server.handlers.ResponseCodeHandler;
import io.waypoint.server.handlers.TrustedHostMiddleware;

/**
 * Utility class with convenience methods for dealing with handlers
 */
public class Handlers {

    /**
     * Creates a new router
     *
     * @return A new router
     */
    public static Router router() {
        return new Router();
    }

    /**
     * Creates a new router whose templates all start with the given prefix
     *
     * @param prefix The prefix
     * @return A new router
     */
    public static Router router(final String prefix) {
        return new Router(prefix);
    }

    /**
     * Creates a handler that dispatches requests to the routes of a router
     *
     * @param router The router
     * @return A new routing handler
     */
    public static RoutingHandler routing(final Router router) {
        return new RoutingHandler(router);
    }

    /**
     * @return A new, empty, middleware chain
     */
    public static MiddlewareChain chain() {
        return new MiddlewareChain();
    }

    /**
     * Returns a handler that answers with the given response code
     *
     * @param code The response code
     * @return A response code handler
     */
    public static ResponseCodeHandler responseCode(final int code) {
        return new ResponseCodeHandler(code);
    }

    /**
     * Returns middleware that turns exceptions into error responses
     *
     * @param debug If the response should describe the exception
     * @return The exception middleware
     */
    public static ExceptionMiddleware exceptionMiddleware(final boolean debug) {
        return new ExceptionMiddleware(debug);
    }

    /**
     * Returns middleware that only lets requests for the given hosts through
     *
     * @param allowedHosts The allowed hosts
     * @return The trusted host middleware
     */
    public static TrustedHostMiddleware trustedHost(final List<String> allowedHosts) {
        return new TrustedHostMiddleware(allowedHosts);
    }

    /**
     * Returns middleware that dumps requests to the log
     *
     * @return The request dumping middleware
     */
    public static RequestDumpingMiddleware requestDump() {
        return new RequestDumpingMiddleware();
    }

    private Handlers() {

    }

    public static void handlerNotNull(final HttpHandler handler) {
        if (handler == null) {
            throw WaypointMessages.MESSAGES.handlerCannotBeNull();
        }
    }
}
