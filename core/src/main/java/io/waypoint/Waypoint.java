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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import io.waypoint.server.HandlerAdapter;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Middleware;
import io.waypoint.server.MiddlewareChain;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.server.Route;
import io.waypoint.server.Router;
import io.waypoint.server.RoutingHandler;
import io.waypoint.server.handlers.RequestDumpingMiddleware;
import io.waypoint.util.Methods;
import io.waypoint.util.StatusCodes;
import org.xnio.Option;
import org.xnio.OptionMap;

/**
 * Convenience class used to build a Waypoint application.
 * <p>
 * An application owns a router and a middleware chain. Routes and middleware are added while the
 * application is being set up; {@link #start()} then builds the chain around the routing handler once,
 * and from that point on {@link #handleRequest(Request)} may be called from any number of threads.
 */
public final class Waypoint {

    private final OptionMap serverOptions;
    private final Router router;
    private final RoutingHandler routingHandler;
    private final MiddlewareChain middlewareChain = new MiddlewareChain();

    private volatile HttpHandler rootHandler;

    private Waypoint(final Builder builder) {
        this.serverOptions = builder.serverOptions.getMap();
        this.router = builder.router == null ? new Router() : builder.router;
        this.routingHandler = new RoutingHandler(router);
        if (serverOptions.get(WaypointOptions.DUMP_REQUESTS, false)) {
            middlewareChain.add(new RequestDumpingMiddleware());
        }
        for (Middleware middleware : builder.middleware) {
            middlewareChain.add(middleware);
        }
    }

    /**
     * @return A builder that can be used to create a Waypoint application
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the middleware chain. Calling this more than once has no further effect.
     */
    public synchronized void start() {
        if (rootHandler != null) {
            return;
        }
        WaypointLogger.ROOT_LOGGER.debugf("Starting application with %s routes and %s middleware", router.getRoutes().size(), middlewareChain.count());
        rootHandler = middlewareChain.build(routingHandler);
    }

    public boolean isStarted() {
        return rootHandler != null;
    }

    /**
     * Runs a request through the middleware chain and the router.
     * <p>
     * An exception that escapes the chain is logged and answered with a 500 response.
     *
     * @param request the request
     * @return the response
     * @throws IllegalStateException if the application has not been started
     */
    public Response handleRequest(final Request request) {
        final HttpHandler handler = rootHandler;
        if (handler == null) {
            throw WaypointMessages.MESSAGES.serverNotStarted();
        }
        try {
            return handler.handleRequest(request);
        } catch (Exception e) {
            WaypointLogger.REQUEST_LOGGER.exceptionProcessingRequest(e);
            final String message = e.getMessage() == null ? "" : e.getMessage();
            return Response.text(StatusCodes.INTERNAL_SERVER_ERROR, StatusCodes.INTERNAL_SERVER_ERROR_STRING + ": " + message);
        }
    }

    /**
     * Adds middleware to the end of the chain, so it runs inside every middleware added before it.
     *
     * @throws ConfigurationException if the application has been started
     */
    public Waypoint addMiddleware(final Middleware middleware) {
        middlewareChain.add(middleware);
        return this;
    }

    public Waypoint includeRouter(final Router router, final String prefix) {
        this.router.include(router, prefix);
        return this;
    }

    public Waypoint includeRouter(final Router router) {
        return includeRouter(router, null);
    }

    public Route route(final String template, final Collection<String> methods, final HandlerAdapter handler, final String name, final int priority) {
        return router.register(template, methods, handler, name, priority);
    }

    public Waypoint get(final String template, final HttpHandler handler) {
        router.get(template, handler);
        return this;
    }

    public Waypoint get(final String template, final HandlerAdapter handler) {
        router.get(template, handler);
        return this;
    }

    public Waypoint post(final String template, final HttpHandler handler) {
        router.post(template, handler);
        return this;
    }

    public Waypoint post(final String template, final HandlerAdapter handler) {
        router.post(template, handler);
        return this;
    }

    public Waypoint put(final String template, final HttpHandler handler) {
        router.put(template, handler);
        return this;
    }

    public Waypoint put(final String template, final HandlerAdapter handler) {
        router.put(template, handler);
        return this;
    }

    public Waypoint delete(final String template, final HttpHandler handler) {
        router.delete(template, handler);
        return this;
    }

    public Waypoint delete(final String template, final HandlerAdapter handler) {
        router.delete(template, handler);
        return this;
    }

    public Waypoint patch(final String template, final HttpHandler handler) {
        router.patch(template, handler);
        return this;
    }

    public Waypoint patch(final String template, final HandlerAdapter handler) {
        router.patch(template, handler);
        return this;
    }

    public Waypoint head(final String template, final HttpHandler handler) {
        router.add(Methods.HEAD, template, handler);
        return this;
    }

    public Waypoint head(final String template, final HandlerAdapter handler) {
        router.add(Methods.HEAD, template, handler);
        return this;
    }

    public Waypoint options(final String template, final HttpHandler handler) {
        router.add(Methods.OPTIONS, template, handler);
        return this;
    }

    public Waypoint options(final String template, final HandlerAdapter handler) {
        router.add(Methods.OPTIONS, template, handler);
        return this;
    }

    public Router getRouter() {
        return router;
    }

    public RoutingHandler getRoutingHandler() {
        return routingHandler;
    }

    public MiddlewareChain getMiddlewareChain() {
        return middlewareChain;
    }

    public OptionMap getServerOptions() {
        return serverOptions;
    }

    public static final class Builder {

        private final OptionMap.Builder serverOptions = OptionMap.builder();
        private final List<Middleware> middleware = new ArrayList<>();
        private Router router;

        private Builder() {

        }

        public Waypoint build() {
            return new Waypoint(this);
        }

        /**
         * Uses an existing router instead of creating one.
         */
        public Builder setRouter(final Router router) {
            this.router = router;
            return this;
        }

        public Builder addMiddleware(final Middleware middleware) {
            if (middleware == null) {
                throw WaypointMessages.MESSAGES.argumentCannotBeNull("middleware");
            }
            this.middleware.add(middleware);
            return this;
        }

        public <T> Builder setServerOption(final Option<T> option, final T value) {
            serverOptions.set(option, value);
            return this;
        }

        public Builder setServerOptions(final OptionMap options) {
            serverOptions.addAll(options);
            return this;
        }
    }
}
