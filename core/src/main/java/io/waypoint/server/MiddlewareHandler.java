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

import io.waypoint.Handlers;

/**
 * One layer of a composed middleware chain: a middleware bound to the handler it wraps.
 */
final class MiddlewareHandler implements HttpHandler {

    private final Middleware middleware;
    private final HttpHandler next;

    MiddlewareHandler(final Middleware middleware, final HttpHandler next) {
        Handlers.handlerNotNull(next);
        this.middleware = middleware;
        this.next = next;
    }

    @Override
    public Response handleRequest(final Request request) throws Exception {
        return middleware.handle(request, next);
    }

    Middleware getMiddleware() {
        return middleware;
    }

    HttpHandler getNext() {
        return next;
    }

    @Override
    public String toString() {
        return "middleware( " + middleware + " -> " + next + " )";
    }
}
