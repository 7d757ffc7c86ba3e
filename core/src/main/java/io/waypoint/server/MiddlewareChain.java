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

import java.util.ArrayList;
import java.util.List;

import io.waypoint.Handlers;
import io.waypoint.WaypointLogger;
import io.waypoint.WaypointMessages;

/**
 * Composes middleware around a terminal handler.
 * <p>
 * The middleware added first is the outermost: it sees the request first and the response last. A chain
 * can be built once. After that it is frozen and every attempt to modify it fails, as does building it
 * around a different terminal handler.
 */
public class MiddlewareChain {

    private final List<Middleware> middleware = new ArrayList<>();
    private HttpHandler terminal;
    private HttpHandler built;

    public synchronized MiddlewareChain add(final Middleware middleware) {
        if (middleware == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("middleware");
        }
        if (built != null) {
            throw WaypointMessages.MESSAGES.middlewareChainAlreadyBuilt();
        }
        this.middleware.add(middleware);
        return this;
    }

    /**
     * Builds the composed handler.
     *
     * @param terminal the handler the innermost middleware delegates to
     * @return the composed handler, which is {@code terminal} itself if the chain is empty
     */
    public synchronized HttpHandler build(final HttpHandler terminal) {
        Handlers.handlerNotNull(terminal);
        if (built != null) {
            if (this.terminal != terminal) {
                throw WaypointMessages.MESSAGES.middlewareChainBuiltForOtherHandler();
            }
            return built;
        }
        HttpHandler current = terminal;
        for (int i = middleware.size() - 1; i >= 0; --i) {
            current = new MiddlewareHandler(middleware.get(i), current);
        }
        this.terminal = terminal;
        this.built = current;
        WaypointLogger.ROOT_LOGGER.middlewareChainBuilt(middleware.size());
        return current;
    }

    public synchronized int count() {
        return middleware.size();
    }

    public synchronized boolean isBuilt() {
        return built != null;
    }

    public synchronized void clear() {
        if (built != null) {
            throw WaypointMessages.MESSAGES.middlewareChainAlreadyBuilt();
        }
        middleware.clear();
    }

    public synchronized List<Middleware> getMiddleware() {
        return new ArrayList<>(middleware);
    }
}
