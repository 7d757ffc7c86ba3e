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

import java.util.Map;

import io.waypoint.util.AttachmentKey;

/**
 * The route a request was dispatched to, and the path parameters it matched with.
 */
public final class RouteMatch {

    public static final AttachmentKey<RouteMatch> ATTACHMENT_KEY = AttachmentKey.create(RouteMatch.class);

    private final Route route;
    private final Map<String, Object> parameters;

    public RouteMatch(final Route route, final Map<String, Object> parameters) {
        this.route = route;
        this.parameters = parameters;
    }

    public Route getRoute() {
        return route;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getMatchedTemplate() {
        return route.getTemplate();
    }

    @Override
    public String toString() {
        return "RouteMatch{" + route + ", " + parameters + "}";
    }
}
