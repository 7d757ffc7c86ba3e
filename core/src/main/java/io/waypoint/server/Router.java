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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.waypoint.WaypointLogger;
import io.waypoint.WaypointMessages;
import io.waypoint.util.Methods;
import io.waypoint.util.PathUtils;

/**
 * An ordered collection of routes.
 * <p>
 * Routes are tried in order of descending priority. Routes of equal priority are tried in the order they
 * were registered, so with default priorities the first route registered for a path wins.
 * <p>
 * A router may carry a prefix, which is prepended to every template registered with it. Another router's
 * routes can be copied in with {@link #include(Router, String)}.
 * <p>
 * Registration is expected to happen before requests are served. Lookups read an immutable snapshot and
 * are safe to run concurrently with each other.
 */
public class Router {

    private static final Comparator<Route> BY_PRIORITY = Comparator.comparingInt(Route::getPriority).reversed();

    private final String prefix;
    private final List<Route> routes = new ArrayList<>();
    private volatile List<Route> sortedRoutes = Collections.emptyList();

    public Router() {
        this(null);
    }

    public Router(final String prefix) {
        this.prefix = prefix == null || prefix.isEmpty() ? null : PathUtils.normalizeTemplate(prefix);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Registers a route.
     *
     * @param template the path template, relative to the prefix of this router
     * @param methods  the methods, {@code GET} if null
     * @param handler  the handler
     * @param name     the route name, may be null
     * @param priority the priority
     * @return the route
     */
    public synchronized Route register(final String template, final Collection<String> methods, final HandlerAdapter handler, final String name, final int priority) {
        if (template == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("template");
        }
        final String fullTemplate = prefix == null ? template : PathUtils.concat(prefix, template);
        final Route route = new Route(fullTemplate, handler, methods, priority, name);
        addRoute(route);
        return route;
    }

    public Route register(final String template, final Collection<String> methods, final HandlerAdapter handler) {
        return register(template, methods, handler, null, Route.DEFAULT_PRIORITY);
    }

    private void addRoute(final Route route) {
        routes.add(route);
        final List<Route> sorted = new ArrayList<>(routes);
        // List.sort is stable, registration order is kept among equal priorities
        sorted.sort(BY_PRIORITY);
        sortedRoutes = Collections.unmodifiableList(sorted);
        WaypointLogger.ROUTING_LOGGER.routeRegistered(route);
    }

    public Router add(final String method, final String template, final HttpHandler handler) {
        return add(method, template, HandlerAdapter.of(handler));
    }

    public Router add(final String method, final String template, final HandlerAdapter handler) {
        register(template, Collections.singleton(method), handler);
        return this;
    }

    public Router get(final String template, final HttpHandler handler) {
        return add(Methods.GET, template, handler);
    }

    public Router get(final String template, final HandlerAdapter handler) {
        return add(Methods.GET, template, handler);
    }

    public Router post(final String template, final HttpHandler handler) {
        return add(Methods.POST, template, handler);
    }

    public Router post(final String template, final HandlerAdapter handler) {
        return add(Methods.POST, template, handler);
    }

    public Router put(final String template, final HttpHandler handler) {
        return add(Methods.PUT, template, handler);
    }

    public Router put(final String template, final HandlerAdapter handler) {
        return add(Methods.PUT, template, handler);
    }

    public Router delete(final String template, final HttpHandler handler) {
        return add(Methods.DELETE, template, handler);
    }

    public Router delete(final String template, final HandlerAdapter handler) {
        return add(Methods.DELETE, template, handler);
    }

    public Router patch(final String template, final HttpHandler handler) {
        return add(Methods.PATCH, template, handler);
    }

    public Router patch(final String template, final HandlerAdapter handler) {
        return add(Methods.PATCH, template, handler);
    }

    public Router head(final String template, final HttpHandler handler) {
        return add(Methods.HEAD, template, handler);
    }

    public Router head(final String template, final HandlerAdapter handler) {
        return add(Methods.HEAD, template, handler);
    }

    public Router options(final String template, final HttpHandler handler) {
        return add(Methods.OPTIONS, template, handler);
    }

    public Router options(final String template, final HandlerAdapter handler) {
        return add(Methods.OPTIONS, template, handler);
    }

    /**
     * Copies the routes of another router into this one. Each copied template is this router's prefix,
     * followed by the given prefix, followed by the template of the route in the other router.
     * <p>
     * The routes are copied as they are now; routes registered with the other router later are not
     * seen by this one.
     *
     * @param router the router to copy from
     * @param prefix the prefix, may be null
     * @return this router
     */
    public Router include(final Router router, final String prefix) {
        if (router == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("router");
        }
        final List<Route> included = router.getRoutes();
        synchronized (this) {
            for (Route route : included) {
                addRoute(route.withTemplate(PathUtils.concat(this.prefix, prefix, route.getTemplate())));
            }
        }
        return this;
    }

    public Router include(final Router router) {
        return include(router, null);
    }

    /**
     * Finds the route for a request.
     *
     * @param path   the request path
     * @param method the request method
     * @return the first matching route with its parameters, or {@code null}
     */
    public RouteMatch find(final String path, final String method) {
        for (Route route : sortedRoutes) {
            final Map<String, Object> parameters = route.matches(path, method);
            if (parameters != null) {
                return new RouteMatch(route, parameters);
            }
        }
        return null;
    }

    /**
     * @param path the request path
     * @return the methods of every route whose template matches the path, empty if there is none
     */
    public Set<String> allowedMethods(final String path) {
        final Set<String> methods = new LinkedHashSet<>();
        for (Route route : sortedRoutes) {
            if (route.matchesPath(path) != null) {
                methods.addAll(route.getMethods());
            }
        }
        return methods;
    }

    /**
     * @return the routes in registration order
     */
    public synchronized List<Route> getRoutes() {
        return Collections.unmodifiableList(new ArrayList<>(routes));
    }

    /**
     * @return the routes in the order they are tried
     */
    public List<Route> getSortedRoutes() {
        return sortedRoutes;
    }

    public synchronized Route getRoute(final String name) {
        for (Route route : routes) {
            if (route.getName() != null && route.getName().equals(name)) {
                return route;
            }
        }
        return null;
    }

    /**
     * Generates the path of a named route.
     *
     * @param name   the route name
     * @param values a value for every parameter of the route
     * @return the path
     */
    public String urlFor(final String name, final Map<String, ?> values) {
        final Route route = getRoute(name);
        if (route == null) {
            throw WaypointMessages.MESSAGES.unknownRouteName(name);
        }
        return route.buildPath(values == null ? Collections.<String, Object>emptyMap() : values);
    }

    @Override
    public String toString() {
        return "Router{prefix=" + prefix + ", routes=" + sortedRoutes + "}";
    }
}
