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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import io.waypoint.WaypointMessages;
import io.waypoint.util.Methods;
import io.waypoint.util.ParameterSpec;
import io.waypoint.util.PathTemplate;
import io.waypoint.util.PathUtils;

/**
 * A path template bound to a handler for a set of methods.
 * <p>
 * A route is validated when it is created: the methods must be known, the template must compile and the
 * handler must bind exactly the parameters of the template. Once created a route is immutable.
 */
public final class Route {

    public static final int DEFAULT_PRIORITY = 0;

    private final PathTemplate pathTemplate;
    private final HandlerAdapter adapter;
    private final Set<String> methods;
    private final int priority;
    private final String name;

    public Route(final String template, final HandlerAdapter adapter) {
        this(template, adapter, null, DEFAULT_PRIORITY, null);
    }

    /**
     * @param template the path template
     * @param adapter  the handler
     * @param methods  the methods, {@code GET} if null
     * @param priority routes with a higher priority are tried first
     * @param name     the route name used for URL generation, may be null
     */
    public Route(final String template, final HandlerAdapter adapter, final Collection<String> methods, final int priority, final String name) {
        if (adapter == null) {
            throw WaypointMessages.MESSAGES.handlerCannotBeNull();
        }
        this.methods = canonicalMethods(methods);
        this.pathTemplate = PathTemplate.compile(template);
        this.adapter = adapter;
        this.priority = priority;
        this.name = name;
        validateBindings();
    }

    private static Set<String> canonicalMethods(final Collection<String> methods) {
        if (methods == null) {
            return Collections.singleton(Methods.GET);
        }
        final Set<String> result = new LinkedHashSet<>();
        final List<String> invalid = new ArrayList<>();
        for (String method : methods) {
            final String canonical = Methods.canonicalize(method);
            if (canonical == null || !Methods.isKnown(canonical)) {
                invalid.add(method);
            } else {
                result.add(canonical);
            }
        }
        if (result.isEmpty() || !invalid.isEmpty()) {
            throw WaypointMessages.MESSAGES.invalidHttpMethods(invalid.isEmpty() ? methods : invalid);
        }
        return Collections.unmodifiableSet(result);
    }

    private void validateBindings() {
        final Set<String> pathParameters = pathTemplate.getParameterNames();
        final Set<String> handlerParameters = adapter.getParameterNames();

        final Set<String> missingInHandler = new LinkedHashSet<>(pathParameters);
        missingInHandler.removeAll(handlerParameters);
        if (!missingInHandler.isEmpty()) {
            throw WaypointMessages.MESSAGES.pathParametersMissingInHandler(pathTemplate.getTemplateString(), missingInHandler, handlerParameters);
        }
        final Set<String> missingInPath = new LinkedHashSet<>(handlerParameters);
        missingInPath.removeAll(pathParameters);
        if (!missingInPath.isEmpty()) {
            throw WaypointMessages.MESSAGES.handlerParametersMissingInPath(missingInPath, pathTemplate.getTemplateString(), pathParameters);
        }

        for (ParameterBinding binding : adapter.getBindings()) {
            if (binding.getType() == null) {
                continue;
            }
            final ParameterSpec parameter = pathTemplate.getParameter(binding.getName());
            if (!parameter.getKind().accepts(binding.getType())) {
                throw WaypointMessages.MESSAGES.parameterTypeMismatch(binding.getName(), parameter.getKind(), binding.getType().getName());
            }
        }
    }

    /**
     * Tests this route against a request.
     *
     * @param path   the request path
     * @param method the request method
     * @return the converted path parameters, or {@code null} if the route does not match
     */
    public Map<String, Object> matches(final String path, final String method) {
        if (method == null || !methods.contains(Methods.canonicalize(method))) {
            return null;
        }
        return matchesPath(path);
    }

    /**
     * Tests this route against a request path, ignoring the method.
     *
     * @param path the request path
     * @return the converted path parameters, or {@code null} if the path does not match
     */
    public Map<String, Object> matchesPath(final String path) {
        final String normalized = PathUtils.stripTrailingSlashes(path);
        final int segments = PathUtils.countSegments(path);
        final int routeSegments = pathTemplate.getSegmentCount();
        if (segments != routeSegments
                && PathUtils.countSegments(normalized) != routeSegments
                && !(segments > routeSegments && pathTemplate.hasTailParameter())) {
            return null;
        }

        // a multipath parameter may capture a trailing slash, so the raw path is tried first
        if (pathTemplate.hasTailParameter()) {
            final Matcher matcher = pathTemplate.matcher(path);
            if (matcher.matches()) {
                return pathTemplate.extract(matcher);
            }
        }
        final Matcher matcher = pathTemplate.matcher(normalized);
        if (!matcher.matches()) {
            return null;
        }
        return pathTemplate.extract(matcher);
    }

    /**
     * Invokes the handler. The path parameters are read from the request.
     */
    public Response handle(final Request request) throws Exception {
        final Map<String, Object> values = request.getPathParameters();
        final Map<String, Object> arguments = new LinkedHashMap<>();
        for (ParameterBinding binding : adapter.getBindings()) {
            arguments.put(binding.getName(), values.get(binding.getName()));
        }
        final Request declared = adapter.isRequestDeclared() ? request : null;
        return adapter.invoke(new HandlerArguments(pathTemplate.getTemplateString(), declared, Collections.unmodifiableMap(arguments)));
    }

    /**
     * Renders a path for this route.
     *
     * @param values a value for every path parameter
     * @return the path
     */
    public String buildPath(final Map<String, ?> values) {
        return pathTemplate.render(values);
    }

    /**
     * Creates a copy of this route under another template, used when one router includes another.
     */
    Route withTemplate(final String template) {
        return new Route(template, adapter, methods, priority, name);
    }

    public String getTemplate() {
        return pathTemplate.getTemplateString();
    }

    public PathTemplate getPathTemplate() {
        return pathTemplate;
    }

    public Set<String> getMethods() {
        return methods;
    }

    public int getPriority() {
        return priority;
    }

    public String getName() {
        return name;
    }

    public HandlerAdapter getAdapter() {
        return adapter;
    }

    @Override
    public String toString() {
        return "<Route " + String.join(",", methods) + " " + pathTemplate.getTemplateString() + " priority=" + priority + ">";
    }
}
