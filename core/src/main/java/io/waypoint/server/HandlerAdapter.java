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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.waypoint.WaypointMessages;

/**
 * Describes how a route invokes its handler: whether the handler takes the request, and which path
 * parameters it binds.
 * <p>
 * The bound names must be exactly the parameter names of the route template. This is checked when the
 * {@link Route} is created, so a handler never runs with a parameter it did not ask for or without one
 * it did.
 *
 * <pre>
 * HandlerAdapter adapter = HandlerAdapter.builder()
 *         .request()
 *         .param("id", Long.class)
 *         .build(args -&gt; Response.text("user " + args.getLong("id")));
 * </pre>
 */
public final class HandlerAdapter {

    /**
     * The name that refers to the request itself and so cannot be used for a path parameter binding.
     */
    public static final String REQUEST = "request";

    private final Invoker invoker;
    private final boolean requestDeclared;
    private final List<ParameterBinding> bindings;

    private HandlerAdapter(final Invoker invoker, final boolean requestDeclared, final List<ParameterBinding> bindings) {
        this.invoker = invoker;
        this.requestDeclared = requestDeclared;
        this.bindings = Collections.unmodifiableList(bindings);
    }

    /**
     * Adapts a plain handler, which takes the request and no path parameters.
     */
    public static HandlerAdapter of(final HttpHandler handler) {
        if (handler == null) {
            throw WaypointMessages.MESSAGES.handlerCannotBeNull();
        }
        return new HandlerAdapter(args -> handler.handleRequest(args.getRequest()), true, Collections.<ParameterBinding>emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Response invoke(final HandlerArguments arguments) throws Exception {
        return invoker.invoke(arguments);
    }

    public boolean isRequestDeclared() {
        return requestDeclared;
    }

    public List<ParameterBinding> getBindings() {
        return bindings;
    }

    public Set<String> getParameterNames() {
        final Set<String> names = new LinkedHashSet<>();
        for (ParameterBinding binding : bindings) {
            names.add(binding.getName());
        }
        return names;
    }

    public ParameterBinding getBinding(final String name) {
        for (ParameterBinding binding : bindings) {
            if (binding.getName().equals(name)) {
                return binding;
            }
        }
        return null;
    }

    @FunctionalInterface
    public interface Invoker {

        Response invoke(HandlerArguments arguments) throws Exception;
    }

    public static final class Builder {

        private final List<ParameterBinding> bindings = new ArrayList<>();
        private boolean requestDeclared;

        Builder() {

        }

        public Builder request() {
            requestDeclared = true;
            return this;
        }

        public Builder param(final String name) {
            return param(name, null);
        }

        public Builder param(final String name, final Class<?> type) {
            final ParameterBinding binding = ParameterBinding.of(name, type);
            if (REQUEST.equals(name)) {
                throw WaypointMessages.MESSAGES.reservedParameterName(name);
            }
            for (ParameterBinding existing : bindings) {
                if (existing.getName().equals(name)) {
                    throw WaypointMessages.MESSAGES.duplicateHandlerParameter(name);
                }
            }
            bindings.add(binding);
            return this;
        }

        public HandlerAdapter build(final Invoker invoker) {
            if (invoker == null) {
                throw WaypointMessages.MESSAGES.handlerCannotBeNull();
            }
            return new HandlerAdapter(invoker, requestDeclared, new ArrayList<>(bindings));
        }
    }
}
