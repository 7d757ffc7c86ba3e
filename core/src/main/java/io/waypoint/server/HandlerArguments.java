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
import java.util.UUID;

import io.waypoint.WaypointMessages;

/**
 * The arguments a {@link HandlerAdapter} is invoked with: the request, if the handler declared it, and
 * the converted value of every declared path parameter.
 */
public final class HandlerArguments {

    private final String template;
    private final Request request;
    private final Map<String, Object> parameters;

    HandlerArguments(final String template, final Request request, final Map<String, Object> parameters) {
        this.template = template;
        this.request = request;
        this.parameters = parameters;
    }

    public Request getRequest() {
        if (request == null) {
            throw WaypointMessages.MESSAGES.requestNotDeclared(template);
        }
        return request;
    }

    public Object get(final String name) {
        if (!parameters.containsKey(name)) {
            throw WaypointMessages.MESSAGES.parameterNotDeclared(name);
        }
        return parameters.get(name);
    }

    public <T> T get(final String name, final Class<T> type) {
        return type.cast(get(name));
    }

    public String getString(final String name) {
        return String.valueOf(get(name));
    }

    public Long getLong(final String name) {
        return get(name, Long.class);
    }

    public Double getDouble(final String name) {
        return get(name, Double.class);
    }

    public UUID getUuid(final String name) {
        return get(name, UUID.class);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }
}
