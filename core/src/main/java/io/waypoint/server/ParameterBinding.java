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

import io.waypoint.WaypointMessages;

/**
 * A named parameter a handler expects, optionally with the type it expects the value to have.
 * <p>
 * A binding without a type accepts whatever the path parameter converts to.
 */
public final class ParameterBinding {

    private final String name;
    private final Class<?> type;

    private ParameterBinding(final String name, final Class<?> type) {
        this.name = name;
        this.type = type;
    }

    public static ParameterBinding of(final String name) {
        return of(name, null);
    }

    public static ParameterBinding of(final String name, final Class<?> type) {
        if (name == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("name");
        }
        return new ParameterBinding(name, type);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the declared type, or {@code null} if none was declared
     */
    public Class<?> getType() {
        return type;
    }

    @Override
    public String toString() {
        return type == null ? name : name + ":" + type.getSimpleName();
    }
}
