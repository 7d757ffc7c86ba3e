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

package io.waypoint.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The HTTP methods a route can be registered for.
 */
public final class Methods {

    private Methods() {
    }

    public static final String GET = "GET";
    public static final String POST = "POST";
    public static final String PUT = "PUT";
    public static final String DELETE = "DELETE";
    public static final String PATCH = "PATCH";
    public static final String HEAD = "HEAD";
    public static final String OPTIONS = "OPTIONS";

    /**
     * Every method a route may accept, in the order they are usually listed in an {@code Allow} header.
     */
    public static final Set<String> KNOWN_METHODS;

    static {
        final Set<String> methods = new LinkedHashSet<>();
        methods.add(GET);
        methods.add(HEAD);
        methods.add(POST);
        methods.add(PUT);
        methods.add(DELETE);
        methods.add(PATCH);
        methods.add(OPTIONS);
        KNOWN_METHODS = Collections.unmodifiableSet(methods);
    }

    public static boolean isKnown(final String method) {
        return method != null && KNOWN_METHODS.contains(method);
    }

    /**
     * @return the method in the canonical upper case form, or {@code null} for a null method
     */
    public static String canonicalize(final String method) {
        if (method == null) {
            return null;
        }
        return method.trim().toUpperCase(Locale.ENGLISH);
    }
}
