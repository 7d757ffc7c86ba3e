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

import org.xnio.Option;
import org.xnio.Sequence;

/**
 * Options understood by a {@link Waypoint} application and the built in middleware.
 */
public class WaypointOptions {

    /**
     * If error responses produced by {@link io.waypoint.server.handlers.ExceptionMiddleware} should include the
     * exception type, message and stack trace. Defaults to false.
     */
    public static final Option<Boolean> DEBUG_ERROR_RESPONSES = Option.simple(WaypointOptions.class, "DEBUG_ERROR_RESPONSES", Boolean.class);

    /**
     * Host names accepted by {@link io.waypoint.server.handlers.TrustedHostMiddleware}. An entry of {@code *} accepts
     * every host, an entry of the form {@code *.example.com} accepts every sub domain of example.com.
     * <p>
     * If this is not specified every host is accepted.
     */
    public static final Option<Sequence<String>> ALLOWED_HOSTS = Option.sequence(WaypointOptions.class, "ALLOWED_HOSTS", String.class);

    /**
     * If every request and response should be written to the request dump log. Defaults to false.
     */
    public static final Option<Boolean> DUMP_REQUESTS = Option.simple(WaypointOptions.class, "DUMP_REQUESTS", Boolean.class);

    private WaypointOptions() {

    }
}
