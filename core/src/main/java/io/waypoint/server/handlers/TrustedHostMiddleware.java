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

package io.waypoint.server.handlers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import io.waypoint.WaypointLogger;
import io.waypoint.WaypointOptions;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Middleware;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.util.StatusCodes;
import org.xnio.OptionMap;
import org.xnio.Sequence;

/**
 * Middleware that rejects requests whose {@code Host} header names a host the application does not serve.
 * <p>
 * Allowed hosts are matched without regard to case and after removing any port. {@code *} allows every
 * host and {@code *.example.com} allows every sub domain of example.com, but not example.com itself.
 * A rejected request is answered with 400 and never reaches the rest of the chain.
 */
public class TrustedHostMiddleware implements Middleware {

    public static final String HOST = "Host";
    private static final String WILDCARD = "*";
    private static final String WILDCARD_PREFIX = "*.";

    private final List<String> allowedHosts;
    private final boolean allowAll;

    public TrustedHostMiddleware(final List<String> allowedHosts) {
        final List<String> hosts = new ArrayList<>();
        boolean all = false;
        for (String host : allowedHosts) {
            final String lower = host.toLowerCase(Locale.ENGLISH);
            if (WILDCARD.equals(lower)) {
                all = true;
            }
            hosts.add(lower);
        }
        this.allowedHosts = Collections.unmodifiableList(hosts);
        this.allowAll = all;
    }

    /**
     * Reads the allowed hosts from {@link WaypointOptions#ALLOWED_HOSTS}. Every host is allowed if the option is not set.
     */
    public TrustedHostMiddleware(final OptionMap options) {
        this(options.get(WaypointOptions.ALLOWED_HOSTS, Sequence.of(WILDCARD)));
    }

    @Override
    public Response handle(final Request request, final HttpHandler next) throws Exception {
        if (allowAll) {
            return next.handleRequest(request);
        }
        final String host = request.getHeader(HOST);
        if (host == null || !isAllowed(stripPort(host))) {
            WaypointLogger.REQUEST_LOGGER.untrustedHost(host);
            return Response.text(StatusCodes.BAD_REQUEST, "Invalid host header");
        }
        return next.handleRequest(request);
    }

    boolean isAllowed(final String host) {
        final String lower = host.toLowerCase(Locale.ENGLISH);
        for (String allowed : allowedHosts) {
            if (allowed.startsWith(WILDCARD_PREFIX)) {
                if (lower.endsWith(allowed.substring(1))) {
                    return true;
                }
            } else if (allowed.equals(lower)) {
                return true;
            }
        }
        return false;
    }

    private static String stripPort(final String host) {
        if (host.startsWith("[")) {
            final int end = host.indexOf(']');
            return end == -1 ? host : host.substring(0, end + 1);
        }
        final int colon = host.indexOf(':');
        return colon == -1 ? host : host.substring(0, colon);
    }

    public List<String> getAllowedHosts() {
        return allowedHosts;
    }

    @Override
    public String toString() {
        return "trusted-host( " + allowedHosts + " )";
    }
}
