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

import java.io.PrintWriter;
import java.io.StringWriter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waypoint.WaypointLogger;
import io.waypoint.WaypointOptions;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Middleware;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.util.StatusCodes;
import org.xnio.OptionMap;

/**
 * Middleware that turns an exception thrown further down the chain into a JSON error response.
 * <p>
 * In production mode the body only says {@code Internal Server Error}. In debug mode it carries the
 * exception type, its message and the stack trace, so it must never be enabled for a public deployment.
 */
public class ExceptionMiddleware implements Middleware {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final boolean debug;

    public ExceptionMiddleware(final boolean debug) {
        this.debug = debug;
    }

    public ExceptionMiddleware(final OptionMap options) {
        this(options.get(WaypointOptions.DEBUG_ERROR_RESPONSES, false));
    }

    @Override
    public Response handle(final Request request, final HttpHandler next) throws Exception {
        try {
            return next.handleRequest(request);
        } catch (Exception e) {
            WaypointLogger.REQUEST_LOGGER.exceptionProcessingRequest(e);
            return Response.of(StatusCodes.INTERNAL_SERVER_ERROR, Response.APPLICATION_JSON, errorBody(e));
        }
    }

    private String errorBody(final Exception e) throws JsonProcessingException {
        final ObjectNode body = OBJECT_MAPPER.createObjectNode();
        final ObjectNode error = body.putObject("error");
        if (debug) {
            error.put("type", e.getClass().getSimpleName());
            error.put("message", e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            final StringWriter trace = new StringWriter();
            e.printStackTrace(new PrintWriter(trace));
            error.put("traceback", trace.toString());
        } else {
            error.put("message", StatusCodes.INTERNAL_SERVER_ERROR_STRING);
        }
        return OBJECT_MAPPER.writeValueAsString(body);
    }

    public boolean isDebug() {
        return debug;
    }

    @Override
    public String toString() {
        return "exception-middleware( " + (debug ? "debug" : "production") + " )";
    }
}
