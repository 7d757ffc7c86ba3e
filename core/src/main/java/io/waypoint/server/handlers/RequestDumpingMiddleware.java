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

import java.util.Map;

import io.waypoint.WaypointLogger;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Middleware;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.server.RouteMatch;

/**
 * Middleware that dumps each request and its response to the request dump log.
 */
public class RequestDumpingMiddleware implements Middleware {

    @Override
    public Response handle(final Request request, final HttpHandler next) throws Exception {
        final StringBuilder sb = new StringBuilder();
        sb.append("\n----------------------------REQUEST---------------------------\n");
        sb.append("            method=" + request.getMethod() + "\n");
        sb.append("              path=" + request.getPath() + "\n");
        sb.append("       queryString=" + request.getQueryString() + "\n");
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            sb.append("            header=" + header.getKey() + "=" + header.getValue() + "\n");
        }
        sb.append("     contentLength=" + request.getBody().length + "\n");

        Response response = null;
        try {
            response = next.handleRequest(request);
            return response;
        } finally {
            final RouteMatch match = request.getAttachment(RouteMatch.ATTACHMENT_KEY);
            sb.append("--------------------------RESPONSE--------------------------\n");
            if (match != null) {
                sb.append("             route=" + match.getMatchedTemplate() + "\n");
                sb.append("    pathParameters=" + match.getParameters() + "\n");
            }
            if (response == null) {
                sb.append("            status=none, an exception was thrown\n");
            } else {
                sb.append("            status=" + response.getStatusCode() + "\n");
                for (Map.Entry<String, String> header : response.getHeaders().entrySet()) {
                    sb.append("            header=" + header.getKey() + "=" + header.getValue() + "\n");
                }
            }
            sb.append("==============================================================");
            WaypointLogger.REQUEST_DUMPER_LOGGER.info(sb.toString());
        }
    }

    @Override
    public String toString() {
        return "dump-request()";
    }
}
