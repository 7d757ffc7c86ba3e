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

import io.waypoint.WaypointLogger;
import io.waypoint.server.HttpHandler;
import io.waypoint.server.Request;
import io.waypoint.server.Response;
import io.waypoint.util.StatusCodes;

/**
 * A handler which answers with a fixed response code and its reason phrase as a text body.
 */
public final class ResponseCodeHandler implements HttpHandler {

    private static final boolean debugEnabled;

    static {
        debugEnabled = WaypointLogger.REQUEST_LOGGER.isDebugEnabled();
    }

    /**
     * A handler which answers 403.
     */
    public static final ResponseCodeHandler HANDLE_403 = new ResponseCodeHandler(StatusCodes.FORBIDDEN);
    /**
     * A handler which answers 404.
     */
    public static final ResponseCodeHandler HANDLE_404 = new ResponseCodeHandler(StatusCodes.NOT_FOUND);
    /**
     * A handler which answers 405.
     */
    public static final ResponseCodeHandler HANDLE_405 = new ResponseCodeHandler(StatusCodes.METHOD_NOT_ALLOWED);

    private final int responseCode;

    /**
     * Construct a new instance.
     *
     * @param responseCode the response code to answer with
     */
    public ResponseCodeHandler(final int responseCode) {
        this.responseCode = responseCode;
    }

    @Override
    public Response handleRequest(final Request request) throws Exception {
        if (debugEnabled) {
            WaypointLogger.REQUEST_LOGGER.debugf("Response code set to [%s] for %s.", responseCode, request);
        }
        return Response.text(responseCode, StatusCodes.getReason(responseCode));
    }

    public int getResponseCode() {
        return responseCode;
    }

    @Override
    public String toString() {
        return "response-code( " + this.responseCode + " )";
    }
}
