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

import java.util.HashMap;
import java.util.Map;

/**
 * The status codes produced by routing outcomes and the built in middleware.
 */
public class StatusCodes {

    private static final Map<Integer, String> REASONS = new HashMap<>();

    public static final int OK = 200;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int INTERNAL_SERVER_ERROR = 500;

    public static final String OK_STRING = "OK";
    public static final String NO_CONTENT_STRING = "No Content";
    public static final String BAD_REQUEST_STRING = "Bad Request";
    public static final String FORBIDDEN_STRING = "Forbidden";
    public static final String NOT_FOUND_STRING = "Not Found";
    public static final String METHOD_NOT_ALLOWED_STRING = "Method Not Allowed";
    public static final String INTERNAL_SERVER_ERROR_STRING = "Internal Server Error";

    static {
        putCode(OK, OK_STRING);
        putCode(NO_CONTENT, NO_CONTENT_STRING);
        putCode(BAD_REQUEST, BAD_REQUEST_STRING);
        putCode(FORBIDDEN, FORBIDDEN_STRING);
        putCode(NOT_FOUND, NOT_FOUND_STRING);
        putCode(METHOD_NOT_ALLOWED, METHOD_NOT_ALLOWED_STRING);
        putCode(INTERNAL_SERVER_ERROR, INTERNAL_SERVER_ERROR_STRING);
    }

    private static void putCode(final int code, final String reason) {
        REASONS.put(code, reason);
    }

    private StatusCodes() {
    }

    public static String getReason(final int code) {
        final String reason = REASONS.get(code);
        return reason == null ? "Unknown" : reason;
    }
}
