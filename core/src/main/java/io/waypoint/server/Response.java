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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import io.waypoint.util.StatusCodes;

/**
 * The response produced by a handler. Headers stay mutable so middleware can add to them on the way out.
 */
public final class Response {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String APPLICATION_JSON = "application/json";

    private final int statusCode;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final byte[] body;

    public Response(final int statusCode, final byte[] body) {
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body;
    }

    public static Response status(final int statusCode) {
        return new Response(statusCode, null);
    }

    public static Response text(final String text) {
        return text(StatusCodes.OK, text);
    }

    public static Response text(final int statusCode, final String text) {
        return of(statusCode, TEXT_PLAIN, text);
    }

    public static Response of(final int statusCode, final String contentType, final String body) {
        final Response response = new Response(statusCode, body.getBytes(StandardCharsets.UTF_8));
        response.setHeader(CONTENT_TYPE, contentType);
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(final String name) {
        return headers.get(name);
    }

    public Response setHeader(final String name, final String value) {
        headers.put(name, value);
        return this;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Response{" + statusCode + " " + StatusCodes.getReason(statusCode) + "}";
    }
}
