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
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;

import io.waypoint.WaypointMessages;
import io.waypoint.util.AbstractAttachable;
import io.waypoint.util.Methods;
import io.waypoint.util.QueryParameterUtils;

/**
 * An HTTP request, as handed over by the protocol layer once the body has been read.
 * <p>
 * Besides the request data the request carries the path parameters of the route it was dispatched to
 * and any attachments added by middleware. A request belongs to a single call of the handler chain and
 * is not thread safe.
 */
public final class Request extends AbstractAttachable {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final String method;
    private final String path;
    private final String queryString;
    private final Map<String, String> headers;
    private final byte[] body;

    private Map<String, Deque<String>> queryParameters;
    private Map<String, Object> pathParameters = Collections.emptyMap();

    private Request(final Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.queryString = builder.queryString;
        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(headers);
        this.body = builder.body;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the request method in upper case
     */
    public String getMethod() {
        return method;
    }

    /**
     * @return the decoded request path, without the query string
     */
    public String getPath() {
        return path;
    }

    /**
     * @return the raw query string, or the empty string
     */
    public String getQueryString() {
        return queryString;
    }

    public Map<String, Deque<String>> getQueryParameters() {
        if (queryParameters == null) {
            queryParameters = Collections.unmodifiableMap(QueryParameterUtils.parseQueryString(queryString));
        }
        return queryParameters;
    }

    public String getQueryParameter(final String name) {
        final Deque<String> values = getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    /**
     * @return the request headers, looked up without regard to case
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(final String name) {
        return headers.get(name);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return the converted path parameters of the route this request was dispatched to, empty before dispatch
     */
    public Map<String, Object> getPathParameters() {
        return pathParameters;
    }

    public Object getPathParameter(final String name) {
        return pathParameters.get(name);
    }

    void setPathParameters(final Map<String, Object> pathParameters) {
        this.pathParameters = Collections.unmodifiableMap(pathParameters);
    }

    @Override
    public String toString() {
        return "Request{" + method + " " + path + (queryString.isEmpty() ? "" : "?" + queryString) + "}";
    }

    public static final class Builder {

        private String method = Methods.GET;
        private String path = "/";
        private String queryString = "";
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body = EMPTY_BODY;

        Builder() {

        }

        public Builder setMethod(final String method) {
            if (method == null) {
                throw WaypointMessages.MESSAGES.argumentCannotBeNull("method");
            }
            this.method = Methods.canonicalize(method);
            return this;
        }

        /**
         * Sets the path. Anything after a {@code ?} becomes the query string.
         */
        public Builder setPath(final String path) {
            if (path == null) {
                throw WaypointMessages.MESSAGES.argumentCannotBeNull("path");
            }
            final int query = path.indexOf('?');
            if (query == -1) {
                this.path = path;
            } else {
                this.path = path.substring(0, query);
                this.queryString = path.substring(query + 1);
            }
            return this;
        }

        public Builder setQueryString(final String queryString) {
            this.queryString = queryString == null ? "" : queryString;
            return this;
        }

        public Builder addHeader(final String name, final String value) {
            if (name == null) {
                throw WaypointMessages.MESSAGES.argumentCannotBeNull("name");
            }
            if (value == null) {
                throw WaypointMessages.MESSAGES.argumentCannotBeNull("value");
            }
            headers.merge(name, value, (existing, added) -> existing + "," + added);
            return this;
        }

        public Builder setBody(final byte[] body) {
            this.body = body == null ? EMPTY_BODY : body.clone();
            return this;
        }

        public Builder setBody(final String body) {
            return setBody(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
        }

        public Request build() {
            return new Request(this);
        }
    }
}
