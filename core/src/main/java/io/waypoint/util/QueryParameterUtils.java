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

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Methods for dealing with the query string
 */
public class QueryParameterUtils {

    private QueryParameterUtils() {

    }

    /**
     * Parses a query string into a map. Keys and values are decoded as UTF-8.
     *
     * @param queryString The query string, without the leading {@code ?}
     * @return The map of key value parameters, in the order they first appear
     */
    public static Map<String, Deque<String>> parseQueryString(final String queryString) {
        final Map<String, Deque<String>> parameters = new LinkedHashMap<>();
        if (queryString == null || queryString.isEmpty()) {
            return parameters;
        }
        int startPos = 0;
        int equalPos = -1;
        boolean needsDecode = false;
        for (int i = 0; i < queryString.length(); ++i) {
            char c = queryString.charAt(i);
            if (c == '=' && equalPos == -1) {
                equalPos = i;
            } else if (c == '&') {
                handleQueryParameter(queryString, parameters, startPos, equalPos, i, needsDecode);
                needsDecode = false;
                startPos = i + 1;
                equalPos = -1;
            } else if (c == '%' || c == '+') {
                needsDecode = true;
            }
        }
        if (startPos != queryString.length()) {
            handleQueryParameter(queryString, parameters, startPos, equalPos, queryString.length(), needsDecode);
        }
        return parameters;
    }

    private static void handleQueryParameter(String queryString, Map<String, Deque<String>> parameters, int startPos, int equalPos, int i, boolean needsDecode) {
        if (startPos == i) {
            //empty parameter, as in a&&b
            return;
        }
        String key;
        String value = "";
        if (equalPos == -1) {
            key = decodeParam(queryString, startPos, i, needsDecode);
        } else {
            key = decodeParam(queryString, startPos, equalPos, needsDecode);
            value = decodeParam(queryString, equalPos + 1, i, needsDecode);
        }
        parameters.computeIfAbsent(key, k -> new ArrayDeque<>(1)).add(value);
    }

    private static String decodeParam(String queryString, int start, int end, boolean needsDecode) {
        final String raw = queryString.substring(start, end);
        if (!needsDecode) {
            return raw;
        }
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            //malformed escape, keep it as it was sent
            return raw;
        }
    }
}
