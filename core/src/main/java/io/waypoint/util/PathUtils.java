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

/**
 * Utility methods for request paths and path templates.
 */
public final class PathUtils {

    private PathUtils() {

    }

    /**
     * Removes every trailing slash. The root path, and a path made only of slashes, becomes {@code /}.
     *
     * @param path the path
     * @return the normalized path
     */
    public static String stripTrailingSlashes(final String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            --end;
        }
        if (end == 0) {
            return "/";
        }
        return end == path.length() ? path : path.substring(0, end);
    }

    /**
     * Normalizes a path template: runs of slashes are collapsed into one and trailing slashes are removed,
     * except for the root template {@code /}. An empty template is the root template.
     *
     * @param template the template
     * @return the normalized template
     */
    public static String normalizeTemplate(final String template) {
        final StringBuilder sb = new StringBuilder(template.length());
        for (int i = 0; i < template.length(); ++i) {
            char c = template.charAt(i);
            if (c == '/' && sb.length() > 0 && sb.charAt(sb.length() - 1) == '/') {
                continue;
            }
            sb.append(c);
        }
        return stripTrailingSlashes(sb.toString());
    }

    /**
     * Joins prefixes and a template into one normalized template.
     *
     * @param parts the prefixes followed by the template, null and empty parts are skipped
     * @return the normalized template
     */
    public static String concat(final String... parts) {
        final StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isEmpty()) {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '/' && part.charAt(0) != '/') {
                    sb.append('/');
                }
                sb.append(part);
            }
        }
        return normalizeTemplate(sb.toString());
    }

    /**
     * Counts the segments of a path. The root path counts as one segment. A trailing slash opens a new,
     * empty, segment, so {@code /files/} has two segments where {@code /files} has one.
     *
     * @param path the path
     * @return the number of segments
     */
    public static int countSegments(final String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            ++start;
        }
        if (start == path.length()) {
            return 1;
        }
        int count = 1;
        for (int i = start; i < path.length(); ++i) {
            if (path.charAt(i) == '/') {
                ++count;
            }
        }
        return count;
    }
}
