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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.waypoint.WaypointLogger;
import io.waypoint.WaypointMessages;

/**
 * A compiled path template.
 * <p>
 * A template is made of literal text and parameters. A parameter is written as {@code {name}}, which
 * matches a single segment, or as {@code {name:kind}} where kind is one of {@code str}, {@code int},
 * {@code float}, {@code uuid} or {@code multipath}. A {@code multipath} parameter matches the rest of the
 * path, slashes included, and may match nothing at all.
 * <p>
 * Compiling normalizes the template (see {@link PathUtils#normalizeTemplate(String)}), anchors a regular
 * expression over it, and counts its segments so a matcher can reject most paths without running the
 * expression.
 * <p>
 * Instances are immutable.
 */
public final class PathTemplate {

    private static final char PARAMETER_START = '{';
    private static final char PARAMETER_END = '}';
    private static final char KIND_SEPARATOR = ':';
    private static final char WILDCARD = '*';

    private final String templateString;
    /**
     * The literal text around the parameters, one more entry than there are parameters.
     */
    private final List<String> literals;
    private final List<ParameterSpec> parameters;
    private final Pattern pattern;
    private final int segmentCount;
    private final boolean tailParameter;

    private PathTemplate(final String templateString, final List<String> literals, final List<ParameterSpec> parameters, final Pattern pattern) {
        this.templateString = templateString;
        this.literals = Collections.unmodifiableList(literals);
        this.parameters = Collections.unmodifiableList(parameters);
        this.pattern = pattern;
        this.segmentCount = PathUtils.countSegments(templateString);
        boolean tail = false;
        for (ParameterSpec parameter : parameters) {
            if (parameter.getKind() == ParameterKind.MULTIPATH) {
                tail = true;
                break;
            }
        }
        this.tailParameter = tail;
    }

    /**
     * Compiles a path template.
     *
     * @param template the template
     * @return the compiled template
     * @throws io.waypoint.ConfigurationException if the template is invalid
     */
    public static PathTemplate compile(final String template) {
        if (template == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("template");
        }
        final String path = PathUtils.normalizeTemplate(template);
        if (path.charAt(0) != '/') {
            throw WaypointMessages.MESSAGES.pathMustStartWithSlash(template);
        }
        if (path.indexOf(WILDCARD) != -1) {
            throw WaypointMessages.MESSAGES.wildcardNotSupported(template);
        }

        final List<String> literals = new ArrayList<>();
        final List<ParameterSpec> parameters = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        final StringBuilder regex = new StringBuilder("^");
        final StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < path.length()) {
            final char c = path.charAt(i);
            if (c != PARAMETER_START) {
                literal.append(c);
                ++i;
                continue;
            }
            final int end = path.indexOf(PARAMETER_END, i);
            if (end == -1) {
                throw WaypointMessages.MESSAGES.unclosedParameter(i, path);
            }
            final ParameterSpec parameter = parseParameter(path, i, end);
            if (!names.add(parameter.getName())) {
                throw WaypointMessages.MESSAGES.duplicateParameterName(parameter.getName(), path);
            }
            appendLiteral(regex, literal);
            literals.add(literal.toString());
            literal.setLength(0);
            regex.append('(').append(parameter.getKind().getRegex()).append(')');
            parameters.add(parameter);
            i = end + 1;
        }
        appendLiteral(regex, literal);
        literals.add(literal.toString());
        regex.append('$');

        return new PathTemplate(path, literals, parameters, Pattern.compile(regex.toString()));
    }

    private static ParameterSpec parseParameter(final String path, final int start, final int end) {
        final String token = path.substring(start + 1, end);
        final int separator = token.indexOf(KIND_SEPARATOR);
        final String name;
        final ParameterKind kind;
        if (separator == -1) {
            name = token;
            kind = ParameterKind.STRING;
        } else {
            name = token.substring(0, separator);
            final String kindName = token.substring(separator + 1);
            kind = ParameterKind.forTemplateName(kindName);
            if (kind == null) {
                throw WaypointMessages.MESSAGES.unsupportedParameterKind(kindName, path);
            }
        }
        if (name.isEmpty()) {
            throw WaypointMessages.MESSAGES.emptyParameterName(start, path);
        }
        return new ParameterSpec(name, kind);
    }

    private static void appendLiteral(final StringBuilder regex, final CharSequence literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
    }

    /**
     * Runs the full expression against a path.
     *
     * @param path the path
     * @return a matcher, check {@link Matcher#matches()} before passing it to {@link #extract(Matcher)}
     */
    public Matcher matcher(final String path) {
        return pattern.matcher(path);
    }

    /**
     * Converts the groups captured by a successful match.
     *
     * @param matcher a matcher for which {@link Matcher#matches()} returned true
     * @return the converted values keyed by parameter name in template order, or {@code null} if a value
     * could not be converted
     */
    public Map<String, Object> extract(final Matcher matcher) {
        final Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < parameters.size(); ++i) {
            final ParameterSpec parameter = parameters.get(i);
            final String raw = matcher.group(i + 1);
            try {
                values.put(parameter.getName(), parameter.getKind().convert(raw));
            } catch (IllegalArgumentException e) {
                WaypointLogger.ROUTING_LOGGER.tracef("Could not convert %s to %s for parameter %s of %s", raw, parameter.getKind(), parameter.getName(), templateString);
                return null;
            }
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * Matches a path as given, without any normalization.
     *
     * @param path the path
     * @return the converted values, or {@code null} if the path does not match or a value could not be converted
     */
    public Map<String, Object> match(final String path) {
        final Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        return extract(matcher);
    }

    /**
     * Renders a concrete path by substituting a value for each parameter.
     *
     * @param values the values keyed by parameter name
     * @return the path
     */
    public String render(final Map<String, ?> values) {
        final StringBuilder sb = new StringBuilder(literals.get(0));
        for (int i = 0; i < parameters.size(); ++i) {
            final String name = parameters.get(i).getName();
            final Object value = values.get(name);
            if (value == null) {
                throw WaypointMessages.MESSAGES.missingPathParameterValue(name, templateString);
            }
            sb.append(value);
            sb.append(literals.get(i + 1));
        }
        return sb.toString();
    }

    public String getTemplateString() {
        return templateString;
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    public List<String> getLiterals() {
        return literals;
    }

    public Set<String> getParameterNames() {
        final Set<String> names = new LinkedHashSet<>();
        for (ParameterSpec parameter : parameters) {
            names.add(parameter.getName());
        }
        return names;
    }

    public ParameterSpec getParameter(final String name) {
        for (ParameterSpec parameter : parameters) {
            if (parameter.getName().equals(name)) {
                return parameter;
            }
        }
        return null;
    }

    /**
     * @return the number of segments of the normalized template, the root template counts as one
     */
    public int getSegmentCount() {
        return segmentCount;
    }

    /**
     * @return true if a {@code multipath} parameter can make this template match paths with more segments than it has
     */
    public boolean hasTailParameter() {
        return tailParameter;
    }

    @Override
    public String toString() {
        return templateString;
    }
}
