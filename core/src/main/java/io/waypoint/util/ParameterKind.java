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

import java.util.Locale;

/**
 * The type of a path parameter. The kind decides both the sub pattern the parameter matches and the
 * value it is converted to once matched.
 */
public enum ParameterKind {

    /**
     * One or more characters other than {@code /}, kept as a {@link String}.
     */
    STRING("str", "[^/]+", String.class),
    /**
     * One or more digits, converted to a {@link Long}.
     */
    INTEGER("int", "\\d+", Long.class),
    /**
     * Digits with an optional fractional part, converted to a {@link Double}.
     */
    FLOAT("float", "\\d+(?:\\.\\d+)?", Double.class),
    /**
     * The canonical 8-4-4-4-12 lower case hex form, converted to a {@link java.util.UUID}.
     */
    UUID("uuid", "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", java.util.UUID.class),
    /**
     * The remainder of the path, slashes included. May be empty.
     */
    MULTIPATH("multipath", ".*", String.class);

    private final String templateName;
    private final String regex;
    private final Class<?> valueType;

    ParameterKind(final String templateName, final String regex, final Class<?> valueType) {
        this.templateName = templateName;
        this.regex = regex;
        this.valueType = valueType;
    }

    /**
     * @return the name used for this kind inside a path template, as in {@code {id:int}}
     */
    public String getTemplateName() {
        return templateName;
    }

    public String getRegex() {
        return regex;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * Converts a captured value.
     *
     * @param raw the text captured by {@link #getRegex()}
     * @return the converted value
     * @throws IllegalArgumentException if the text cannot be represented, for example an integer that overflows a long
     */
    public Object convert(final String raw) {
        switch (this) {
            case INTEGER:
                return Long.valueOf(raw);
            case FLOAT:
                return Double.valueOf(raw);
            case UUID:
                return java.util.UUID.fromString(raw);
            default:
                return raw;
        }
    }

    /**
     * Checks a type declared by a handler for a parameter of this kind.
     *
     * @param declaredType the declared type
     * @return true if a converted value can be assigned to the declared type
     */
    public boolean accepts(final Class<?> declaredType) {
        if (declaredType == Object.class) {
            return true;
        }
        switch (this) {
            case INTEGER:
                return declaredType == Long.class || declaredType == long.class || declaredType == Number.class;
            case FLOAT:
                return declaredType == Double.class || declaredType == double.class || declaredType == Number.class;
            case UUID:
                return declaredType == java.util.UUID.class;
            default:
                return declaredType == String.class || declaredType == CharSequence.class;
        }
    }

    /**
     * @param templateName the name used in a path template
     * @return the kind, or {@code null} if the name is not supported
     */
    public static ParameterKind forTemplateName(final String templateName) {
        for (ParameterKind kind : values()) {
            if (kind.templateName.equals(templateName)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
