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

package io.waypoint;

import java.util.Collection;

import io.waypoint.util.ParameterKind;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exception messages. Path template errors start at 10, route errors at 20, middleware
 * chain errors at 30 and request time errors at 40.
 */
@MessageBundle(projectCode = "WP")
public interface WaypointMessages {

    WaypointMessages MESSAGES = Messages.getBundle(WaypointMessages.class);

    @Message(id = 1, value = "Handler cannot be null")
    IllegalArgumentException handlerCannotBeNull();

    @Message(id = 2, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(final String argument);

    @Message(id = 10, value = "Wildcard patterns (* and **) are no longer supported in '%s'. Use multipath parameters instead: {name:multipath}")
    ConfigurationException wildcardNotSupported(String template);

    @Message(id = 11, value = "Unclosed parameter at position %d in path template '%s'")
    ConfigurationException unclosedParameter(int position, String template);

    @Message(id = 12, value = "Unsupported parameter type: %s in path template '%s'. Supported types are str, int, float, uuid and multipath")
    ConfigurationException unsupportedParameterKind(String kind, String template);

    @Message(id = 13, value = "Empty parameter name at position %d in path template '%s'")
    ConfigurationException emptyParameterName(int position, String template);

    @Message(id = 14, value = "Parameter '%s' is declared more than once in path template '%s'")
    ConfigurationException duplicateParameterName(String name, String template);

    @Message(id = 15, value = "Path template '%s' must start with '/'")
    ConfigurationException pathMustStartWithSlash(String template);

    @Message(id = 20, value = "Invalid HTTP methods: %s")
    ConfigurationException invalidHttpMethods(Collection<String> methods);

    @Message(id = 21, value = "Route pattern '%s' defines path parameters %s but handler does not have corresponding parameters. Handler parameters: %s")
    ConfigurationException pathParametersMissingInHandler(String template, Collection<String> missing, Collection<String> handlerParameters);

    @Message(id = 22, value = "Handler expects path parameters %s but route pattern '%s' only defines %s")
    ConfigurationException handlerParametersMissingInPath(Collection<String> missing, String template, Collection<String> pathParameters);

    @Message(id = 23, value = "Parameter '%s' type mismatch: route expects %s but handler declares %s")
    ConfigurationException parameterTypeMismatch(String name, ParameterKind kind, String declaredType);

    @Message(id = 24, value = "Parameter name '%s' is reserved for the request")
    ConfigurationException reservedParameterName(String name);

    @Message(id = 25, value = "Handler parameter '%s' is declared more than once")
    ConfigurationException duplicateHandlerParameter(String name);

    @Message(id = 30, value = "Middleware chain has already been built and can no longer be modified. Add all middleware before the application starts")
    ConfigurationException middlewareChainAlreadyBuilt();

    @Message(id = 31, value = "Middleware chain has already been built around a different terminal handler")
    ConfigurationException middlewareChainBuiltForOtherHandler();

    @Message(id = 40, value = "Server not started")
    IllegalStateException serverNotStarted();

    @Message(id = 41, value = "Handler for route '%s' did not declare the request parameter")
    IllegalStateException requestNotDeclared(String template);

    @Message(id = 42, value = "Handler parameter '%s' was not declared")
    IllegalArgumentException parameterNotDeclared(String name);

    @Message(id = 43, value = "No route named '%s'")
    IllegalArgumentException unknownRouteName(String name);

    @Message(id = 44, value = "No value for path parameter '%s' of route '%s'")
    IllegalArgumentException missingPathParameterValue(String name, String template);
}
