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

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.ERROR;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "WP")
public interface WaypointLogger extends BasicLogger {

    WaypointLogger ROOT_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName());
    WaypointLogger ROUTING_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName() + ".routing");
    WaypointLogger REQUEST_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName() + ".request");
    WaypointLogger REQUEST_DUMPER_LOGGER = Logger.getMessageLogger(WaypointLogger.class, WaypointLogger.class.getPackage().getName() + ".request.dump");

    @LogMessage(level = ERROR)
    @Message(id = 5001, value = "An exception occurred processing the request")
    void exceptionProcessingRequest(@Cause Throwable cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Registered route %s")
    void routeRegistered(Object route);

    @LogMessage(level = WARN)
    @Message(id = 5003, value = "Rejected request for untrusted host %s")
    void untrustedHost(String host);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Built middleware chain with %d middleware")
    void middlewareChainBuilt(int count);
}
