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

/**
 * A wrapper around the rest of the request handling pipeline.
 * <p>
 * A middleware receives the request together with {@code next}, the handler for everything inside it.
 * It may do work before calling {@code next}, after it returns, or both, and it may decide not to call
 * it at all, in which case its own response is returned and nothing inside it runs. Work that has to
 * happen after {@code next} no matter how it completes belongs in a {@code finally} block.
 *
 * @see MiddlewareChain
 */
@FunctionalInterface
public interface Middleware {

    Response handle(Request request, HttpHandler next) throws Exception;
}
