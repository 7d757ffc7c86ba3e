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

import io.waypoint.WaypointMessages;

/**
 * A key for an attachment on a {@link Attachable}, typically a {@link io.waypoint.server.Request}.
 * <p>
 * Keys are compared by identity, so a key is usually held in a constant such as
 * {@link io.waypoint.server.RouteMatch#ATTACHMENT_KEY}.
 *
 * @param <T> the attachment type
 */
public final class AttachmentKey<T> {

    private final Class<T> valueClass;

    private AttachmentKey(final Class<T> valueClass) {
        this.valueClass = valueClass;
    }

    /**
     * Cast the value to the type of this attachment key.
     *
     * @param value the value
     * @return the cast value
     */
    public T cast(final Object value) {
        return valueClass.cast(value);
    }

    /**
     * Construct a new attachment key.
     *
     * @param valueClass the value class
     * @param <T>        the attachment type
     * @return the new instance
     */
    @SuppressWarnings("unchecked")
    public static <T> AttachmentKey<T> create(final Class<? super T> valueClass) {
        if (valueClass == null) {
            throw WaypointMessages.MESSAGES.argumentCannotBeNull("valueClass");
        }
        return new AttachmentKey<>((Class<T>) valueClass);
    }

    @Override
    public String toString() {
        return "AttachmentKey<" + valueClass.getSimpleName() + ">";
    }
}
