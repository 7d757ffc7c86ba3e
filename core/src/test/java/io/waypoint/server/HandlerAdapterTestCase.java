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

import java.util.Arrays;
import java.util.Collections;
import java.util.UUID;

import io.waypoint.ConfigurationException;
import io.waypoint.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class HandlerAdapterTestCase {

    @Test
    public void testPlainHandlerDeclaresRequestOnly() {
        HandlerAdapter adapter = HandlerAdapter.of(request -> Response.text("ok"));
        Assert.assertTrue(adapter.isRequestDeclared());
        Assert.assertTrue(adapter.getBindings().isEmpty());
    }

    @Test
    public void testBindings() {
        HandlerAdapter adapter = HandlerAdapter.builder()
                .param("id", UUID.class)
                .param("slug")
                .build(args -> Response.text("ok"));
        Assert.assertFalse(adapter.isRequestDeclared());
        Assert.assertEquals(Arrays.asList("id", "slug"), Arrays.asList(adapter.getParameterNames().toArray()));
        Assert.assertEquals(UUID.class, adapter.getBinding("id").getType());
        Assert.assertNull(adapter.getBinding("slug").getType());
        Assert.assertNull(adapter.getBinding("other"));
    }

    @Test(expected = ConfigurationException.class)
    public void testRequestIsReserved() {
        HandlerAdapter.builder().param("request");
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateBinding() {
        HandlerAdapter.builder().param("id").param("id", Integer.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullHandler() {
        HandlerAdapter.of(null);
    }

    @Test
    public void testArguments() throws Exception {
        UUID id = UUID.randomUUID();
        HandlerArguments arguments = new HandlerArguments("/items/{id:uuid}", null, Collections.<String, Object>singletonMap("id", id));
        Assert.assertEquals(id, arguments.getUuid("id"));
        Assert.assertEquals(id.toString(), arguments.getString("id"));
        try {
            arguments.get("name");
            Assert.fail("expected an undeclared parameter to be rejected");
        } catch (IllegalArgumentException expected) {
            //expected
        }
        try {
            arguments.getRequest();
            Assert.fail("expected the request to be unavailable");
        } catch (IllegalStateException expected) {
            Assert.assertTrue(expected.getMessage(), expected.getMessage().contains("/items/{id:uuid}"));
        }
    }
}
