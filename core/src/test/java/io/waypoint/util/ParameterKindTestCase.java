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

import java.util.UUID;

import io.waypoint.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class ParameterKindTestCase {

    @Test
    public void testForTemplateName() {
        Assert.assertEquals(ParameterKind.STRING, ParameterKind.forTemplateName("str"));
        Assert.assertEquals(ParameterKind.INTEGER, ParameterKind.forTemplateName("int"));
        Assert.assertEquals(ParameterKind.FLOAT, ParameterKind.forTemplateName("float"));
        Assert.assertEquals(ParameterKind.UUID, ParameterKind.forTemplateName("uuid"));
        Assert.assertEquals(ParameterKind.MULTIPATH, ParameterKind.forTemplateName("multipath"));
        Assert.assertNull(ParameterKind.forTemplateName("path"));
        Assert.assertNull(ParameterKind.forTemplateName("INT"));
    }

    @Test
    public void testAcceptedTypes() {
        Assert.assertTrue(ParameterKind.INTEGER.accepts(Long.class));
        Assert.assertTrue(ParameterKind.INTEGER.accepts(long.class));
        Assert.assertTrue(ParameterKind.INTEGER.accepts(Number.class));
        Assert.assertTrue(ParameterKind.INTEGER.accepts(Object.class));
        Assert.assertFalse(ParameterKind.INTEGER.accepts(String.class));
        Assert.assertFalse(ParameterKind.INTEGER.accepts(Integer.class));

        Assert.assertTrue(ParameterKind.FLOAT.accepts(double.class));
        Assert.assertFalse(ParameterKind.FLOAT.accepts(Integer.class));

        Assert.assertTrue(ParameterKind.UUID.accepts(UUID.class));
        Assert.assertFalse(ParameterKind.UUID.accepts(String.class));

        Assert.assertTrue(ParameterKind.STRING.accepts(String.class));
        Assert.assertTrue(ParameterKind.MULTIPATH.accepts(CharSequence.class));
        Assert.assertFalse(ParameterKind.MULTIPATH.accepts(Integer.class));
    }

    @Test
    public void testConvert() {
        Assert.assertEquals(Long.valueOf(42), ParameterKind.INTEGER.convert("42"));
        Assert.assertEquals(Long.valueOf(3000000000L), ParameterKind.INTEGER.convert("3000000000"));
        Assert.assertEquals(Double.valueOf(1.25), ParameterKind.FLOAT.convert("1.25"));
        Assert.assertEquals("a/b", ParameterKind.MULTIPATH.convert("a/b"));
        try {
            ParameterKind.INTEGER.convert("99999999999999999999");
            Assert.fail("expected overflow to be rejected");
        } catch (IllegalArgumentException expected) {
            //NumberFormatException
        }
    }
}
