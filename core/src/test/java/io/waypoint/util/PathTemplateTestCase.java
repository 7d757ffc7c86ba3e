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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import io.waypoint.ConfigurationException;
import io.waypoint.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Tests compiling and matching path templates
 */
@Category(UnitTest.class)
public class PathTemplateTestCase {

    @Test
    public void testLiteralTemplate() {
        PathTemplate template = PathTemplate.compile("/files/report.pdf");
        Assert.assertEquals(Collections.emptyMap(), template.match("/files/report.pdf"));
        //the dot is matched literally
        Assert.assertNull(template.match("/files/reportXpdf"));
        Assert.assertNull(template.match("/files/report.pdf/more"));
        Assert.assertFalse(template.hasTailParameter());
    }

    @Test
    public void testRootTemplate() {
        Assert.assertEquals("/", PathTemplate.compile("").getTemplateString());
        PathTemplate template = PathTemplate.compile("/");
        Assert.assertEquals(1, template.getSegmentCount());
        Assert.assertNotNull(template.match("/"));
        Assert.assertNull(template.match("/users"));
    }

    @Test
    public void testTemplateIsNormalized() {
        PathTemplate template = PathTemplate.compile("//api//users/");
        Assert.assertEquals("/api/users", template.getTemplateString());
        Assert.assertEquals(2, template.getSegmentCount());
    }

    @Test
    public void testStringParameter() {
        PathTemplate template = PathTemplate.compile("/hello/{name}");
        Assert.assertEquals(Collections.singletonList(new ParameterSpec("name", ParameterKind.STRING)), template.getParameters());
        Assert.assertEquals("world", template.match("/hello/world").get("name"));
        Assert.assertNull(template.match("/hello/a/b"));
        Assert.assertNull(template.match("/hello/"));
    }

    @Test
    public void testIntParameter() {
        PathTemplate template = PathTemplate.compile("/users/{id:int}");
        Map<String, Object> values = template.match("/users/123");
        Assert.assertEquals(Long.valueOf(123), values.get("id"));
        Assert.assertNull(template.match("/users/abc"));
        Assert.assertNull(template.match("/users/-1"));
        Assert.assertEquals(Long.valueOf(3000000000L), template.match("/users/3000000000").get("id"));
        //too large for a Long, so no match rather than an exception
        Assert.assertNull(template.match("/users/99999999999999999999"));
    }

    @Test
    public void testFloatParameter() {
        PathTemplate template = PathTemplate.compile("/price/{amount:float}");
        Assert.assertEquals(3.5d, (Double) template.match("/price/3.5").get("amount"), 0.0d);
        Assert.assertEquals(3.0d, (Double) template.match("/price/3").get("amount"), 0.0d);
        Assert.assertNull(template.match("/price/3."));
        Assert.assertNull(template.match("/price/abc"));
    }

    @Test
    public void testUuidParameter() {
        PathTemplate template = PathTemplate.compile("/items/{id:uuid}");
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        Assert.assertEquals(id, template.match("/items/123e4567-e89b-12d3-a456-426614174000").get("id"));
        Assert.assertNull(template.match("/items/123E4567-E89B-12D3-A456-426614174000"));
        Assert.assertNull(template.match("/items/not-a-uuid"));
    }

    @Test
    public void testMultipathParameter() {
        PathTemplate template = PathTemplate.compile("/files/{path:multipath}");
        Assert.assertTrue(template.hasTailParameter());
        Assert.assertEquals(2, template.getSegmentCount());
        Assert.assertEquals("a/b/c.txt", template.match("/files/a/b/c.txt").get("path"));
        Assert.assertEquals("", template.match("/files/").get("path"));
        Assert.assertNull(template.match("/files"));
    }

    @Test
    public void testParametersKeepOrder() {
        PathTemplate template = PathTemplate.compile("/{context}/{version}/{entity}/{id:int}");
        Map<String, Object> values = template.match("/api/v3/users/1");
        Assert.assertEquals(Arrays.asList("context", "version", "entity", "id"), Arrays.asList(values.keySet().toArray()));
        Assert.assertEquals(Arrays.asList("/", "/", "/", "/", ""), template.getLiterals());
    }

    @Test
    public void testMixedLiteralAndParameterInSegment() {
        PathTemplate template = PathTemplate.compile("/reports/report-{year:int}.csv");
        Assert.assertEquals(Long.valueOf(2024), template.match("/reports/report-2024.csv").get("year"));
        Assert.assertNull(template.match("/reports/report-x.csv"));
    }

    @Test
    public void testWildcardRejected() {
        assertConfigurationError("/static/*", "multipath");
        assertConfigurationError("/static/**", "/static/**");
    }

    @Test
    public void testUnclosedParameter() {
        assertConfigurationError("/users/{id", "position 7");
    }

    @Test
    public void testUnsupportedKind() {
        assertConfigurationError("/users/{id:long}", "long");
    }

    @Test
    public void testEmptyName() {
        assertConfigurationError("/users/{}", "Empty parameter name");
        assertConfigurationError("/users/{:int}", "Empty parameter name");
    }

    @Test
    public void testDuplicateName() {
        assertConfigurationError("/{id}/posts/{id}", "'id'");
    }

    @Test
    public void testMissingLeadingSlash() {
        assertConfigurationError("users/{id}", "must start with '/'");
    }

    @Test
    public void testRender() {
        PathTemplate template = PathTemplate.compile("/users/{id:int}/posts/{slug}");
        Map<String, Object> values = new HashMap<>();
        values.put("id", 5);
        values.put("slug", "hello");
        Assert.assertEquals("/users/5/posts/hello", template.render(values));

        values.remove("slug");
        try {
            template.render(values);
            Assert.fail("expected a missing value to be rejected");
        } catch (IllegalArgumentException expected) {
            Assert.assertTrue(expected.getMessage(), expected.getMessage().contains("slug"));
        }
    }

    private static void assertConfigurationError(String template, String expectedText) {
        try {
            PathTemplate.compile(template);
            Assert.fail("expected " + template + " to be rejected");
        } catch (ConfigurationException expected) {
            Assert.assertTrue(expected.getMessage(), expected.getMessage().contains(expectedText));
        }
    }
}
