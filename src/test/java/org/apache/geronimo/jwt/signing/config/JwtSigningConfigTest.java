/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.geronimo.jwt.signing.config;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import javax.enterprise.inject.Vetoed;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public class JwtSigningConfigTest {
    @AfterMethod
    public void clearSystemProperties() {
        System.clearProperty("geronimo.jwt-signing.test.overridden");
    }

    @Test
    public void prefixesKeys() {
        final Map<String, String> values = new HashMap<>();
        values.put("geronimo.jwt-signing.signer.default", "a");
        values.put("mp.jwt.verify.issuer", "https://issuer.example.com");
        final JwtSigningConfig config = new PrefixedConfig(values::getOrDefault);

        assertEquals(config.read("signer.default", null), "a");
        assertEquals(config.read("mp.jwt.verify.issuer", null), "https://issuer.example.com");
        assertEquals(config.read("unsigned.accepted", "false"), "false");
    }

    @Test
    public void prefixedConfigIsNotABean() {
        assertTrue(PrefixedConfig.class.isAnnotationPresent(Vetoed.class));
    }

    @Test
    public void defaultConfigReadsResourcesAndSystemProperties() {
        System.setProperty("geronimo.jwt-signing.test.overridden", "system");
        final JwtSigningConfig config = new DefaultJwtSigningConfig();
        assertEquals(config.read("geronimo.jwt-signing.test.from-resource", null), "resource");
        assertEquals(config.read("geronimo.jwt-signing.test.overridden", null), "system");
        assertNull(config.read("geronimo.jwt-signing.test.missing", null));
    }

    @Test
    public void createFallsBackOnDefaultConfig() {
        // no MicroProfile Config implementation on the test classpath
        final JwtSigningConfig config = JwtSigningConfig.create();
        assertEquals(config.getClass(), PrefixedConfig.class);
        assertEquals(config.read("test.from-resource", null), "resource");
    }
}
