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

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Properties;

class DefaultJwtSigningConfig implements JwtSigningConfig {
    static final String RESOURCE = "META-INF/geronimo/jwt-signing.properties";

    private final Properties configuration = new Properties();

    DefaultJwtSigningConfig() {
        final ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            final Enumeration<URL> resources = loader == null ?
                    ClassLoader.getSystemResources(RESOURCE) : loader.getResources(RESOURCE);
            while (resources.hasMoreElements()) {
                try (final InputStream stream = resources.nextElement().openStream()) {
                    configuration.load(stream);
                }
            }
        } catch (final IOException e) {
            throw new IllegalStateException("Can't read " + RESOURCE, e);
        }
        configuration.putAll(System.getProperties());
    }

    @Override
    public String read(final String value, final String def) {
        return configuration.getProperty(value, def);
    }
}
