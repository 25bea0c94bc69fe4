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

import java.util.Iterator;
import java.util.ServiceLoader;

@FunctionalInterface
public interface JwtSigningConfig {
    String read(String value, String def);

    /**
     * Resolution order: a {@link ServiceLoader} registered implementation, MicroProfile Config
     * when an implementation is available, then system properties over
     * {@code META-INF/geronimo/jwt-signing.properties}.
     *
     * @return the configuration, keys are read under the {@code geronimo.jwt-signing.} prefix.
     */
    static JwtSigningConfig create() {
        final Iterator<JwtSigningConfig> iterator = ServiceLoader.load(JwtSigningConfig.class).iterator();
        if (iterator.hasNext()) {
            return new PrefixedConfig(iterator.next());
        }
        try {
            return new PrefixedConfig(new MicroprofileJwtSigningConfig());
        } catch (final NoClassDefFoundError | IllegalStateException e) { // no MicroProfile Config at runtime
            return new PrefixedConfig(new DefaultJwtSigningConfig());
        }
    }
}
