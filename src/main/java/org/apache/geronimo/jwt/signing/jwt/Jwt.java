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
package org.apache.geronimo.jwt.signing.jwt;

/**
 * A token whose signature and claims were verified by {@link JwtParser}.
 */
public final class Jwt<P extends JwtPayload> {
    private final String raw;
    private final JwtHeader header;
    private final P payload;

    Jwt(final String raw, final JwtHeader header, final P payload) {
        this.raw = raw;
        this.header = header;
        this.payload = payload;
    }

    public String getRawToken() {
        return raw;
    }

    public JwtHeader getHeader() {
        return header;
    }

    public P getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "Jwt[" + header + "]";
    }
}
