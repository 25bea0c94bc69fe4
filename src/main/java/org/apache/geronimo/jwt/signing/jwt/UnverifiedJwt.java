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
 * Header and payload of a token read without checking the signature nor the claims.
 * Only meant for introspection, for instance to read the {@code kid} before a key is available;
 * nothing in it can be trusted.
 */
public final class UnverifiedJwt<P> {
    private final JwtHeader header;
    private final P payload;

    UnverifiedJwt(final JwtHeader header, final P payload) {
        this.header = header;
        this.payload = payload;
    }

    public JwtHeader getUnverifiedHeader() {
        return header;
    }

    public P getUnverifiedPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "UnverifiedJwt[" + header + "]";
    }
}
