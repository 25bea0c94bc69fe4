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
package org.apache.geronimo.jwt.signing.algorithm;

/**
 * A signature scheme bound to its key material.
 * The set of implementations is closed: constructors are package private and
 * instances are obtained from {@link Algorithms}.
 */
public abstract class SigningAlgorithm {
    private final JwsAlgorithm id;

    SigningAlgorithm(final JwsAlgorithm id) {
        this.id = id;
    }

    public JwsAlgorithm getId() {
        return id;
    }

    /**
     * @return the {@code alg} header value.
     */
    public String getName() {
        return id.getName();
    }

    public boolean isUnsigned() {
        return id == JwsAlgorithm.NONE;
    }

    /**
     * @param message the signing input.
     * @return the raw signature bytes.
     * @throws org.apache.geronimo.jwt.signing.JwtException with
     * {@link org.apache.geronimo.jwt.signing.JwtError#SIGNING_FAILED} when no signing key is available
     * or the provider fails.
     */
    public abstract byte[] sign(byte[] message);

    /**
     * Never throws for a bad signature, a malformed one is simply not valid.
     */
    public abstract boolean verify(byte[] message, byte[] signature);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + "]";
    }
}
