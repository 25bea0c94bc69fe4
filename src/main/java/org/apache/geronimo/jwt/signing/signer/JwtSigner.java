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
package org.apache.geronimo.jwt.signing.signer;

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;

import org.apache.geronimo.jwt.signing.algorithm.SigningAlgorithm;

/**
 * Pairs an algorithm with the name it is known under.
 * The algorithm used to verify is always the one of the signer,
 * the {@code alg} of a received header is never consulted here.
 */
public final class JwtSigner {
    private final String name;
    private final SigningAlgorithm algorithm;

    public JwtSigner(final SigningAlgorithm algorithm) {
        this(requireNonNull(algorithm, "algorithm can't be null").getName(), algorithm);
    }

    public JwtSigner(final String name, final SigningAlgorithm algorithm) {
        this.name = requireNonNull(name, "name can't be null");
        this.algorithm = requireNonNull(algorithm, "algorithm can't be null");
    }

    public String getName() {
        return name;
    }

    public SigningAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String getAlgorithmName() {
        return algorithm.getName();
    }

    /**
     * @param encodedHeader base64url header segment.
     * @param encodedPayload base64url payload segment.
     * @return the signature of {@code encodedHeader + "." + encodedPayload}.
     */
    public byte[] sign(final String encodedHeader, final String encodedPayload) {
        return algorithm.sign(signingInput(encodedHeader, encodedPayload));
    }

    /**
     * Verification works on the segments as received, a re-serialized header or payload
     * is not guaranteed to produce the same bytes.
     */
    public boolean verify(final byte[] signature, final String encodedHeader, final String encodedPayload) {
        return algorithm.verify(signingInput(encodedHeader, encodedPayload), signature);
    }

    private static byte[] signingInput(final String encodedHeader, final String encodedPayload) {
        return (encodedHeader + '.' + encodedPayload).getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public String toString() {
        return "JwtSigner[name=" + name + ", alg=" + algorithm.getName() + "]";
    }
}
