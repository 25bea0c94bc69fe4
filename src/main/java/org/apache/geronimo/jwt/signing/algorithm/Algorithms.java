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

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Entry point to build {@link SigningAlgorithm} instances.
 * Each factory only accepts the key shape of its family.
 */
public final class Algorithms {
    private Algorithms() {
        // no-op
    }

    public static SigningAlgorithm hs256(final byte[] secret) {
        return new HmacAlgorithm(JwsAlgorithm.HS256, secret, null);
    }

    public static SigningAlgorithm hs384(final byte[] secret) {
        return new HmacAlgorithm(JwsAlgorithm.HS384, secret, null);
    }

    public static SigningAlgorithm hs512(final byte[] secret) {
        return new HmacAlgorithm(JwsAlgorithm.HS512, secret, null);
    }

    public static SigningAlgorithm rs256(final KeyPair keyPair) {
        return rsa(JwsAlgorithm.RS256, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm rs256(final RSAPublicKey publicKey) {
        return new RsaAlgorithm(JwsAlgorithm.RS256, publicKey, null, null);
    }

    public static SigningAlgorithm rs384(final KeyPair keyPair) {
        return rsa(JwsAlgorithm.RS384, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm rs384(final RSAPublicKey publicKey) {
        return new RsaAlgorithm(JwsAlgorithm.RS384, publicKey, null, null);
    }

    public static SigningAlgorithm rs512(final KeyPair keyPair) {
        return rsa(JwsAlgorithm.RS512, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm rs512(final RSAPublicKey publicKey) {
        return new RsaAlgorithm(JwsAlgorithm.RS512, publicKey, null, null);
    }

    public static SigningAlgorithm es256(final KeyPair keyPair) {
        return ecdsa(JwsAlgorithm.ES256, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm es256(final ECPublicKey publicKey) {
        return new EcdsaAlgorithm(JwsAlgorithm.ES256, publicKey, null, null);
    }

    public static SigningAlgorithm es384(final KeyPair keyPair) {
        return ecdsa(JwsAlgorithm.ES384, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm es384(final ECPublicKey publicKey) {
        return new EcdsaAlgorithm(JwsAlgorithm.ES384, publicKey, null, null);
    }

    public static SigningAlgorithm es512(final KeyPair keyPair) {
        return ecdsa(JwsAlgorithm.ES512, keyPair.getPublic(), keyPair.getPrivate(), null);
    }

    public static SigningAlgorithm es512(final ECPublicKey publicKey) {
        return new EcdsaAlgorithm(JwsAlgorithm.ES512, publicKey, null, null);
    }

    public static SigningAlgorithm none() {
        return NoneAlgorithm.INSTANCE;
    }

    /**
     * Generic factory used when the algorithm comes from configuration.
     *
     * @param id the algorithm.
     * @param secret HMAC secret, ignored by other families.
     * @param publicKey verification key of asymmetric families.
     * @param privateKey signing key of asymmetric families, can be null for a verify-only algorithm.
     * @param jcaProvider JCA provider name, null for the default lookup.
     * @return the algorithm.
     */
    public static SigningAlgorithm create(final JwsAlgorithm id, final byte[] secret,
                                          final PublicKey publicKey, final PrivateKey privateKey,
                                          final String jcaProvider) {
        switch (id.getFamily()) {
            case HMAC:
                return new HmacAlgorithm(id, secret, jcaProvider);
            case RSA:
                return rsa(id, publicKey, privateKey, jcaProvider);
            case ECDSA:
                return ecdsa(id, publicKey, privateKey, jcaProvider);
            case NONE:
                return none();
            default:
                throw new IllegalArgumentException("Unsupported algorithm: " + id);
        }
    }

    private static SigningAlgorithm rsa(final JwsAlgorithm id, final PublicKey publicKey, final PrivateKey privateKey,
                                        final String jcaProvider) {
        if (!RSAPublicKey.class.isInstance(publicKey) || (privateKey != null && !RSAPrivateKey.class.isInstance(privateKey))) {
            throw new IllegalArgumentException(id + " requires RSA keys");
        }
        return new RsaAlgorithm(id, RSAPublicKey.class.cast(publicKey), RSAPrivateKey.class.cast(privateKey), jcaProvider);
    }

    private static SigningAlgorithm ecdsa(final JwsAlgorithm id, final PublicKey publicKey, final PrivateKey privateKey,
                                          final String jcaProvider) {
        if (!ECPublicKey.class.isInstance(publicKey) || (privateKey != null && !ECPrivateKey.class.isInstance(privateKey))) {
            throw new IllegalArgumentException(id + " requires EC keys");
        }
        return new EcdsaAlgorithm(id, ECPublicKey.class.cast(publicKey), ECPrivateKey.class.cast(privateKey), jcaProvider);
    }
}
