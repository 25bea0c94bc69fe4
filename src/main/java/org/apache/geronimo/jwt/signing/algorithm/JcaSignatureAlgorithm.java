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

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;

/**
 * Asymmetric algorithms backed by {@link Signature}. Built without a private key,
 * an instance can only verify.
 */
abstract class JcaSignatureAlgorithm extends SigningAlgorithm {
    private final PublicKey publicKey;
    private final PrivateKey privateKey;
    private final String jcaProvider;

    JcaSignatureAlgorithm(final JwsAlgorithm id, final PublicKey publicKey, final PrivateKey privateKey,
                          final String jcaProvider) {
        super(id);
        if (publicKey == null) {
            throw new IllegalArgumentException(id + " requires a public key");
        }
        this.publicKey = publicKey;
        this.privateKey = privateKey;
        this.jcaProvider = jcaProvider;
    }

    protected abstract String getJcaAlgorithm();

    @Override
    public byte[] sign(final byte[] message) {
        if (privateKey == null) {
            throw new JwtException(JwtError.SIGNING_FAILED, getName() + " signer has no private key");
        }
        try {
            final Signature signature = newSignature();
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch (final GeneralSecurityException e) {
            throw new JwtException(JwtError.SIGNING_FAILED, "Can't sign with " + getName(), e);
        }
    }

    @Override
    public boolean verify(final byte[] message, final byte[] signature) {
        try {
            final Signature verifier = newSignature();
            verifier.initVerify(publicKey);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (final GeneralSecurityException e) { // wrong length/encoding is an invalid signature
            return false;
        }
    }

    private Signature newSignature() throws GeneralSecurityException {
        return jcaProvider == null ?
                Signature.getInstance(getJcaAlgorithm()) :
                Signature.getInstance(getJcaAlgorithm(), jcaProvider);
    }
}
