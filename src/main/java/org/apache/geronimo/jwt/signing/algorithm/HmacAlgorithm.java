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
import java.security.MessageDigest;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;

final class HmacAlgorithm extends SigningAlgorithm {
    private final SecretKey key;
    private final String jcaProvider;

    HmacAlgorithm(final JwsAlgorithm id, final byte[] secret, final String jcaProvider) {
        super(id);
        if (id.getFamily() != JwsAlgorithm.Family.HMAC) {
            throw new IllegalArgumentException(id + " is not an HMAC algorithm");
        }
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("HMAC secret can't be empty");
        }
        this.key = new SecretKeySpec(secret, id.getWidth().getMac());
        this.jcaProvider = jcaProvider;
    }

    @Override
    public byte[] sign(final byte[] message) {
        try {
            return mac(message);
        } catch (final GeneralSecurityException e) {
            throw new JwtException(JwtError.SIGNING_FAILED, "Can't sign with " + getName(), e);
        }
    }

    @Override
    public boolean verify(final byte[] message, final byte[] signature) {
        try {
            return MessageDigest.isEqual(mac(message), signature);
        } catch (final GeneralSecurityException e) {
            return false;
        }
    }

    private byte[] mac(final byte[] message) throws GeneralSecurityException {
        final Mac mac = jcaProvider == null ?
                Mac.getInstance(key.getAlgorithm()) :
                Mac.getInstance(key.getAlgorithm(), jcaProvider);
        mac.init(key);
        return mac.doFinal(message);
    }
}
