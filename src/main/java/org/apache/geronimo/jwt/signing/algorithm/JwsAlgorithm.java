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

import java.util.Locale;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;

/**
 * The closed set of supported {@code alg} values.
 * Only used to name algorithms and to build them from configuration,
 * never to pick how a received token is verified.
 */
public enum JwsAlgorithm {
    HS256(Family.HMAC, ShaWidth.SHA256),
    HS384(Family.HMAC, ShaWidth.SHA384),
    HS512(Family.HMAC, ShaWidth.SHA512),
    RS256(Family.RSA, ShaWidth.SHA256),
    RS384(Family.RSA, ShaWidth.SHA384),
    RS512(Family.RSA, ShaWidth.SHA512),
    ES256(Family.ECDSA, ShaWidth.SHA256),
    ES384(Family.ECDSA, ShaWidth.SHA384),
    ES512(Family.ECDSA, ShaWidth.SHA512),
    NONE(Family.NONE, null);

    public enum Family {
        HMAC, RSA, ECDSA, NONE
    }

    private final Family family;
    private final ShaWidth width;

    JwsAlgorithm(final Family family, final ShaWidth width) {
        this.family = family;
        this.width = width;
    }

    public String getName() {
        return this == NONE ? "none" : name();
    }

    public Family getFamily() {
        return family;
    }

    public ShaWidth getWidth() {
        return width;
    }

    public static JwsAlgorithm fromName(final String name) {
        if ("none".equals(name)) {
            return NONE;
        }
        try {
            final JwsAlgorithm algorithm = valueOf(name.toUpperCase(Locale.ROOT));
            if (algorithm != NONE && algorithm.name().equals(name)) {
                return algorithm;
            }
        } catch (final IllegalArgumentException iae) {
            throw new JwtException(JwtError.UNSUPPORTED_ALGORITHM, "Unsupported algorithm: " + name, iae);
        }
        throw new JwtException(JwtError.UNSUPPORTED_ALGORITHM, "Unsupported algorithm: " + name);
    }
}
