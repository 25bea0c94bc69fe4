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

import static java.util.Objects.requireNonNull;

import org.apache.geronimo.jwt.signing.codec.Base64Url;
import org.apache.geronimo.jwt.signing.codec.JwtJsonCodec;
import org.apache.geronimo.jwt.signing.signer.JwtSigner;
import org.apache.geronimo.jwt.signing.signer.SignerRegistry;

/**
 * Serializes and signs payloads: {@code base64url(header).base64url(payload).base64url(signature)}.
 */
public class JwtEncoder {
    private final JwtJsonCodec codec;
    private final String type;

    public JwtEncoder(final JwtJsonCodec codec) {
        this(codec, "JWT");
    }

    /**
     * @param codec JSON codec.
     * @param type {@code typ} header value, null to omit it.
     */
    public JwtEncoder(final JwtJsonCodec codec, final String type) {
        this.codec = requireNonNull(codec, "codec can't be null");
        this.type = type;
    }

    public String sign(final JwtPayload payload, final JwtSigner signer) {
        return sign(payload, signer, null);
    }

    /**
     * @param kid written in the header when not null.
     */
    public String sign(final JwtPayload payload, final JwtSigner signer, final String kid) {
        requireNonNull(payload, "payload can't be null");
        final JwtHeader header = new JwtHeader(signer.getAlgorithmName(), kid, type, null);
        final String encodedHeader = Base64Url.encode(codec.writeObject(header.toJson(codec)));
        final String encodedPayload = Base64Url.encode(codec.writePayload(payload));
        return encodedHeader + '.' + encodedPayload + '.' + Base64Url.encode(signer.sign(encodedHeader, encodedPayload));
    }

    /**
     * Signs with the signer registered for {@code kid} and writes the kid in the header.
     * Without kid the default signer is used and the header has no kid.
     */
    public String sign(final JwtPayload payload, final SignerRegistry signers, final String kid) {
        return sign(payload, signers.requireSigner(kid), kid);
    }

    public String sign(final JwtPayload payload, final SignerRegistry signers) {
        return sign(payload, signers, null);
    }
}
