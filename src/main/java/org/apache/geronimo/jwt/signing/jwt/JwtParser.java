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

import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.codec.Base64Url;
import org.apache.geronimo.jwt.signing.codec.InvalidBase64UrlException;
import org.apache.geronimo.jwt.signing.codec.JwtJsonCodec;
import org.apache.geronimo.jwt.signing.signer.JwtSigner;
import org.apache.geronimo.jwt.signing.signer.SignerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and verifies tokens. Each stage must pass before the next one runs:
 * split, header, signer selection, signature, payload, claims.
 * A failure at any stage is a {@link JwtException} and no payload is returned.
 */
public class JwtParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(JwtParser.class);

    private final JwtJsonCodec codec;
    private final Clock clock;
    private final boolean unsignedAccepted;
    private final String expectedAudience;
    private final Set<String> acceptedIssuers;

    private JwtParser(final Builder builder) {
        this.codec = requireNonNull(builder.codec, "codec can't be null");
        this.clock = builder.clock;
        this.unsignedAccepted = builder.unsignedAccepted;
        this.expectedAudience = builder.expectedAudience;
        this.acceptedIssuers = unmodifiableSet(new LinkedHashSet<>(builder.acceptedIssuers));
    }

    public static Builder builder(final JwtJsonCodec codec) {
        return new Builder(codec);
    }

    /**
     * Single key mode: the token is verified with the given signer whatever its {@code kid}.
     */
    public <P extends JwtPayload> Jwt<P> parse(final String token, final Class<P> type, final JwtSigner signer) {
        requireNonNull(signer, "signer can't be null");
        return verify(token, type, header -> signer);
    }

    /**
     * Multiple keys mode: the signer is the one registered for the {@code kid} of the token,
     * the default signer of the registry when the token has no kid.
     */
    public <P extends JwtPayload> Jwt<P> parse(final String token, final Class<P> type, final SignerRegistry signers) {
        requireNonNull(signers, "signers can't be null");
        return verify(token, type, header -> signers.requireSigner(header.getKeyId()));
    }

    /**
     * Decodes header and payload <b>without any verification</b>.
     * The result must not be used for an authorization decision.
     */
    public <P> UnverifiedJwt<P> parseUnverified(final String token, final Class<P> type) {
        final Segments segments = split(token);
        return new UnverifiedJwt<>(decodeHeader(segments.header), decodePayload(segments.payload, type));
    }

    private <P extends JwtPayload> Jwt<P> verify(final String token, final Class<P> type,
                                                 final Function<JwtHeader, JwtSigner> signerSelector) {
        try {
            final Segments segments = split(token);
            final JwtHeader header = decodeHeader(segments.header);
            if ("none".equals(header.getAlgorithm()) && !unsignedAccepted) {
                throw new JwtException(JwtError.UNSIGNED_TOKEN, "Unsigned tokens are not accepted");
            }

            final JwtSigner signer = signerSelector.apply(header);
            if (signer.getAlgorithm().isUnsigned() && !unsignedAccepted) {
                throw new JwtException(JwtError.UNSIGNED_TOKEN, "Unsigned tokens are not accepted");
            }
            verifySignature(signer, header, segments);

            final P payload = decodePayload(segments.payload, type);
            payload.verify(new VerificationContext(signer, clock, expectedAudience, acceptedIssuers));
            return new Jwt<>(token, header, payload);
        } catch (final JwtException e) {
            LOGGER.debug("Rejected token: {}", e.getError());
            throw e;
        }
    }

    // how to verify only depends on the signer, a header alg which disagrees is rejected
    private void verifySignature(final JwtSigner signer, final JwtHeader header, final Segments segments) {
        final byte[] signature;
        try {
            signature = Base64Url.decode(segments.signature);
        } catch (final InvalidBase64UrlException e) {
            throw JwtException.invalidSignature();
        }
        if (!signer.getAlgorithmName().equals(header.getAlgorithm())
                || !signer.verify(signature, segments.header, segments.payload)) {
            throw JwtException.invalidSignature();
        }
    }

    private Segments split(final String token) {
        if (token == null) {
            throw new JwtException(JwtError.MALFORMED_TOKEN, "JWT is not valid");
        }
        final int firstDot = token.indexOf('.');
        if (firstDot < 0) {
            throw new JwtException(JwtError.MALFORMED_TOKEN, "JWT is not valid");
        }
        final int secondDot = token.indexOf('.', firstDot + 1);
        if (secondDot < 0 || token.indexOf('.', secondDot + 1) >= 0) {
            throw new JwtException(JwtError.MALFORMED_TOKEN, "JWT is not valid");
        }
        return new Segments(token.substring(0, firstDot), token.substring(firstDot + 1, secondDot), token.substring(secondDot + 1));
    }

    private JwtHeader decodeHeader(final String encoded) {
        try {
            return JwtHeader.fromJson(codec.readObject(Base64Url.decode(encoded)));
        } catch (final JwtException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new JwtException(JwtError.INVALID_HEADER_ENCODING, "JWT header is not valid", e);
        }
    }

    private <P> P decodePayload(final String encoded, final Class<P> type) {
        final P payload;
        try {
            payload = codec.readPayload(Base64Url.decode(encoded), type);
        } catch (final RuntimeException e) {
            throw new JwtException(JwtError.INVALID_PAYLOAD_ENCODING, "JWT payload is not valid", e);
        }
        if (payload == null) {
            throw new JwtException(JwtError.INVALID_PAYLOAD_ENCODING, "JWT payload is not valid");
        }
        return payload;
    }

    private static final class Segments {
        private final String header;
        private final String payload;
        private final String signature;

        private Segments(final String header, final String payload, final String signature) {
            this.header = header;
            this.payload = payload;
            this.signature = signature;
        }
    }

    public static final class Builder {
        private final JwtJsonCodec codec;
        private Clock clock = Clock.systemUTC();
        private boolean unsignedAccepted;
        private String expectedAudience;
        private Collection<String> acceptedIssuers = emptySet();

        private Builder(final JwtJsonCodec codec) {
            this.codec = codec;
        }

        public Builder clock(final Clock clock) {
            this.clock = requireNonNull(clock, "clock can't be null");
            return this;
        }

        /**
         * Accepts {@code alg: none} tokens. Only for interoperability testing.
         */
        public Builder acceptUnsigned(final boolean unsignedAccepted) {
            this.unsignedAccepted = unsignedAccepted;
            return this;
        }

        public Builder expectedAudience(final String expectedAudience) {
            this.expectedAudience = expectedAudience;
            return this;
        }

        public Builder acceptedIssuers(final Collection<String> acceptedIssuers) {
            this.acceptedIssuers = requireNonNull(acceptedIssuers, "acceptedIssuers can't be null");
            return this;
        }

        public JwtParser build() {
            return new JwtParser(this);
        }
    }
}
