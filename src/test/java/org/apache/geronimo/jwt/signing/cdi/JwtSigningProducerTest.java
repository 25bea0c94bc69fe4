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
package org.apache.geronimo.jwt.signing.cdi;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.algorithm.Algorithms;
import org.apache.geronimo.jwt.signing.claim.AudienceClaim;
import org.apache.geronimo.jwt.signing.claim.ExpirationClaim;
import org.apache.geronimo.jwt.signing.jwt.Jwt;
import org.apache.geronimo.jwt.signing.jwt.StandardClaims;
import org.apache.geronimo.jwt.signing.signer.JwtSigner;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class JwtSigningProducerTest {
    private final JwtSigningProducer producer = new JwtSigningProducer();

    @BeforeMethod
    public void init() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "signers/hmac-signers.properties");
        values.put("signer.default", "primary");
        values.put("audience", "orders");
        producer.init(values::getOrDefault);
    }

    @AfterMethod
    public void destroy() {
        producer.destroy();
    }

    @Test
    public void signAndParseWithConfiguredRegistry() {
        final StandardClaims claims = new StandardClaims();
        claims.setExpiration(new ExpirationClaim(Instant.now().plusSeconds(300)));
        claims.setAudience(new AudienceClaim("orders"));

        final String token = producer.encoder().sign(claims, producer.signerRegistry(), "secondary");
        final Jwt<StandardClaims> jwt = producer.parser().parse(token, StandardClaims.class, producer.signerRegistry());
        assertEquals(jwt.getHeader().getKeyId(), "secondary");
        assertEquals(jwt.getHeader().getAlgorithm(), "HS384");
        assertEquals(jwt.getPayload(), claims);

        final String byDefault = producer.encoder().sign(claims, producer.signerRegistry());
        assertEquals(producer.parser().parse(byDefault, StandardClaims.class, producer.signerRegistry()).getHeader().getAlgorithm(),
                "HS256");
    }

    @Test
    public void configuredAudienceIsEnforced() {
        final StandardClaims claims = new StandardClaims();
        claims.setAudience(new AudienceClaim("billing"));
        final String token = producer.encoder().sign(claims, producer.signerRegistry());
        assertEquals(expectThrows(JwtException.class,
                () -> producer.parser().parse(token, StandardClaims.class, producer.signerRegistry())).getError(),
                JwtError.INVALID_AUDIENCE);
    }

    @Test
    public void unsignedTokensStayRejected() {
        final JwtSigner none = new JwtSigner(Algorithms.none());
        final String token = producer.encoder().sign(new StandardClaims(), none);
        assertEquals(expectThrows(JwtException.class,
                () -> producer.parser().parse(token, StandardClaims.class, none)).getError(),
                JwtError.UNSIGNED_TOKEN);
    }
}
