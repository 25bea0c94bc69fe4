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
package org.apache.geronimo.jwt.signing.claim;

import static java.util.Arrays.asList;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

import java.time.Duration;
import java.time.Instant;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.testng.annotations.Test;

public class ClaimsTest {
    private final Instant now = Instant.ofEpochSecond(1_700_000_000L);

    @Test
    public void expirationIsExclusive() {
        assertEquals(expectThrows(JwtException.class, () -> new ExpirationClaim(now).verify(now)).getError(),
                JwtError.TOKEN_EXPIRED);
        new ExpirationClaim(now.plusSeconds(1)).verify(now);
    }

    @Test
    public void expirationInThePast() {
        assertEquals(expectThrows(JwtException.class, () -> new ExpirationClaim(now.minusSeconds(30)).verify(now)).getError(),
                JwtError.TOKEN_EXPIRED);
    }

    @Test
    public void valuesAreTruncatedToTheSecond() {
        final ExpirationClaim claim = new ExpirationClaim(now.plusMillis(999));
        assertEquals(claim.getValue(), now);
        assertEquals(claim, new ExpirationClaim(now));
        expectThrows(JwtException.class, () -> claim.verify(now.plusMillis(500)));
    }

    @Test
    public void notBefore() {
        new NotBeforeClaim(now).verify(now);
        new NotBeforeClaim(now.minusSeconds(10)).verify(now);
        assertEquals(expectThrows(JwtException.class, () -> new NotBeforeClaim(now.plusSeconds(1)).verify(now)).getError(),
                JwtError.TOKEN_NOT_YET_VALID);
    }

    @Test
    public void issuedAtPolicy() {
        final IssuedAtClaim claim = new IssuedAtClaim(now.plusSeconds(30));
        claim.verifyNotIssuedAfter(now, Duration.ofMinutes(1));
        assertEquals(expectThrows(JwtException.class, () -> claim.verifyNotIssuedAfter(now, Duration.ZERO)).getError(),
                JwtError.TOKEN_ISSUED_IN_FUTURE);
    }

    @Test
    public void audience() {
        final AudienceClaim claim = new AudienceClaim("orders", "billing");
        claim.verify("billing");
        assertEquals(expectThrows(JwtException.class, () -> claim.verify("admin")).getError(), JwtError.INVALID_AUDIENCE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void emptyAudience() {
        new AudienceClaim();
    }

    @Test
    public void issuer() {
        final IssuerClaim claim = new IssuerClaim("https://issuer.example.com");
        claim.verify(asList("https://other.example.com", "https://issuer.example.com"));
        assertEquals(expectThrows(JwtException.class, () -> claim.verify(asList("https://other.example.com"))).getError(),
                JwtError.INVALID_ISSUER);
    }
}
