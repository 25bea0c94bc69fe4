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

import java.time.Instant;
import java.util.Objects;

import javax.json.bind.annotation.JsonbProperty;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.claim.AudienceClaim;
import org.apache.geronimo.jwt.signing.claim.ExpirationClaim;
import org.apache.geronimo.jwt.signing.claim.IdClaim;
import org.apache.geronimo.jwt.signing.claim.IssuedAtClaim;
import org.apache.geronimo.jwt.signing.claim.IssuerClaim;
import org.apache.geronimo.jwt.signing.claim.NotBeforeClaim;
import org.apache.geronimo.jwt.signing.claim.SubjectClaim;

/**
 * Registered claims of RFC 7519. Applications extend it with their own properties
 * and override {@link #verify(VerificationContext)} calling {@code super.verify(context)}.
 */
public class StandardClaims implements JwtPayload {
    @JsonbProperty("exp")
    private ExpirationClaim expiration;

    @JsonbProperty("nbf")
    private NotBeforeClaim notBefore;

    @JsonbProperty("iat")
    private IssuedAtClaim issuedAt;

    @JsonbProperty("aud")
    private AudienceClaim audience;

    @JsonbProperty("iss")
    private IssuerClaim issuer;

    @JsonbProperty("sub")
    private SubjectClaim subject;

    @JsonbProperty("jti")
    private IdClaim id;

    /**
     * Checks {@code exp} and {@code nbf} when present, then the audience and issuer
     * expectations of the context.
     */
    @Override
    public void verify(final VerificationContext context) {
        final Instant now = context.now();
        if (expiration != null) {
            expiration.verify(now);
        }
        if (notBefore != null) {
            notBefore.verify(now);
        }
        if (context.getExpectedAudience() != null) {
            if (audience == null) {
                throw new JwtException(JwtError.INVALID_AUDIENCE, "Invalid audience");
            }
            audience.verify(context.getExpectedAudience());
        }
        if (!context.getAcceptedIssuers().isEmpty()) {
            if (issuer == null) {
                throw new JwtException(JwtError.INVALID_ISSUER, "Invalid issuer");
            }
            issuer.verify(context.getAcceptedIssuers());
        }
    }

    public ExpirationClaim getExpiration() {
        return expiration;
    }

    public void setExpiration(final ExpirationClaim expiration) {
        this.expiration = expiration;
    }

    public NotBeforeClaim getNotBefore() {
        return notBefore;
    }

    public void setNotBefore(final NotBeforeClaim notBefore) {
        this.notBefore = notBefore;
    }

    public IssuedAtClaim getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(final IssuedAtClaim issuedAt) {
        this.issuedAt = issuedAt;
    }

    public AudienceClaim getAudience() {
        return audience;
    }

    public void setAudience(final AudienceClaim audience) {
        this.audience = audience;
    }

    public IssuerClaim getIssuer() {
        return issuer;
    }

    public void setIssuer(final IssuerClaim issuer) {
        this.issuer = issuer;
    }

    public SubjectClaim getSubject() {
        return subject;
    }

    public void setSubject(final SubjectClaim subject) {
        this.subject = subject;
    }

    public IdClaim getId() {
        return id;
    }

    public void setId(final IdClaim id) {
        this.id = id;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final StandardClaims that = StandardClaims.class.cast(o);
        return Objects.equals(expiration, that.expiration) && Objects.equals(notBefore, that.notBefore)
                && Objects.equals(issuedAt, that.issuedAt) && Objects.equals(audience, that.audience)
                && Objects.equals(issuer, that.issuer) && Objects.equals(subject, that.subject)
                && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expiration, notBefore, issuedAt, audience, issuer, subject, id);
    }
}
