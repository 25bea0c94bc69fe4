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

import java.time.Clock;
import java.time.Instant;
import java.util.Set;

import org.apache.geronimo.jwt.signing.signer.JwtSigner;

public final class VerificationContext {
    private final JwtSigner signer;
    private final Clock clock;
    private final String expectedAudience;
    private final Set<String> acceptedIssuers;

    VerificationContext(final JwtSigner signer, final Clock clock, final String expectedAudience,
                        final Set<String> acceptedIssuers) {
        this.signer = signer;
        this.clock = clock;
        this.expectedAudience = expectedAudience;
        this.acceptedIssuers = acceptedIssuers;
    }

    public JwtSigner getSigner() {
        return signer;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * @return the audience tokens must be intended for, null when not checked.
     */
    public String getExpectedAudience() {
        return expectedAudience;
    }

    /**
     * @return accepted issuers, empty when not checked.
     */
    public Set<String> getAcceptedIssuers() {
        return acceptedIssuers;
    }
}
