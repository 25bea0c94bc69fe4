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
package org.apache.geronimo.jwt.signing.signer;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signers indexed by key id ({@code kid}).
 * Lookups are lock free; registering an existing kid replaces the signer in one step.
 * A missing kid only resolves to the default signer, never to another registered one.
 */
public class SignerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(SignerRegistry.class);

    private final ConcurrentMap<String, JwtSigner> signers = new ConcurrentHashMap<>();
    private volatile JwtSigner defaultSigner;

    public SignerRegistry register(final String kid, final JwtSigner signer) {
        requireNonNull(kid, "kid can't be null");
        requireNonNull(signer, "signer can't be null");
        final JwtSigner previous = signers.put(kid, signer);
        if (previous == null) {
            LOGGER.info("Registered signer '{}' ({})", kid, signer.getAlgorithmName());
        } else {
            LOGGER.info("Rotated signer '{}' ({} -> {})", kid, previous.getAlgorithmName(), signer.getAlgorithmName());
        }
        return this;
    }

    public SignerRegistry register(final JwtSigner signer) {
        return register(signer.getName(), signer);
    }

    public boolean unregister(final String kid) {
        final boolean removed = signers.remove(kid) != null;
        if (removed) {
            LOGGER.info("Unregistered signer '{}'", kid);
        }
        return removed;
    }

    public SignerRegistry setDefault(final JwtSigner signer) {
        defaultSigner = signer;
        if (signer != null) {
            LOGGER.info("Default signer is '{}' ({})", signer.getName(), signer.getAlgorithmName());
        }
        return this;
    }

    public Optional<JwtSigner> getDefault() {
        return Optional.ofNullable(defaultSigner);
    }

    public Optional<JwtSigner> getSigner(final String kid) {
        return Optional.ofNullable(kid).map(signers::get);
    }

    public Set<String> getKeyIds() {
        return unmodifiableSet(new HashSet<>(signers.keySet()));
    }

    /**
     * @param kid the key id of the token, can be null.
     * @return the signer registered for the kid, or the default signer when there is no kid.
     * @throws JwtException {@link JwtError#MISSING_SIGNER} for an unknown kid,
     * {@link JwtError#MISSING_KEY_ID} without kid nor default signer.
     */
    public JwtSigner requireSigner(final String kid) {
        if (kid == null) {
            final JwtSigner signer = defaultSigner;
            if (signer == null) {
                throw new JwtException(JwtError.MISSING_KEY_ID, "kid header required to identify signer");
            }
            return signer;
        }
        final JwtSigner signer = signers.get(kid);
        if (signer == null) {
            throw new JwtException(JwtError.MISSING_SIGNER, "No signer registered for kid '" + kid + "'");
        }
        return signer;
    }
}
