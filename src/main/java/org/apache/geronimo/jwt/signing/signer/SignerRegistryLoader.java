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

import static java.util.Optional.ofNullable;
import static java.util.stream.Collectors.toCollection;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.apache.geronimo.jwt.signing.algorithm.Algorithms;
import org.apache.geronimo.jwt.signing.algorithm.JwsAlgorithm;
import org.apache.geronimo.jwt.signing.algorithm.SigningAlgorithm;
import org.apache.geronimo.jwt.signing.config.JwtSigningConfig;
import org.apache.geronimo.jwt.signing.io.PropertiesLoader;
import org.apache.geronimo.jwt.signing.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SignerRegistry} from configuration.
 *
 * <pre>
 * geronimo.jwt-signing.signers.mapping = signers.properties
 * geronimo.jwt-signing.signer.default = hmac-1
 * </pre>
 *
 * where the mapping (inline, file or classpath resource) lists, per kid:
 *
 * <pre>
 * hmac-1.alg = HS256
 * hmac-1.secret = ...
 * hmac-2.alg = HS512
 * hmac-2.secret-file = /etc/jwt/hmac-2.key
 * rsa-1.alg = RS256
 * rsa-1.public-key = rsa-1.pub.pem
 * rsa-1.private-key = rsa-1.pem
 * </pre>
 *
 * An HMAC secret is either the literal {@code secret} value (UTF-8) or the raw bytes of a
 * {@code secret-file} or {@code secret-resource}.
 * Keys are PEM (X.509 public, PKCS#8 private) given inline, as a file or as a classpath resource.
 * A signer without private key only verifies.
 */
public class SignerRegistryLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SignerRegistryLoader.class);

    private static final String ALG = ".alg";
    private static final String SECRET = ".secret";
    private static final String SECRET_FILE = ".secret-file";
    private static final String SECRET_RESOURCE = ".secret-resource";

    private final JwtSigningConfig config;

    public SignerRegistryLoader(final JwtSigningConfig config) {
        this.config = config;
    }

    public SignerRegistry load() {
        final SignerRegistry registry = new SignerRegistry();
        final String jcaProvider = config.read("jca.provider", null);
        ofNullable(config.read("signers.mapping", null))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(PropertiesLoader::load)
                .ifPresent(props -> props.stringPropertyNames().stream()
                        .filter(k -> k.endsWith(ALG))
                        .map(k -> k.substring(0, k.length() - ALG.length()))
                        .collect(toCollection(TreeSet::new))
                        .forEach(kid -> registry.register(kid, new JwtSigner(kid, createAlgorithm(kid, props, jcaProvider)))));

        ofNullable(config.read("signer.default", null))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .ifPresent(kid -> registry.setDefault(registry.getSigner(kid)
                        .orElseThrow(() -> new IllegalArgumentException("Default signer '" + kid + "' is not configured"))));

        LOGGER.info("Loaded {} signer(s), default signer: {}", registry.getKeyIds().size(),
                registry.getDefault().map(JwtSigner::getName).orElse("none"));
        return registry;
    }

    private SigningAlgorithm createAlgorithm(final String kid, final Properties props, final String jcaProvider) {
        final JwsAlgorithm id = JwsAlgorithm.fromName(props.getProperty(kid + ALG).trim());
        switch (id.getFamily()) {
            case HMAC:
                return Algorithms.create(id, readSecret(kid, props), null, null, jcaProvider);
            case RSA:
            case ECDSA:
                final String keyAlgorithm = id.getFamily() == JwsAlgorithm.Family.RSA ? "RSA" : "EC";
                final String publicKey = props.getProperty(kid + ".public-key");
                if (publicKey == null) {
                    throw new IllegalArgumentException("No public-key for signer '" + kid + "'");
                }
                final PublicKey verificationKey = PemKeys.readPublicKey(Resources.read(publicKey.trim()), keyAlgorithm);
                final PrivateKey signingKey = ofNullable(props.getProperty(kid + ".private-key"))
                        .map(String::trim)
                        .map(Resources::read)
                        .map(pem -> PemKeys.readPrivateKey(pem, keyAlgorithm))
                        .orElse(null);
                return Algorithms.create(id, null, verificationKey, signingKey, jcaProvider);
            default:
                return Algorithms.none();
        }
    }

    // the secret is taken literally, only the -file/-resource variants are resolved
    private byte[] readSecret(final String kid, final Properties props) {
        final String secret = props.getProperty(kid + SECRET);
        final String file = props.getProperty(kid + SECRET_FILE);
        final String resource = props.getProperty(kid + SECRET_RESOURCE);
        final long sources = Stream.of(secret, file, resource).filter(Objects::nonNull).count();
        if (sources == 0) {
            throw new IllegalArgumentException("No secret for signer '" + kid + "'");
        }
        if (sources > 1) {
            throw new IllegalArgumentException("Signer '" + kid + "' must use only one of "
                    + SECRET + ", " + SECRET_FILE + " and " + SECRET_RESOURCE);
        }
        if (secret != null) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
        if (file != null) {
            return Resources.readFile(file.trim());
        }
        return Resources.readResource(resource.trim());
    }
}
