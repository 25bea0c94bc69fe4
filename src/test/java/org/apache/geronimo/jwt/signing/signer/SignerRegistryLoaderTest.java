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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.util.HashMap;
import java.util.Map;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.TestKeys;
import org.apache.geronimo.jwt.signing.algorithm.Algorithms;
import org.apache.geronimo.jwt.signing.algorithm.SigningAlgorithm;
import org.apache.geronimo.jwt.signing.config.JwtSigningConfig;
import org.testng.annotations.Test;

public class SignerRegistryLoaderTest {
    @Test
    public void loadsSignersFromMapping() throws IOException {
        final KeyPair rsa = TestKeys.rsa();
        final KeyPair ec = TestKeys.ec("secp256r1");
        final Path dir = Files.createTempDirectory("signers");
        final Path privateKey = Files.write(dir.resolve("rsa.pem"), PemKeys.toPem(rsa.getPrivate()).getBytes(StandardCharsets.UTF_8));
        final Path publicKey = Files.write(dir.resolve("rsa.pub.pem"), PemKeys.toPem(rsa.getPublic()).getBytes(StandardCharsets.UTF_8));

        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", ""
                + "hmac-1.alg = HS512\n"
                + "hmac-1.secret = a-shared-secret-of-at-least-32-bytes!\n"
                + "rsa-1.alg = RS256\n"
                + "rsa-1.private-key = " + privateKey.toAbsolutePath() + "\n"
                + "rsa-1.public-key = " + publicKey.toAbsolutePath() + "\n"
                + "ec-1.alg = ES256\n"
                + "ec-1.public-key = " + PemKeys.toPem(ec.getPublic()).replace("\n", "") + "\n");
        values.put("signer.default", "rsa-1");

        final SignerRegistry registry = new SignerRegistryLoader(config(values)).load();
        assertEquals(registry.getKeyIds().size(), 3);
        assertEquals(registry.requireSigner("hmac-1").getAlgorithmName(), "HS512");
        assertEquals(registry.requireSigner("ec-1").getAlgorithmName(), "ES256");
        assertSame(registry.requireSigner(null), registry.requireSigner("rsa-1"));

        final JwtSigner rsaSigner = registry.requireSigner("rsa-1");
        assertTrue(rsaSigner.verify(rsaSigner.sign("aGVhZGVy", "cGF5bG9hZA"), "aGVhZGVy", "cGF5bG9hZA"));

        // ec-1 has no private key: verify only
        assertEquals(expectThrows(JwtException.class, () -> registry.requireSigner("ec-1").sign("aGVhZGVy", "cGF5bG9hZA")).getError(),
                JwtError.SIGNING_FAILED);
    }

    @Test
    public void loadsMappingFromClasspath() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "signers/hmac-signers.properties");
        final SignerRegistry registry = new SignerRegistryLoader(config(values)).load();
        assertEquals(registry.requireSigner("primary").getAlgorithmName(), "HS256");
        assertEquals(registry.requireSigner("secondary").getAlgorithmName(), "HS384");
        assertFalse(registry.getDefault().isPresent());
    }

    @Test
    public void emptyConfiguration() {
        final SignerRegistry registry = new SignerRegistryLoader(config(new HashMap<>())).load();
        assertTrue(registry.getKeyIds().isEmpty());
        assertFalse(registry.getDefault().isPresent());
    }

    @Test
    public void inlineSecretIsNeverResolved() throws IOException {
        final Path file = Files.write(Files.createTempFile("secret", ".txt"), "from-file".getBytes(StandardCharsets.UTF_8));
        for (final String secret : new String[]{"simplelogger.properties", file.toAbsolutePath().toString()}) {
            final Map<String, String> values = new HashMap<>();
            values.put("signers.mapping", "k.alg = HS256\nk.secret = " + secret.replace("\\", "\\\\"));
            final JwtSigner loaded = new SignerRegistryLoader(config(values)).load().requireSigner("k");
            assertSameKey(loaded, Algorithms.hs256(secret.getBytes(StandardCharsets.UTF_8)));
        }
    }

    @Test
    public void secretFileIsReadAsRawBytes() throws IOException {
        final byte[] secret = "line-1\r\nline-2\n".getBytes(StandardCharsets.UTF_8);
        final Path file = Files.write(Files.createTempFile("secret", ".key"), secret);
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS256\nk.secret-file = " + file.toAbsolutePath().toString().replace("\\", "\\\\"));
        assertSameKey(new SignerRegistryLoader(config(values)).load().requireSigner("k"), Algorithms.hs256(secret));
    }

    @Test
    public void secretResourceIsReadAsRawBytes() throws IOException {
        final byte[] secret;
        try (final InputStream stream = Thread.currentThread().getContextClassLoader().getResourceAsStream("simplelogger.properties")) {
            secret = stream.readAllBytes();
        }
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS384\nk.secret-resource = simplelogger.properties");
        assertSameKey(new SignerRegistryLoader(config(values)).load().requireSigner("k"), Algorithms.hs384(secret));
    }

    @Test
    public void missingSecretResource() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS256\nk.secret-resource = signers/missing.key");
        assertThrows(IllegalArgumentException.class, () -> new SignerRegistryLoader(config(values)).load());
    }

    @Test
    public void ambiguousSecret() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS256\nk.secret = s\nk.secret-resource = simplelogger.properties");
        assertThrows(IllegalArgumentException.class, () -> new SignerRegistryLoader(config(values)).load());
    }

    @Test
    public void unknownAlgorithm() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = PS256\nk.secret = s");
        assertEquals(expectThrows(JwtException.class, () -> new SignerRegistryLoader(config(values)).load()).getError(),
                JwtError.UNSUPPORTED_ALGORITHM);
    }

    @Test
    public void missingSecret() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS256");
        assertThrows(IllegalArgumentException.class, () -> new SignerRegistryLoader(config(values)).load());
    }

    @Test
    public void unknownDefault() {
        final Map<String, String> values = new HashMap<>();
        values.put("signers.mapping", "k.alg = HS256\nk.secret = s");
        values.put("signer.default", "other");
        assertThrows(IllegalArgumentException.class, () -> new SignerRegistryLoader(config(values)).load());
    }

    private static void assertSameKey(final JwtSigner loaded, final SigningAlgorithm expected) {
        final JwtSigner reference = new JwtSigner(expected);
        assertEquals(loaded.sign("aGVhZGVy", "cGF5bG9hZA"), reference.sign("aGVhZGVy", "cGF5bG9hZA"));
    }

    private static JwtSigningConfig config(final Map<String, String> values) {
        return values::getOrDefault;
    }
}
