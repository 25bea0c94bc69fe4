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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.TestKeys;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class AlgorithmsTest {
    private final byte[] message = "eyJhbGciOiJIUzI1NiJ9.eyJzdWIiOiJtZSJ9".getBytes(StandardCharsets.US_ASCII);

    @DataProvider
    public Object[][] algorithms() {
        final KeyPair p256 = TestKeys.ec("secp256r1");
        final KeyPair p384 = TestKeys.ec("secp384r1");
        final KeyPair p521 = TestKeys.ec("secp521r1");
        return new Object[][]{
                {Algorithms.hs256(TestKeys.SECRET), "HS256", 32},
                {Algorithms.hs384(TestKeys.SECRET), "HS384", 48},
                {Algorithms.hs512(TestKeys.SECRET), "HS512", 64},
                {Algorithms.rs256(TestKeys.rsa()), "RS256", 256},
                {Algorithms.rs384(TestKeys.rsa()), "RS384", 256},
                {Algorithms.rs512(TestKeys.rsa()), "RS512", 256},
                {Algorithms.es256(p256), "ES256", 64},
                {Algorithms.es384(p384), "ES384", 96},
                {Algorithms.es512(p521), "ES512", 132}
        };
    }

    @Test(dataProvider = "algorithms")
    public void signAndVerify(final SigningAlgorithm algorithm, final String name, final int signatureLength) {
        assertEquals(algorithm.getName(), name);
        final byte[] signature = algorithm.sign(message);
        assertEquals(signature.length, signatureLength);
        assertTrue(algorithm.verify(message, signature));

        final byte[] tampered = signature.clone();
        tampered[0] ^= 1;
        assertFalse(algorithm.verify(message, tampered));
        assertFalse(algorithm.verify("other".getBytes(StandardCharsets.US_ASCII), signature));
        assertFalse(algorithm.verify(message, new byte[0]));
    }

    @Test
    public void hmacKeysAreNotInterchangeable() {
        final byte[] signature = Algorithms.hs256(TestKeys.SECRET).sign(message);
        assertFalse(Algorithms.hs256(TestKeys.OTHER_SECRET).verify(message, signature));
        assertFalse(Algorithms.hs384(TestKeys.SECRET).verify(message, signature));
    }

    @Test
    public void rsaKeysAreNotInterchangeable() {
        final byte[] signature = Algorithms.rs256(TestKeys.rsa()).sign(message);
        assertFalse(Algorithms.rs256((RSAPublicKey) TestKeys.otherRsa().getPublic()).verify(message, signature));
        assertTrue(Algorithms.rs256((RSAPublicKey) TestKeys.rsa().getPublic()).verify(message, signature));
    }

    @Test
    public void verifyOnlyAlgorithmCantSign() {
        final SigningAlgorithm algorithm = Algorithms.es256((ECPublicKey) TestKeys.ec("secp256r1").getPublic());
        assertEquals(expectThrows(JwtException.class, () -> algorithm.sign(message)).getError(), JwtError.SIGNING_FAILED);
    }

    @Test
    public void curveMustMatchHashWidth() {
        assertThrows(IllegalArgumentException.class, () -> Algorithms.es384(TestKeys.ec("secp256r1")));
        assertThrows(IllegalArgumentException.class, () -> Algorithms.es256(TestKeys.ec("secp521r1")));
    }

    @Test
    public void keyShapeMustMatchFamily() {
        final KeyPair ec = TestKeys.ec("secp256r1");
        assertThrows(IllegalArgumentException.class, () -> Algorithms.rs256(ec));
        assertThrows(IllegalArgumentException.class,
                () -> Algorithms.create(JwsAlgorithm.ES256, null, TestKeys.rsa().getPublic(), null, null));
        assertThrows(IllegalArgumentException.class, () -> Algorithms.hs256(new byte[0]));
    }

    @Test
    public void rejectsShortRsaKeys() {
        assertThrows(IllegalArgumentException.class, () -> Algorithms.rs256(TestKeys.rsa(1024)));
    }

    @Test
    public void none() {
        final SigningAlgorithm none = Algorithms.none();
        assertEquals(none.getName(), "none");
        assertTrue(none.isUnsigned());
        assertEquals(none.sign(message).length, 0);
        assertTrue(none.verify(message, new byte[0]));
        assertFalse(none.verify(message, new byte[]{1}));
    }

    @Test
    public void algorithmNames() {
        assertEquals(JwsAlgorithm.fromName("ES384"), JwsAlgorithm.ES384);
        assertEquals(JwsAlgorithm.fromName("none"), JwsAlgorithm.NONE);
        assertEquals(expectThrows(JwtException.class, () -> JwsAlgorithm.fromName("hs256")).getError(),
                JwtError.UNSUPPORTED_ALGORITHM);
        assertEquals(expectThrows(JwtException.class, () -> JwsAlgorithm.fromName("NONE")).getError(),
                JwtError.UNSUPPORTED_ALGORITHM);
        assertEquals(expectThrows(JwtException.class, () -> JwsAlgorithm.fromName("PS256")).getError(),
                JwtError.UNSUPPORTED_ALGORITHM);
    }
}
