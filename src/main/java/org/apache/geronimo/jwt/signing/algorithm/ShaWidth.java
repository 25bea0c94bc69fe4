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

/**
 * Hash width of an algorithm and the JCA names it maps to.
 */
public enum ShaWidth {
    SHA256("HmacSHA256", "SHA256withRSA", "SHA256withECDSAinP1363Format", 256),
    SHA384("HmacSHA384", "SHA384withRSA", "SHA384withECDSAinP1363Format", 384),
    SHA512("HmacSHA512", "SHA512withRSA", "SHA512withECDSAinP1363Format", 521);

    private final String mac;
    private final String rsa;
    private final String ecdsa;
    private final int curveFieldSize;

    ShaWidth(final String mac, final String rsa, final String ecdsa, final int curveFieldSize) {
        this.mac = mac;
        this.rsa = rsa;
        this.ecdsa = ecdsa;
        this.curveFieldSize = curveFieldSize;
    }

    public String getMac() {
        return mac;
    }

    public String getRsa() {
        return rsa;
    }

    // P1363 format is the raw R||S concatenation JWS uses, not DER
    public String getEcdsa() {
        return ecdsa;
    }

    public int getCurveFieldSize() {
        return curveFieldSize;
    }
}
