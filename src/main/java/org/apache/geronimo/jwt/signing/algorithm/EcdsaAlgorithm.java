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

import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;

final class EcdsaAlgorithm extends JcaSignatureAlgorithm {
    EcdsaAlgorithm(final JwsAlgorithm id, final ECPublicKey publicKey, final ECPrivateKey privateKey,
                   final String jcaProvider) {
        super(id, publicKey, privateKey, jcaProvider);
        if (id.getFamily() != JwsAlgorithm.Family.ECDSA) {
            throw new IllegalArgumentException(id + " is not an ECDSA algorithm");
        }
        final int fieldSize = publicKey.getParams().getCurve().getField().getFieldSize();
        if (fieldSize != id.getWidth().getCurveFieldSize()) {
            throw new IllegalArgumentException(id + " requires a P-" + id.getWidth().getCurveFieldSize()
                    + " key, got a " + fieldSize + " bits curve");
        }
    }

    @Override
    protected String getJcaAlgorithm() {
        return getId().getWidth().getEcdsa();
    }
}
