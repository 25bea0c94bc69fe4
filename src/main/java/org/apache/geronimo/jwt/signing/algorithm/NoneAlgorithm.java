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
 * {@code alg: none}. Only for interoperability testing, parsers reject it unless told otherwise.
 */
final class NoneAlgorithm extends SigningAlgorithm {
    static final NoneAlgorithm INSTANCE = new NoneAlgorithm();

    private NoneAlgorithm() {
        super(JwsAlgorithm.NONE);
    }

    @Override
    public byte[] sign(final byte[] message) {
        return new byte[0];
    }

    @Override
    public boolean verify(final byte[] message, final byte[] signature) {
        return signature.length == 0;
    }
}
