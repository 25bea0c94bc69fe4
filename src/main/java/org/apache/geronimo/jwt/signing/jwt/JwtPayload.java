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

/**
 * Application payload of a token. Implementations are mapped with JSON-B
 * (public no-arg constructor and accessors) and check their own claims.
 */
public interface JwtPayload {
    /**
     * Called once the signature is verified, before the payload is handed over.
     *
     * @param context the signer that authenticated the token and the current time.
     * @throws org.apache.geronimo.jwt.signing.JwtException with the kind of the failing claim.
     */
    void verify(VerificationContext context);
}
