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
package org.apache.geronimo.jwt.signing;

/**
 * Kind of failure raised while signing or verifying a token.
 * Stages are listed in the order a verification runs through them.
 */
public enum JwtError {
    MALFORMED_TOKEN,
    INVALID_HEADER_ENCODING,
    UNSIGNED_TOKEN,
    MISSING_KEY_ID,
    MISSING_SIGNER,
    INVALID_SIGNATURE,
    INVALID_PAYLOAD_ENCODING,

    // claims, only reached once the signature is trusted
    TOKEN_EXPIRED,
    TOKEN_NOT_YET_VALID,
    TOKEN_ISSUED_IN_FUTURE,
    INVALID_AUDIENCE,
    INVALID_ISSUER,
    MISSING_CLAIM,

    // signing side
    UNSUPPORTED_ALGORITHM,
    SIGNING_FAILED
}
