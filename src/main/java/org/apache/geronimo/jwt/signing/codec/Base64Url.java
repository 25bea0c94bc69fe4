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
package org.apache.geronimo.jwt.signing.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Unpadded URL-safe base64 as used by every JWT segment (RFC 7515, section 2).
 */
public final class Base64Url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64Url() {
        // no-op
    }

    public static String encode(final byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }

    public static String encode(final String utf8) {
        return encode(utf8.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes an unpadded base64url string.
     * Only the canonical encoding of a byte sequence is accepted: padding characters,
     * characters of the standard alphabet and non-zero trailing bits are all rejected.
     *
     * @param value the encoded segment.
     * @return the decoded bytes.
     * @throws InvalidBase64UrlException if the value is not canonical base64url.
     */
    public static byte[] decode(final String value) {
        final int length = value.length();
        if (length % 4 == 1) {
            throw new InvalidBase64UrlException("Invalid base64url length: " + length);
        }
        for (int i = 0; i < length; i++) {
            if (!isAlphabet(value.charAt(i))) {
                throw new InvalidBase64UrlException("Invalid base64url character at index " + i);
            }
        }

        final StringBuilder padded = new StringBuilder(length + 2).append(value);
        for (int i = 0; i < (4 - length % 4) % 4; i++) {
            padded.append('=');
        }
        final byte[] decoded;
        try {
            decoded = DECODER.decode(padded.toString());
        } catch (final IllegalArgumentException iae) {
            throw new InvalidBase64UrlException(iae.getMessage());
        }
        if (!encode(decoded).equals(value)) { // unused trailing bits were set
            throw new InvalidBase64UrlException("Non canonical base64url value");
        }
        return decoded;
    }

    private static boolean isAlphabet(final char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
    }
}
