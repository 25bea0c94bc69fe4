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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonValue;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;
import org.apache.geronimo.jwt.signing.codec.JwtJsonCodec;

/**
 * JOSE header of a token. Built by {@link JwtEncoder} from the signer actually signing,
 * there is no way to choose {@code alg} independently.
 */
public final class JwtHeader {
    private final String algorithm;
    private final String keyId;
    private final String type;
    private final String contentType;

    JwtHeader(final String algorithm, final String keyId, final String type, final String contentType) {
        this.algorithm = requireNonNull(algorithm, "alg can't be null");
        this.keyId = keyId;
        this.type = type;
        this.contentType = contentType;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getType() {
        return type;
    }

    public String getContentType() {
        return contentType;
    }

    JsonObject toJson(final JwtJsonCodec codec) {
        final JsonObjectBuilder builder = codec.createObjectBuilder().add("alg", algorithm);
        if (keyId != null) {
            builder.add("kid", keyId);
        }
        if (type != null) {
            builder.add("typ", type);
        }
        if (contentType != null) {
            builder.add("cty", contentType);
        }
        return builder.build();
    }

    // unknown members are ignored
    static JwtHeader fromJson(final JsonObject json) {
        final String alg = getString(json, "alg");
        if (alg == null) {
            throw new JwtException(JwtError.INVALID_HEADER_ENCODING, "No alg in JWT header");
        }
        return new JwtHeader(alg, getString(json, "kid"), getString(json, "typ"), getString(json, "cty"));
    }

    private static String getString(final JsonObject json, final String key) {
        final JsonValue value = json.get(key);
        if (value == null || value.getValueType() == JsonValue.ValueType.NULL) {
            return null;
        }
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JwtException(JwtError.INVALID_HEADER_ENCODING, "Invalid " + key + " in JWT header");
        }
        return json.getString(key);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final JwtHeader that = JwtHeader.class.cast(o);
        return algorithm.equals(that.algorithm) && Objects.equals(keyId, that.keyId)
                && Objects.equals(type, that.type) && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, keyId, type, contentType);
    }

    @Override
    public String toString() {
        return "JwtHeader[alg=" + algorithm + ", kid=" + keyId + ", typ=" + type + ", cty=" + contentType + "]";
    }
}
