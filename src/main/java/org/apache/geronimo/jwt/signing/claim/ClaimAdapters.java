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
package org.apache.geronimo.jwt.signing.claim;

import static java.util.stream.Collectors.toList;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonNumber;
import javax.json.JsonString;
import javax.json.JsonValue;
import javax.json.bind.adapter.JsonbAdapter;
import javax.json.spi.JsonProvider;

/**
 * JSON-B adapters of the registered claims.
 * Dates are NumericDate values (seconds, never milliseconds) and an audience is
 * read from a string or an array of strings.
 */
public final class ClaimAdapters {
    // Long.MAX_VALUE has 19 digits
    private static final int MAX_INTEGER_DIGITS = 19;

    private ClaimAdapters() {
        // no-op
    }

    public static JsonbAdapter<?, ?>[] all(final JsonProvider provider) {
        return new JsonbAdapter<?, ?>[]{
                new Expiration(provider), new NotBefore(provider), new IssuedAt(provider),
                new Issuer(provider), new Subject(provider), new Id(provider),
                new Audience(provider)
        };
    }

    /**
     * Fractional seconds are dropped, a value {@link Instant} can't represent is rejected.
     */
    static long toEpochSecond(final String name, final JsonValue value) {
        if (value.getValueType() != JsonValue.ValueType.NUMBER) {
            throw new IllegalArgumentException(name + " must be a number");
        }
        final BigDecimal number = JsonNumber.class.cast(value).bigDecimalValue();
        if (number.precision() - number.scale() > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException(name + " is out of range");
        }
        if (number.precision() - number.scale() <= 0) { // |number| < 1
            return number.signum() < 0 ? -1 : 0;
        }
        final long seconds = number.setScale(0, RoundingMode.FLOOR).longValueExact();
        if (seconds < Instant.MIN.getEpochSecond() || seconds > Instant.MAX.getEpochSecond()) {
            throw new IllegalArgumentException(name + " is out of range");
        }
        return seconds;
    }

    static String toText(final String name, final JsonValue value) {
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new IllegalArgumentException(name + " must be a string");
        }
        return JsonString.class.cast(value).getString();
    }

    public static class Expiration implements JsonbAdapter<ExpirationClaim, JsonValue> {
        private final JsonProvider provider;

        public Expiration(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final ExpirationClaim claim) {
            return provider.createValue(claim.getEpochSecond());
        }

        @Override
        public ExpirationClaim adaptFromJson(final JsonValue value) {
            return new ExpirationClaim(Instant.ofEpochSecond(toEpochSecond("exp", value)));
        }
    }

    public static class NotBefore implements JsonbAdapter<NotBeforeClaim, JsonValue> {
        private final JsonProvider provider;

        public NotBefore(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final NotBeforeClaim claim) {
            return provider.createValue(claim.getEpochSecond());
        }

        @Override
        public NotBeforeClaim adaptFromJson(final JsonValue value) {
            return new NotBeforeClaim(Instant.ofEpochSecond(toEpochSecond("nbf", value)));
        }
    }

    public static class IssuedAt implements JsonbAdapter<IssuedAtClaim, JsonValue> {
        private final JsonProvider provider;

        public IssuedAt(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final IssuedAtClaim claim) {
            return provider.createValue(claim.getEpochSecond());
        }

        @Override
        public IssuedAtClaim adaptFromJson(final JsonValue value) {
            return new IssuedAtClaim(Instant.ofEpochSecond(toEpochSecond("iat", value)));
        }
    }

    public static class Issuer implements JsonbAdapter<IssuerClaim, JsonValue> {
        private final JsonProvider provider;

        public Issuer(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final IssuerClaim claim) {
            return provider.createValue(claim.getValue());
        }

        @Override
        public IssuerClaim adaptFromJson(final JsonValue value) {
            return new IssuerClaim(toText("iss", value));
        }
    }

    public static class Subject implements JsonbAdapter<SubjectClaim, JsonValue> {
        private final JsonProvider provider;

        public Subject(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final SubjectClaim claim) {
            return provider.createValue(claim.getValue());
        }

        @Override
        public SubjectClaim adaptFromJson(final JsonValue value) {
            return new SubjectClaim(toText("sub", value));
        }
    }

    public static class Id implements JsonbAdapter<IdClaim, JsonValue> {
        private final JsonProvider provider;

        public Id(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final IdClaim claim) {
            return provider.createValue(claim.getValue());
        }

        @Override
        public IdClaim adaptFromJson(final JsonValue value) {
            return new IdClaim(toText("jti", value));
        }
    }

    public static class Audience implements JsonbAdapter<AudienceClaim, JsonValue> {
        private final JsonProvider provider;

        public Audience(final JsonProvider provider) {
            this.provider = provider;
        }

        @Override
        public JsonValue adaptToJson(final AudienceClaim claim) {
            if (claim.getValue().size() == 1) {
                return provider.createValue(claim.getValue().iterator().next());
            }
            final JsonArrayBuilder builder = provider.createArrayBuilder();
            claim.getValue().forEach(builder::add);
            return builder.build();
        }

        @Override
        public AudienceClaim adaptFromJson(final JsonValue value) {
            switch (value.getValueType()) {
                case STRING:
                    return new AudienceClaim(toText("aud", value));
                case ARRAY:
                    final List<String> audiences = JsonArray.class.cast(value).stream()
                            .map(it -> toText("aud entry", it))
                            .collect(toList());
                    return new AudienceClaim(audiences);
                default:
                    throw new IllegalArgumentException("aud must be a string or an array of strings");
            }
        }
    }
}
