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

import static java.util.Collections.emptyMap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import javax.json.JsonBuilderFactory;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;
import javax.json.bind.Jsonb;
import javax.json.bind.JsonbBuilder;
import javax.json.bind.JsonbConfig;
import javax.json.spi.JsonProvider;

import org.apache.geronimo.jwt.signing.claim.ClaimAdapters;

/**
 * JSON side of the tokens: JSON-P for the header, JSON-B for application payloads.
 * The JSON-B mapper knows the registered claim types, dates are written as
 * whole seconds since the epoch.
 */
public class JwtJsonCodec implements AutoCloseable {
    private final JsonReaderFactory readerFactory;
    private final JsonWriterFactory writerFactory;
    private final JsonBuilderFactory builderFactory;
    private final Jsonb jsonb;

    public JwtJsonCodec() {
        this(JsonProvider.provider());
    }

    public JwtJsonCodec(final JsonProvider provider) {
        readerFactory = provider.createReaderFactory(emptyMap());
        writerFactory = provider.createWriterFactory(emptyMap());
        builderFactory = provider.createBuilderFactory(emptyMap());
        jsonb = JsonbBuilder.newBuilder()
                .withProvider(provider)
                .withConfig(new JsonbConfig()
                        .withNullValues(false)
                        .withAdapters(ClaimAdapters.all(provider))
                        .setProperty("johnzon.cdi.activated", false))
                .build();
    }

    public JsonObjectBuilder createObjectBuilder() {
        return builderFactory.createObjectBuilder();
    }

    /**
     * @throws javax.json.JsonException if the bytes are not a JSON object.
     */
    public JsonObject readObject(final byte[] json) {
        try (final JsonReader reader = readerFactory.createReader(new ByteArrayInputStream(json), StandardCharsets.UTF_8)) {
            return reader.readObject();
        }
    }

    public byte[] writeObject(final JsonObject object) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (final JsonWriter writer = writerFactory.createWriter(out, StandardCharsets.UTF_8)) {
            writer.writeObject(object);
        }
        return out.toByteArray();
    }

    public byte[] writePayload(final Object payload) {
        return jsonb.toJson(payload).getBytes(StandardCharsets.UTF_8);
    }

    public <T> T readPayload(final byte[] json, final Class<T> type) {
        return jsonb.fromJson(new String(json, StandardCharsets.UTF_8), type);
    }

    @Override
    public void close() {
        try {
            jsonb.close();
        } catch (final Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
