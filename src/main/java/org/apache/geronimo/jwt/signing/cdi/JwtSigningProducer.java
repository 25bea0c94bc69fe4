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
package org.apache.geronimo.jwt.signing.cdi;

import static java.util.stream.Collectors.toSet;

import java.util.Set;
import java.util.stream.Stream;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.enterprise.context.ApplicationScoped;
import javax.enterprise.inject.Produces;

import org.apache.geronimo.jwt.signing.codec.JwtJsonCodec;
import org.apache.geronimo.jwt.signing.config.JwtSigningConfig;
import org.apache.geronimo.jwt.signing.jwt.JwtEncoder;
import org.apache.geronimo.jwt.signing.jwt.JwtParser;
import org.apache.geronimo.jwt.signing.signer.SignerRegistry;
import org.apache.geronimo.jwt.signing.signer.SignerRegistryLoader;

/**
 * Exposes the registry, the encoder and the parser built once from {@link JwtSigningConfig}.
 */
@ApplicationScoped
public class JwtSigningProducer {
    private JwtSigningConfig config;
    private JwtJsonCodec codec;
    private SignerRegistry registry;
    private JwtEncoder encoder;
    private JwtParser parser;

    @PostConstruct
    void init() {
        init(JwtSigningConfig.create());
    }

    void init(final JwtSigningConfig config) {
        this.config = config;
        codec = new JwtJsonCodec();
        registry = new SignerRegistryLoader(config).load();
        encoder = new JwtEncoder(codec, config.read("jwt.header.typ.default", "JWT"));

        final Set<String> issuers = Stream.of(config.read("issuers", "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(toSet());
        parser = JwtParser.builder(codec)
                .acceptUnsigned(Boolean.parseBoolean(config.read("unsigned.accepted", "false")))
                .expectedAudience(config.read("audience", null))
                .acceptedIssuers(issuers)
                .build();
    }

    @PreDestroy
    void destroy() {
        if (codec != null) {
            codec.close();
        }
    }

    @Produces
    public JwtSigningConfig config() {
        return config;
    }

    @Produces
    public SignerRegistry signerRegistry() {
        return registry;
    }

    @Produces
    public JwtEncoder encoder() {
        return encoder;
    }

    @Produces
    public JwtParser parser() {
        return parser;
    }
}
