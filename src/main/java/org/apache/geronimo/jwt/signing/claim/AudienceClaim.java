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

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.geronimo.jwt.signing.JwtError;
import org.apache.geronimo.jwt.signing.JwtException;

/**
 * {@code aud}: the recipients the token is intended for.
 */
public class AudienceClaim {
    private final Set<String> value;

    public AudienceClaim(final String... value) {
        this(Arrays.asList(value));
    }

    public AudienceClaim(final Collection<String> value) {
        if (requireNonNull(value, "value can't be null").isEmpty()) {
            throw new IllegalArgumentException("audience can't be empty");
        }
        this.value = unmodifiableSet(new LinkedHashSet<>(value));
    }

    public Set<String> getValue() {
        return value;
    }

    public void verify(final String expected) {
        if (!value.contains(expected)) {
            throw new JwtException(JwtError.INVALID_AUDIENCE, "Invalid audience");
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(AudienceClaim.class.cast(o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AudienceClaim" + value;
    }
}
