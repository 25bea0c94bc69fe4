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

import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * A point in time claim, serialized as a NumericDate (whole seconds since the epoch).
 * The value is truncated to the second when the claim is created so it survives
 * a serialization unchanged.
 */
public abstract class DateClaim {
    private final Instant value;

    protected DateClaim(final Instant value) {
        this.value = Instant.ofEpochSecond(requireNonNull(value, "value can't be null").getEpochSecond());
    }

    public Instant getValue() {
        return value;
    }

    public long getEpochSecond() {
        return value.getEpochSecond();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(DateClaim.class.cast(o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + value.getEpochSecond() + "]";
    }
}
