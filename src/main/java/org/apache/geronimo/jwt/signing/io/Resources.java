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
package org.apache.geronimo.jwt.signing.io;

import static java.util.stream.Collectors.joining;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

public final class Resources {
    private Resources() {
        // no-op
    }

    /**
     * Resolves a configured value: an existing file, then a classpath resource,
     * otherwise the value itself is the content.
     *
     * @param value file path, resource name or inline content.
     * @return the content.
     */
    public static String read(final String value) {
        final File file = new File(value);
        if (file.isFile()) {
            try {
                return String.join("\n", Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        final ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (final InputStream stream = loader == null ? null : loader.getResourceAsStream(value)) {
            if (stream != null) {
                return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)).lines().collect(joining("\n"));
            }
        } catch (final IOException e) {
            throw new IllegalArgumentException(e);
        }
        return value;
    }

    /**
     * @param path file path.
     * @return the exact bytes of the file.
     */
    public static byte[] readFile(final String path) {
        try {
            return Files.readAllBytes(Paths.get(path));
        } catch (final IOException | InvalidPathException e) {
            throw new IllegalArgumentException("Can't read file '" + path + "'", e);
        }
    }

    /**
     * @param name classpath resource name.
     * @return the exact bytes of the resource.
     */
    public static byte[] readResource(final String name) {
        final ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (final InputStream stream = loader == null ? null : loader.getResourceAsStream(name)) {
            if (stream == null) {
                throw new IllegalArgumentException("No resource '" + name + "'");
            }
            return stream.readAllBytes();
        } catch (final IOException e) {
            throw new IllegalArgumentException("Can't read resource '" + name + "'", e);
        }
    }
}
