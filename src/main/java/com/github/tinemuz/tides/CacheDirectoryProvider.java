/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.tides;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Supplies the directory where harmonic datasets are cached. Used by dataset
 * loaders such as {@link TpxoDataset}; the astronomical computation never
 * needs it.
 */
@FunctionalInterface
public interface CacheDirectoryProvider {

    /** System property naming the cache directory. */
    String PROPERTY = "tides.cache.dir";

    /** Environment variable naming the cache directory. */
    String ENVIRONMENT_VARIABLE = "TIDES_CACHE_DIR";

    Path cacheDirectory();

    /** A provider that always returns {@code directory}. */
    static CacheDirectoryProvider of(Path directory) {
        return () -> directory;
    }

    /**
     * Resolve from {@value #PROPERTY}, then {@value #ENVIRONMENT_VARIABLE},
     * then {@code ${user.home}/.cache/tides}. Looked up on every call.
     */
    static CacheDirectoryProvider fromSystemProperties() {
        return () -> resolve(System.getProperties(), System.getenv());
    }

    /** Resolution rule of {@link #fromSystemProperties()} over explicit sources. */
    static Path resolve(Properties properties, Map<String, String> environment) {
        String configured = properties.getProperty(PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = environment.get(ENVIRONMENT_VARIABLE);
        }
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(properties.getProperty("user.home", "."), ".cache", "tides");
    }
}
