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
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Location of the TPXO 9 global tidal elevation dataset. Only the path is
 * resolved here; reading the file and interpolating it onto model boundaries
 * belongs to the dataset loader.
 */
public final class TpxoDataset {
    private static final Logger log = LoggerFactory.getLogger(TpxoDataset.class);

    /** File name of the TPXO 9 elevation harmonics. */
    public static final String FILE_NAME = "h_tpxo9.v1.nc";

    private TpxoDataset() {}

    /**
     * Path of {@link #FILE_NAME} inside the provider's cache directory. The
     * filesystem is not touched.
     *
     * @throws IllegalStateException if the provider returns no directory
     */
    public static Path locate(CacheDirectoryProvider provider) {
        Objects.requireNonNull(provider, "provider");
        Path dir = provider.cacheDirectory();
        if (dir == null) {
            log.error("Cache directory provider returned no directory");
            throw new IllegalStateException("Cache directory provider returned no directory");
        }
        Path path = dir.resolve(FILE_NAME);
        log.debug("TPXO dataset path resolved to {}", path);
        return path;
    }

    /**
     * The constituents the dataset carries, which is the selectable default
     * vocabulary of {@link ConstituentCatalog}.
     */
    public static List<String> constituents() {
        return ConstituentCatalog.DEFAULT_CONSTITUENTS;
    }
}
