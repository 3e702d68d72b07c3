/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.opensearch.common.settings.Settings;
import org.opensearch.indexdb.IndexDBPlugin;

/**
 * Configuration of a {@link TagIndexBuilder}.
 *
 * @param ignoreMalformed log and skip records whose posting list cannot be decoded instead of failing the build
 * @param maxTags maximum number of distinct tag names per index
 */
public record TagIndexConfig(boolean ignoreMalformed, int maxTags) {

    public TagIndexConfig {
        if (maxTags < 1) {
            throw new IllegalArgumentException("maxTags must be positive, got " + maxTags);
        }
    }

    /**
     * Create configuration from settings.
     *
     * @param settings the node settings
     */
    public static TagIndexConfig fromSettings(Settings settings) {
        return new TagIndexConfig(IndexDBPlugin.TAG_INDEX_IGNORE_MALFORMED.get(settings), IndexDBPlugin.TAG_INDEX_MAX_TAGS.get(settings));
    }

    public static TagIndexConfig defaultConfig() {
        return fromSettings(Settings.EMPTY);
    }

    /**
     * Configuration that fails the build on the first malformed record.
     */
    public static TagIndexConfig strict() {
        return new TagIndexConfig(false, IndexDBPlugin.TAG_INDEX_MAX_TAGS.get(Settings.EMPTY));
    }
}
