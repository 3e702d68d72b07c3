/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb;

import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin registering the settings of the tag value inverted index.
 */
public class IndexDBPlugin extends Plugin {

    /**
     * Whether records with an undecodable posting list are logged and skipped while building a tag index.
     * When disabled the build fails on the first such record.
     */
    public static final Setting<Boolean> TAG_INDEX_IGNORE_MALFORMED = Setting.boolSetting(
        "tsdb_engine.tag_index.ignore_malformed",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Maximum number of distinct tag names a single tag index may hold.
     */
    public static final Setting<Integer> TAG_INDEX_MAX_TAGS = Setting.intSetting(
        "tsdb_engine.tag_index.max_tags",
        10000, // default
        1, // min
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Default constructor
     */
    public IndexDBPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(TAG_INDEX_IGNORE_MALFORMED, TAG_INDEX_MAX_TAGS);
    }
}
