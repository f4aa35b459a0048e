package org.smileyface.linkarchive.link;

import org.smileyface.linkarchive.model.LinkRecord;

import java.util.List;

/**
 * Supplies the curated link list of a run, in list order.
 */
@FunctionalInterface
public interface LinkSource {

    /**
     * @throws org.smileyface.linkarchive.error.ConfigurationException if the list cannot be read
     */
    List<LinkRecord> load();
}
