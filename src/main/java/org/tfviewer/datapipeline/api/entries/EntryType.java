package org.tfviewer.datapipeline.api.entries;

/**
 * Discriminator consumers use to pick a display and decoding strategy for an entry.
 */
public enum EntryType {
    IMAGE("image"),
    SCALAR("scalar");

    private final String name;

    EntryType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
