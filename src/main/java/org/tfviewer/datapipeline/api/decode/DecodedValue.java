package org.tfviewer.datapipeline.api.decode;

import org.tfviewer.datapipeline.api.entries.EntryType;

import java.util.Objects;

/**
 * One value found inside a decoded record.
 * <p>
 * Scalar values carry their number directly. Heavy values (images, masks) are not
 * materialized: they carry a {@code payloadIndex} that, together with the record's offset,
 * lets an entry find the payload again when it is actually needed.
 *
 * @param tag          The raw tag string as written by the producer, e.g. {@code "loss/train"}.
 * @param type         What kind of entry this value becomes.
 * @param scalarValue  The value for {@link EntryType#SCALAR}, otherwise {@code 0}.
 * @param payloadIndex Sub-index of the payload inside the record for {@link EntryType#IMAGE}, otherwise {@code -1}.
 * @param description  Extra human-readable information about the value, possibly empty.
 */
public record DecodedValue(String tag, EntryType type, double scalarValue, int payloadIndex, String description) {

    public DecodedValue {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
    }

    public static DecodedValue scalar(String tag, double value) {
        return new DecodedValue(tag, EntryType.SCALAR, value, -1, "");
    }

    public static DecodedValue payload(String tag, int payloadIndex, String description) {
        return new DecodedValue(tag, EntryType.IMAGE, 0, payloadIndex, description);
    }
}
