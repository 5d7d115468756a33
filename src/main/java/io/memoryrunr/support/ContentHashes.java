package io.memoryrunr.support;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 content hashes used by watermarks and change detection.
 */
public final class ContentHashes {

    private ContentHashes() {
    }

    /** Hashes a record by its canonical string form. Records with map fields must use {@link #ofMap}. */
    public static String of(Object record) {
        return DigestUtils.sha256Hex(String.valueOf(record));
    }

    /** Hashes a map with its keys in sorted order so that iteration order never changes the hash. */
    public static String ofMap(Map<String, ?> values) {
        return DigestUtils.sha256Hex(new TreeMap<>(values).toString());
    }

    /** Hashes a batch from the hashes of its members, in iteration order. */
    public static String ofBatch(Collection<String> memberHashes) {
        return DigestUtils.sha256Hex(String.join(",", memberHashes));
    }
}
