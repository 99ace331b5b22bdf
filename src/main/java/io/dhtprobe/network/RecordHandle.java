package io.dhtprobe.network;

/**
 * An open record. {@code writer} carries the owner keypair for records created
 * in this session and is null for records opened read-only.
 */
public record RecordHandle(String recordKey, String writer) {
    public RecordHandle {
        if (recordKey == null || recordKey.isBlank()) {
            throw new IllegalArgumentException("recordKey must not be blank");
        }
    }

    public static RecordHandle readOnly(String recordKey) {
        return new RecordHandle(recordKey, null);
    }
}
