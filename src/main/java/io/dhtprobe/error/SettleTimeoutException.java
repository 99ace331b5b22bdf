package io.dhtprobe.error;

public class SettleTimeoutException extends ProbeException {
    private final String recordKey;
    private final int attempts;

    public SettleTimeoutException(String recordKey, int attempts, long offlineSubkeys) {
        super("record " + recordKey + " not settled after " + attempts
                + " polls, offline_subkeys=" + offlineSubkeys);
        this.recordKey = recordKey;
        this.attempts = attempts;
    }

    public SettleTimeoutException(String recordKey, int attempts, InterruptedException cause) {
        super("settle wait interrupted for record " + recordKey + " after " + attempts + " polls", cause);
        this.recordKey = recordKey;
        this.attempts = attempts;
    }

    public String recordKey() {
        return recordKey;
    }

    public int attempts() {
        return attempts;
    }
}
