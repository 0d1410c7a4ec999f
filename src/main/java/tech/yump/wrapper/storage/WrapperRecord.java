package tech.yump.wrapper.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored secret: the server-generated id, the caller's value, and the absolute expiry
 * in epoch seconds.
 */
public record WrapperRecord(String id, String value, long expireAt) {

    public WrapperRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() >= expireAt;
    }

    // Keep the secret out of logs and exception messages.
    @Override
    public String toString() {
        return "WrapperRecord[id=" + id + ", value=******, expireAt=" + expireAt + ']';
    }
}
