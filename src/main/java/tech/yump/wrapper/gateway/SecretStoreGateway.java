package tech.yump.wrapper.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.wrapper.storage.DuplicateWrapperIdException;
import tech.yump.wrapper.storage.StorageException;
import tech.yump.wrapper.storage.WrapperRecord;
import tech.yump.wrapper.storage.WrapperStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * The only component touching persistent state. Creates expiring records and hands each
 * record's value out at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretStoreGateway {

    static final int MAX_CREATE_ATTEMPTS = 3;

    private final WrapperStore wrapperStore;
    private final WrapperIdGenerator idGenerator;
    private final Clock clock;

    /**
     * Stores {@code value} under a fresh id that expires {@code ttlSeconds} from now.
     * The write is conditional on the id being unused; on the (practically impossible)
     * collision a new id is drawn, up to {@value #MAX_CREATE_ATTEMPTS} times.
     *
     * @throws StorageException if the store fails or no free id was found
     */
    public CreatedWrapper create(String value, long ttlSeconds) throws StorageException {
        long expireAt = Math.addExact(clock.instant().getEpochSecond(), ttlSeconds);

        DuplicateWrapperIdException lastCollision = null;
        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            String id = idGenerator.nextId();
            try {
                wrapperStore.putIfAbsent(new WrapperRecord(id, value, expireAt));
                log.info("Created wrapper expiring at {}", expireAt);
                return new CreatedWrapper(id, expireAt);
            } catch (DuplicateWrapperIdException e) {
                log.warn("Wrapper id collision on attempt {}/{}", attempt, MAX_CREATE_ATTEMPTS);
                lastCollision = e;
            }
        }
        throw new StorageException("Could not allocate an unused wrapper id after "
                + MAX_CREATE_ATTEMPTS + " attempts", lastCollision);
    }

    /**
     * Atomically removes the record under {@code id} and returns it. Empty when the id was
     * never created, was already retrieved, or has expired; callers cannot tell these apart.
     *
     * @throws StorageException if the store fails
     */
    public Optional<WrapperRecord> retrieveAndDelete(String id) throws StorageException {
        Optional<WrapperRecord> removed = wrapperStore.deleteAndGet(id);
        if (removed.isEmpty()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        WrapperRecord record = removed.get();
        if (record.isExpiredAt(now)) {
            // Native TTL reaping lags; the item is gone now either way.
            log.debug("Wrapper expired at {} but was not yet reaped", record.expireAt());
            return Optional.empty();
        }
        return removed;
    }
}
