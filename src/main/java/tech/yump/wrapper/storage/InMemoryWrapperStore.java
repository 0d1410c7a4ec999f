package tech.yump.wrapper.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link WrapperStore} for development and tests.
 * <p>
 * Backed by a Caffeine cache whose per-entry expiry is the record's own {@code expireAt},
 * measured on the injected {@link Clock}. Expired entries are invisible to
 * {@link #putIfAbsent(WrapperRecord)} and {@link #deleteAndGet(String)} and are evicted
 * during the cache's regular maintenance.
 */
@Slf4j
public class InMemoryWrapperStore implements WrapperStore {

  private final Cache<String, WrapperRecord> records;
  private final Clock clock;

  public InMemoryWrapperStore(Clock clock) {
    this.clock = clock;
    this.records =
        Caffeine.newBuilder()
            .expireAfter(new RecordExpiry())
            .ticker(clockTicker(clock))
            .executor(Runnable::run)
            .build();
  }

  @Override
  public void putIfAbsent(WrapperRecord record) throws StorageException {
    Instant now = clock.instant();
    WrapperRecord stored = records.asMap().compute(record.id(), (id, existing) ->
            existing == null || existing.isExpiredAt(now) ? record : existing);
    if (stored != record) {
      throw new DuplicateWrapperIdException(record.id());
    }
  }

  @Override
  public Optional<WrapperRecord> deleteAndGet(String id) throws StorageException {
    // asMap().remove is atomic: only one caller gets the mapping back.
    WrapperRecord removed = records.asMap().remove(id);
    if (removed == null || removed.isExpiredAt(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(removed);
  }

  /**
   * Runs pending maintenance, evicting every entry whose expiry has passed.
   */
  public void cleanUp() {
    records.cleanUp();
    log.debug("Memory store holds {} wrapper record(s) after clean-up", records.estimatedSize());
  }

  public long size() {
    return records.estimatedSize();
  }

  static Ticker clockTicker(Clock clock) {
    return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }

  /**
   * Expires each entry at its record's {@code expireAt} second; reads do not extend it.
   */
  private static final class RecordExpiry implements Expiry<String, WrapperRecord> {

    @Override
    public long expireAfterCreate(String id, WrapperRecord record, long currentTime) {
      return nanosUntilExpiry(record, currentTime);
    }

    @Override
    public long expireAfterUpdate(String id, WrapperRecord record, long currentTime, long currentDuration) {
      return nanosUntilExpiry(record, currentTime);
    }

    @Override
    public long expireAfterRead(String id, WrapperRecord record, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private static long nanosUntilExpiry(WrapperRecord record, long currentTime) {
      long expireAtNanos = TimeUnit.SECONDS.toNanos(record.expireAt());
      return Math.max(0, expireAtNanos - currentTime);
    }
  }
}
