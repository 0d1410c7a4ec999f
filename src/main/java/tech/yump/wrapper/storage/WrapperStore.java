package tech.yump.wrapper.storage;

import java.util.Optional;

/**
 * Contract for the key-value backend that holds wrapper records.
 * Implementations must make {@link #deleteAndGet(String)} atomic with respect to every
 * other call for the same id, and must enforce expiry natively.
 */
public interface WrapperStore {

  /**
   * Writes a new record, refusing to overwrite a live record with the same id.
   *
   * @param record The record to store. Must not be null.
   * @throws DuplicateWrapperIdException If a record with the same id already exists.
   * @throws StorageException If the backend call fails.
   */
  void putIfAbsent(WrapperRecord record) throws StorageException;

  /**
   * Removes the record stored under {@code id} and returns what was removed, in one
   * operation. Of several concurrent callers for the same id at most one receives a record.
   *
   * @param id The record id. Must not be null.
   * @return The removed record, or Optional.empty() if nothing was stored under the id.
   * @throws StorageException If the backend call fails or returns an unreadable item.
   */
  Optional<WrapperRecord> deleteAndGet(String id) throws StorageException;
}
