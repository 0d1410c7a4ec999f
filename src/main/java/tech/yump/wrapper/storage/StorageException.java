package tech.yump.wrapper.storage;

/**
 * Runtime exception for failures of the backend store: unavailability, rejected calls,
 * or items that do not have the expected shape.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
