package tech.yump.wrapper.storage;

/**
 * Thrown by {@link WrapperStore#putIfAbsent(WrapperRecord)} when the id is already taken.
 */
public class DuplicateWrapperIdException extends StorageException {

  private final String wrapperId;

  public DuplicateWrapperIdException(String wrapperId) {
    super("A wrapper record already exists for the generated id");
    this.wrapperId = wrapperId;
  }

  public DuplicateWrapperIdException(String wrapperId, Throwable cause) {
    super("A wrapper record already exists for the generated id", cause);
    this.wrapperId = wrapperId;
  }

  public String getWrapperId() {
    return wrapperId;
  }
}
