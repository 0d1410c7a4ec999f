package tech.yump.wrapper.validation;

/**
 * A create request that passed validation.
 */
public record CreateCommand(String value, long ttlSeconds) {

    @Override
    public String toString() {
        return "CreateCommand[value=******, ttlSeconds=" + ttlSeconds + ']';
    }
}
