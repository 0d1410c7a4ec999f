package tech.yump.wrapper.gateway;

/**
 * Result of a successful create: the new id and its expiry in epoch seconds.
 */
public record CreatedWrapper(String id, long expireAt) {}
