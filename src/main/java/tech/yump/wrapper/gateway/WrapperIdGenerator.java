package tech.yump.wrapper.gateway;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Produces wrapper ids: 128 bits from {@link SecureRandom} as 32 lowercase hex characters.
 */
@Component
public class WrapperIdGenerator {

    public static final int ID_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    public String nextId() {
        byte[] bytes = new byte[ID_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
