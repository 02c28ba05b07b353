package com.isolend.core.address;

import java.util.regex.Pattern;

/**
 * Validators/normalizers for 20-byte account addresses.
 */
public final class AddressUtil {

    /** Burn address; shares minted here can never be redeemed. */
    public static final String DEAD_ADDRESS = "0x000000000000000000000000000000000000dead";

    private static final Pattern HEX_ADDRESS = Pattern.compile("0x[0-9a-fA-F]{40}");

    private AddressUtil() {}

    public static String normalize(String addr) {
        if (addr == null) {
            throw new IllegalArgumentException("address is null");
        }
        if (!HEX_ADDRESS.matcher(addr).matches()) {
            throw new IllegalArgumentException("invalid address (need 0x + 40 hex chars): " + addr);
        }
        return addr.toLowerCase();
    }

    public static boolean isAddress(String addr) {
        return addr != null && HEX_ADDRESS.matcher(addr).matches();
    }
}
