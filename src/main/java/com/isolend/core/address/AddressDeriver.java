package com.isolend.core.address;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

/**
 * Pure, deterministic identity derivation with keccak-256.
 *
 * <p>Market ids hash {@code (owner, asset, rateModelKey)} so that a second market with the same
 * triple collides with the first. Account and superpool addresses follow the {@code CREATE2}
 * rule {@code keccak(0xff ++ deployer ++ salt ++ initCodeHash)[12:]}, which lets a caller compute
 * an address before the object exists and lets the deployer check a claimed address.
 */
public final class AddressDeriver {

    private static final byte CREATE2_PREFIX = (byte) 0xff;

    static final byte[] POSITION_INIT_CODE_HASH = Hash.sha3("isolend.Position".getBytes(StandardCharsets.UTF_8));
    static final byte[] SUPERPOOL_INIT_CODE_HASH = Hash.sha3("isolend.SuperPool".getBytes(StandardCharsets.UTF_8));

    private AddressDeriver() {}

    /** Market id: {@code keccak(owner ++ asset ++ keccak(rateModelKey))} as a 0x-prefixed 32-byte hex. */
    public static String poolId(String owner, String asset, String rateModelKey) {
        byte[] packed = concat(
                addressBytes(owner), addressBytes(asset), Hash.sha3(rateModelKey.getBytes(StandardCharsets.UTF_8)));
        return Numeric.toHexString(Hash.sha3(packed));
    }

    /** Address the position manager deploys a position to for {@code (owner, salt)}. */
    public static String positionAddress(String positionManager, String owner, String salt) {
        byte[] userSalt = Hash.sha3(concat(addressBytes(owner), saltBytes(salt)));
        return create2(positionManager, userSalt, POSITION_INIT_CODE_HASH);
    }

    /** Address the superpool factory deploys a vault to. */
    public static String superPoolAddress(String factory, String owner, String asset, String name) {
        byte[] salt = Hash.sha3(
                concat(addressBytes(owner), addressBytes(asset), name.getBytes(StandardCharsets.UTF_8)));
        return create2(factory, salt, SUPERPOOL_INIT_CODE_HASH);
    }

    static String create2(String deployer, byte[] salt32, byte[] initCodeHash) {
        byte[] packed = concat(new byte[] {CREATE2_PREFIX}, addressBytes(deployer), salt32, initCodeHash);
        byte[] hash = Hash.sha3(packed);
        return Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }

    /** Left-pads a hex salt to 32 bytes; longer salts are rejected. */
    static byte[] saltBytes(String salt) {
        BigInteger value = Numeric.toBigInt(salt);
        if (value.bitLength() > 256) {
            throw new IllegalArgumentException("salt longer than 32 bytes: " + salt);
        }
        return Numeric.toBytesPadded(value, 32);
    }

    private static byte[] addressBytes(String address) {
        return Numeric.hexStringToByteArray(AddressUtil.normalize(address));
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
