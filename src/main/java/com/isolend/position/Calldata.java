package com.isolend.position;

import java.util.Arrays;
import java.util.List;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

/** ABI helpers for EXEC calldata: 4-byte selector followed by the encoded arguments. */
public final class Calldata {

    public static final int SELECTOR_LENGTH = 4;

    private Calldata() {}

    public static String encode(Function function) {
        return FunctionEncoder.encode(function);
    }

    /** Lower-case {@code 0x}-prefixed selector, e.g. {@code 0xa9059cbb}. */
    public static String selectorOf(byte[] calldata) {
        if (calldata.length < SELECTOR_LENGTH) {
            throw new IllegalArgumentException("calldata shorter than a selector: " + calldata.length + " bytes");
        }
        return Numeric.toHexString(Arrays.copyOf(calldata, SELECTOR_LENGTH));
    }

    public static String selectorOf(String signature) {
        return Hash.sha3String(signature).substring(0, 2 + SELECTOR_LENGTH * 2);
    }

    /** Decodes the arguments after the selector against {@code types}. */
    @SuppressWarnings("rawtypes")
    public static List<Type> decodeArguments(byte[] calldata, List<TypeReference<Type>> types) {
        byte[] arguments = Arrays.copyOfRange(calldata, SELECTOR_LENGTH, calldata.length);
        return FunctionReturnDecoder.decode(Numeric.toHexString(arguments), types);
    }
}
