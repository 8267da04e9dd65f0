package com.demo.rent.service;

import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ValidationException;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.crypto.Hash;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Hashing and identifier helpers shared by the policy store, both gates and
 * the escrow. Everything here is reproducible with any Ethereum ABI encoder.
 */
public final class HashUtil {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    static final BigInteger LIMB_BOUND = BigInteger.ONE.shiftLeft(128);
    static final BigInteger UINT256_BOUND = BigInteger.ONE.shiftLeft(256);

    private HashUtil() {}

    /**
     * keccak256(abi.encode(uint256 minAge, uint256 incomeMultiplier, uint256 rentAmount,
     * bool requireCleanRecord, uint64 deadline, address owner)).
     */
    public static String policyHash(int minAge, int incomeMultiplier, BigInteger rentAmount,
                                    boolean requireCleanRecord, long deadline, String owner) {
        String encoded = abiEncode(
                new Uint256(BigInteger.valueOf(minAge)),
                new Uint256(BigInteger.valueOf(incomeMultiplier)),
                new Uint256(rentAmount),
                new Bool(requireCleanRecord),
                new Uint64(BigInteger.valueOf(deadline)),
                new Address(normalizeAddress(owner)));
        return Hash.sha3(encoded);
    }

    /** Head encoding of static ABI values, hex without prefix. */
    public static String abiEncode(Type<?>... values) {
        StringBuilder sb = new StringBuilder(values.length * 64);
        for (Type<?> v : values) sb.append(TypeEncoder.encode(v));
        return sb.toString();
    }

    public static byte[] keccak(byte[] input) {
        return Hash.sha3(input);
    }

    public static byte[] keccakUtf8(String s) {
        return Hash.sha3(s.getBytes(StandardCharsets.UTF_8));
    }

    /** (hi << 128) | lo as a bytes32 hex string. Both limbs must fit in 128 bits. */
    public static String nullifierFromLimbs(BigInteger hi, BigInteger lo) {
        if (!isLimb(hi) || !isLimb(lo)) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH,
                    "Nullifier limbs must be in [0, 2^128)");
        }
        return toBytes32Hex(hi.shiftLeft(128).or(lo));
    }

    static boolean isLimb(BigInteger v) {
        return v != null && v.signum() >= 0 && v.compareTo(LIMB_BOUND) < 0;
    }

    public static String toBytes32Hex(BigInteger v) {
        return Numeric.toHexStringWithPrefixZeroPadded(v, 64);
    }

    /** Lower-cases and validates a 0x-prefixed 32-byte hex value. */
    public static String normalizeBytes32(String hex) {
        if (hex == null) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "bytes32 value required");
        }
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() != 64 || !clean.matches("[0-9a-fA-F]+")) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "Not a bytes32 value: " + hex);
        }
        return "0x" + clean.toLowerCase(Locale.ROOT);
    }

    /** Lower-case 0x-prefixed form; rejects anything that is not a 20-byte address. */
    public static String normalizeAddress(String address) {
        if (address == null || !WalletUtils.isValidAddress(address.trim())) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + address);
        }
        return Numeric.prependHexPrefix(Numeric.cleanHexPrefix(address.trim()).toLowerCase(Locale.ROOT));
    }

    public static boolean isAddress(String address) {
        return address != null && WalletUtils.isValidAddress(address.trim());
    }

    /** Decodes 0x-prefixed (or bare) hex; odd length or non-hex characters are rejected. */
    public static byte[] hexToBytes(String hex) {
        String clean = hex == null ? "" : Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() % 2 != 0 || !clean.matches("[0-9a-fA-F]*")) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "Not a hex byte string: " + hex);
        }
        return Numeric.hexStringToByteArray(clean);
    }

    public static boolean isZeroAddress(String address) {
        return ZERO_ADDRESS.equals(normalizeAddress(address));
    }

    public static boolean isUint256(BigInteger v) {
        return v != null && v.signum() >= 0 && v.compareTo(UINT256_BOUND) < 0;
    }
}
