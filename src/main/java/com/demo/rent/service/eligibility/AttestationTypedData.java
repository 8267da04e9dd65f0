package com.demo.rent.service.eligibility;

import com.demo.rent.service.HashUtil;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * EIP-712 encoding of {@link Attestation} under the "ZKPRent-TLS" v1 domain,
 * byte-compatible with {@code signTypedData} in ethers.
 */
public final class AttestationTypedData {

    public static final String DOMAIN_NAME = "ZKPRent-TLS";
    public static final String DOMAIN_VERSION = "1";

    static final byte[] DOMAIN_TYPEHASH = HashUtil.keccakUtf8(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    static final byte[] ATTESTATION_TYPEHASH = HashUtil.keccakUtf8(
            "Attestation(address wallet,uint256 policyId,uint64 expiry,bytes32 nullifier,uint8 passBitmask)");

    private final long chainId;
    private final String verifyingContract;
    private final byte[] domainSeparator;

    public AttestationTypedData(long chainId, String verifyingContract) {
        this.chainId = chainId;
        this.verifyingContract = HashUtil.normalizeAddress(verifyingContract);
        this.domainSeparator = HashUtil.keccak(Numeric.hexStringToByteArray(HashUtil.abiEncode(
                new Bytes32(DOMAIN_TYPEHASH),
                new Bytes32(HashUtil.keccakUtf8(DOMAIN_NAME)),
                new Bytes32(HashUtil.keccakUtf8(DOMAIN_VERSION)),
                new Uint256(BigInteger.valueOf(chainId)),
                new Address(this.verifyingContract))));
    }

    public byte[] structHash(Attestation a) {
        return HashUtil.keccak(Numeric.hexStringToByteArray(HashUtil.abiEncode(
                new Bytes32(ATTESTATION_TYPEHASH),
                new Address(a.wallet()),
                new Uint256(BigInteger.valueOf(a.policyId())),
                new Uint64(BigInteger.valueOf(a.expiry())),
                new Bytes32(Numeric.hexStringToByteArray(a.nullifier())),
                new Uint8(BigInteger.valueOf(a.passBitmask())))));
    }

    /** keccak256(0x19 0x01 || domainSeparator || structHash) */
    public byte[] digest(Attestation a) {
        byte[] struct = structHash(a);
        byte[] buf = new byte[2 + 32 + 32];
        buf[0] = 0x19;
        buf[1] = 0x01;
        System.arraycopy(domainSeparator, 0, buf, 2, 32);
        System.arraycopy(struct, 0, buf, 34, 32);
        return HashUtil.keccak(buf);
    }

    public String domainSeparatorHex() {
        return Numeric.toHexString(domainSeparator);
    }

    public long getChainId() {
        return chainId;
    }

    public String getVerifyingContract() {
        return verifyingContract;
    }
}
