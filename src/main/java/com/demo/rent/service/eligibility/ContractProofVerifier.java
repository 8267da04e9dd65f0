package com.demo.rent.service.eligibility;

import com.demo.rent.service.HashUtil;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.VerificationException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Delegates to a deployed verifier contract exposing
 * {@code verify(bytes proof, uint256[] publicInputs) returns (bool)}.
 */
@Slf4j
public class ContractProofVerifier implements ProofVerifier {

    private final Web3j web3j;
    private final String contractAddress;

    public ContractProofVerifier(Web3j web3j, String contractAddress) {
        if (!HashUtil.isAddress(contractAddress) || HashUtil.isZeroAddress(contractAddress)) {
            throw new IllegalArgumentException("gate.proof.contract-address must be a deployed verifier, got '"
                    + contractAddress + "'");
        }
        this.web3j = web3j;
        this.contractAddress = HashUtil.normalizeAddress(contractAddress);
    }

    @Override
    public boolean verify(byte[] proof, List<BigInteger> publicInputs) {
        for (BigInteger v : publicInputs) {
            if (!HashUtil.isUint256(v)) return false;
        }
        Function fn = verifyFunction(proof, publicInputs);
        String data = FunctionEncoder.encode(fn);
        EthCall resp;
        try {
            resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contractAddress, data),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new VerificationException(ErrorCode.VERIFIER_UNAVAILABLE,
                    "Proof verifier at " + contractAddress + " unreachable: " + e.getMessage(), e);
        }
        if (resp.hasError() || resp.isReverted()) {
            // verifier contracts revert on malformed proofs
            log.info("Verifier call reverted: {}", resp.hasError() ? resp.getError().getMessage() : resp.getRevertReason());
            return false;
        }
        @SuppressWarnings("rawtypes")
        List<Type> out = FunctionReturnDecoder.decode(resp.getValue(), fn.getOutputParameters());
        return !out.isEmpty() && Boolean.TRUE.equals(out.get(0).getValue());
    }

    static Function verifyFunction(byte[] proof, List<BigInteger> publicInputs) {
        List<Uint256> inputs = publicInputs.stream().map(Uint256::new).toList();
        return new Function(
                "verify",
                Arrays.asList(new DynamicBytes(proof), new DynamicArray<>(Uint256.class, inputs)),
                List.of(new TypeReference<Bool>() {}));
    }

    @Override
    public String name() {
        return "contract:" + contractAddress;
    }
}
