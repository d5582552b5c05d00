package com.parametric.oracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One consensus round for one (parameter, location, window) request.
 */
public class DataAttestation {

    private String attestationId;
    private DataRequest dataRequest;
    private List<String> qualifiedOracles = new ArrayList<>();
    private List<OracleSignature> oracleSignatures = new ArrayList<>();
    private AttestationStatus status;
    private ConsensusResult consensusResult;
    private AggregatedData aggregatedData;
    private Instant requestedAt;
    private Instant expirationDate;
    private Instant finalizedAt;

    /** Adds the signature, replacing an earlier one from the same oracle in place. */
    public boolean putSignature(OracleSignature signature) {
        for (int i = 0; i < oracleSignatures.size(); i++) {
            if (oracleSignatures.get(i).oracleId().equals(signature.oracleId())) {
                oracleSignatures.set(i, signature);
                return false;
            }
        }
        oracleSignatures.add(signature);
        return true;
    }

    public String getAttestationId() {
        return attestationId;
    }

    public void setAttestationId(String attestationId) {
        this.attestationId = attestationId;
    }

    public DataRequest getDataRequest() {
        return dataRequest;
    }

    public void setDataRequest(DataRequest dataRequest) {
        this.dataRequest = dataRequest;
    }

    public List<String> getQualifiedOracles() {
        return qualifiedOracles;
    }

    public void setQualifiedOracles(List<String> qualifiedOracles) {
        this.qualifiedOracles = qualifiedOracles == null ? new ArrayList<>() : new ArrayList<>(qualifiedOracles);
    }

    public List<OracleSignature> getOracleSignatures() {
        return oracleSignatures;
    }

    public void setOracleSignatures(List<OracleSignature> oracleSignatures) {
        this.oracleSignatures = oracleSignatures == null ? new ArrayList<>() : new ArrayList<>(oracleSignatures);
    }

    public AttestationStatus getStatus() {
        return status;
    }

    public void setStatus(AttestationStatus status) {
        this.status = status;
    }

    public ConsensusResult getConsensusResult() {
        return consensusResult;
    }

    public void setConsensusResult(ConsensusResult consensusResult) {
        this.consensusResult = consensusResult;
    }

    public AggregatedData getAggregatedData() {
        return aggregatedData;
    }

    public void setAggregatedData(AggregatedData aggregatedData) {
        this.aggregatedData = aggregatedData;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    public Instant getExpirationDate() {
        return expirationDate;
    }

    public void setExpirationDate(Instant expirationDate) {
        this.expirationDate = expirationDate;
    }

    public Instant getFinalizedAt() {
        return finalizedAt;
    }

    public void setFinalizedAt(Instant finalizedAt) {
        this.finalizedAt = finalizedAt;
    }
}
