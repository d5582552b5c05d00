package com.parametric.oracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class Oracle {

    private String oracleId;
    private String name;
    private String operator;
    private String publicKey;
    private List<String> supportedParameters = new ArrayList<>();
    private GeoLocation location;
    private OracleStatus status;
    private OracleReputation reputation = new OracleReputation();
    private Instant registeredAt;
    private Instant approvedAt;
    private Instant lastActiveAt;

    public boolean supports(String parameter) {
        return supportedParameters.contains(parameter);
    }

    public String getOracleId() {
        return oracleId;
    }

    public void setOracleId(String oracleId) {
        this.oracleId = oracleId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public List<String> getSupportedParameters() {
        return supportedParameters;
    }

    public void setSupportedParameters(List<String> supportedParameters) {
        this.supportedParameters = supportedParameters == null ? new ArrayList<>() : new ArrayList<>(supportedParameters);
    }

    public GeoLocation getLocation() {
        return location;
    }

    public void setLocation(GeoLocation location) {
        this.location = location;
    }

    public OracleStatus getStatus() {
        return status;
    }

    public void setStatus(OracleStatus status) {
        this.status = status;
    }

    public OracleReputation getReputation() {
        return reputation;
    }

    public void setReputation(OracleReputation reputation) {
        this.reputation = reputation;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public Instant getApprovedAt() {
        return approvedAt;
    }

    public void setApprovedAt(Instant approvedAt) {
        this.approvedAt = approvedAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    public void setLastActiveAt(Instant lastActiveAt) {
        this.lastActiveAt = lastActiveAt;
    }
}
