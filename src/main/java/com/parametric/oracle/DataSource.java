package com.parametric.oracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Provenance of raw readings. Registered once and only read afterwards.
 */
public class DataSource {

    private String sourceId;
    private String name;
    private DataSourceType type;
    private String provider;
    private List<String> parameters = new ArrayList<>();
    private double qualityScore;
    private double slaUptime;
    private Instant registeredAt;

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DataSourceType getType() {
        return type;
    }

    public void setType(DataSourceType type) {
        this.type = type;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public void setParameters(List<String> parameters) {
        this.parameters = parameters == null ? new ArrayList<>() : new ArrayList<>(parameters);
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(double qualityScore) {
        this.qualityScore = qualityScore;
    }

    public double getSlaUptime() {
        return slaUptime;
    }

    public void setSlaUptime(double slaUptime) {
        this.slaUptime = slaUptime;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }
}
