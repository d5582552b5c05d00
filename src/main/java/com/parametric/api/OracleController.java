package com.parametric.api;

import com.parametric.oracle.CommitteeHealth;
import com.parametric.oracle.DataSource;
import com.parametric.oracle.DataSourceRegistration;
import com.parametric.oracle.Oracle;
import com.parametric.oracle.OracleCommitteeService;
import com.parametric.oracle.OracleRegistration;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
public class OracleController {

    private final OracleCommitteeService committee;

    public OracleController(OracleCommitteeService committee) {
        this.committee = committee;
    }

    @PostMapping("/v1/oracles")
    @ResponseStatus(HttpStatus.CREATED)
    public Oracle register(@RequestBody OracleRegistration registration) {
        return committee.registerOracle(registration);
    }

    @GetMapping("/v1/oracles/health")
    public CommitteeHealth health() {
        return committee.committeeHealth();
    }

    @GetMapping("/v1/oracles/{oracleId}")
    public Oracle get(@PathVariable String oracleId) {
        return committee.getOracle(oracleId);
    }

    @PostMapping("/v1/oracles/{oracleId}/approve")
    public Oracle approve(@PathVariable String oracleId) {
        return committee.approveOracle(oracleId);
    }

    @PostMapping("/v1/oracles/{oracleId}/suspend")
    public Oracle suspend(@PathVariable String oracleId) {
        return committee.suspendOracle(oracleId);
    }

    @PostMapping("/v1/oracles/{oracleId}/reinstate")
    public Oracle reinstate(@PathVariable String oracleId) {
        return committee.reinstateOracle(oracleId);
    }

    @PostMapping("/v1/oracles/{oracleId}/deactivate")
    public Oracle deactivate(@PathVariable String oracleId) {
        return committee.deactivateOracle(oracleId);
    }

    @PostMapping("/v1/oracles/{oracleId}/slash")
    public Oracle slash(@PathVariable String oracleId, @RequestBody SlashRequest request) {
        return committee.slashOracle(oracleId, request.amount(), request.reason());
    }

    @PostMapping("/v1/data-sources")
    @ResponseStatus(HttpStatus.CREATED)
    public DataSource registerDataSource(@RequestBody DataSourceRegistration registration) {
        return committee.registerDataSource(registration);
    }

    @GetMapping("/v1/data-sources/{sourceId}")
    public DataSource getDataSource(@PathVariable String sourceId) {
        return committee.getDataSource(sourceId);
    }

    public record SlashRequest(BigDecimal amount, String reason) {}
}
