package com.parametric.api;

import com.parametric.oracle.DataAttestation;
import com.parametric.oracle.DataRequest;
import com.parametric.oracle.OracleCommitteeService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/attestations")
public class AttestationController {

    private final OracleCommitteeService committee;

    public AttestationController(OracleCommitteeService committee) {
        this.committee = committee;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DataAttestation request(@RequestBody DataRequest request) {
        return committee.requestAttestation(request);
    }

    @PostMapping("/{attestationId}/signatures")
    public DataAttestation submitSignature(@PathVariable String attestationId,
                                           @RequestBody SignatureSubmission submission) {
        if (submission.value() == null) {
            throw new IllegalArgumentException("value is required");
        }
        return committee.submitSignature(attestationId, submission.oracleId(), submission.signature(),
            submission.value());
    }

    @GetMapping("/{attestationId}")
    public DataAttestation get(@PathVariable String attestationId) {
        return committee.getAttestation(attestationId);
    }

    public record SignatureSubmission(String oracleId, String signature, Double value) {}
}
