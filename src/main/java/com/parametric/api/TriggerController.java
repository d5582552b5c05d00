package com.parametric.api;

import com.parametric.trigger.EventData;
import com.parametric.trigger.Trigger;
import com.parametric.trigger.TriggerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Direct trigger submission for event data confirmed outside the oracle committee.
 */
@RestController
@RequestMapping("/v1/triggers")
public class TriggerController {

    private final TriggerService triggerService;

    public TriggerController(TriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @PostMapping
    public Trigger submit(@RequestBody TriggerSubmission submission) {
        return triggerService.ingest(submission.policyId(), submission.eventData(), submission.source());
    }

    @GetMapping("/{triggerId}")
    public Trigger get(@PathVariable String triggerId) {
        return triggerService.getTrigger(triggerId);
    }

    public record TriggerSubmission(String policyId, EventData eventData, String source) {}
}
