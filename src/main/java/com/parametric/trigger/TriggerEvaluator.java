package com.parametric.trigger;

import com.parametric.policy.TriggerCondition;

import java.util.List;
import java.util.Optional;

/**
 * Checks a reported value against a policy's conditions in declaration order.
 * The first met condition wins; conditions after it are never evaluated.
 */
public class TriggerEvaluator {

    public Optional<ConditionMatch> evaluate(EventData eventData, List<TriggerCondition> conditions) {
        for (int i = 0; i < conditions.size(); i++) {
            TriggerCondition condition = conditions.get(i);
            if (!condition.parameter().equals(eventData.parameter())) {
                continue;
            }
            if (condition.operator().test(eventData.value(), condition.threshold())) {
                return Optional.of(new ConditionMatch(i, condition.threshold(), eventData.value(), condition.operator()));
            }
        }
        return Optional.empty();
    }
}
