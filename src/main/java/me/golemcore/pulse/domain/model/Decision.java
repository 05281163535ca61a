package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured output of the decision function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Decision {

    @Builder.Default
    private EvaluationResult.ResultType resultType = EvaluationResult.ResultType.OK;

    private String triggeredCheck;
    private String summary;
    private String recommendedAction;
    private boolean shouldNotify;
    private String model;

    public static Decision ok(String summary) {
        return Decision.builder().resultType(EvaluationResult.ResultType.OK).summary(summary).build();
    }
}
