package com.bookforge.core.publish;

import java.util.List;

/**
 * Outcomes of one publishing run, in format declaration order.
 *
 * @param outcomes one outcome per attempted format
 */
public record PublishReport(List<FormatOutcome> outcomes) {

    public PublishReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    /**
     * Returns whether every attempted format succeeded. An empty run counts as success.
     *
     * @return true if no format failed
     */
    public boolean isSuccess() {
        return outcomes.stream().allMatch(FormatOutcome::isSuccess);
    }

    public List<FormatOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }

    public List<FormatOutcome> successes() {
        return outcomes.stream().filter(FormatOutcome::isSuccess).toList();
    }
}
