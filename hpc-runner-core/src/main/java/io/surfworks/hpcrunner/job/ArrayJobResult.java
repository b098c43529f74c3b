package io.surfworks.hpcrunner.job;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of an array submission.
 *
 * @param baseJobId Scheduler-assigned id shared by all tasks
 * @param scheduler Name of the scheduler that accepted the array
 * @param array     The submitted array specification
 */
public record ArrayJobResult(
        String baseJobId,
        String scheduler,
        JobArraySpec array
) {

    public ArrayJobResult {
        Objects.requireNonNull(baseJobId, "baseJobId cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(array, "array cannot be null");
    }

    /**
     * Returns the id of a single task, {@code baseJobId.taskIndex}.
     */
    public String taskJobId(int taskIndex) {
        return baseJobId + "." + taskIndex;
    }

    /**
     * Returns the ids of every task in the array, in index order.
     */
    public List<String> taskJobIds() {
        return array.taskIndices().stream()
                .map(this::taskJobId)
                .toList();
    }
}
