package io.surfworks.hpcrunner.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An array job: one submission that expands into indexed tasks sharing a base id.
 *
 * @param job           The job every task runs
 * @param start         First task index (inclusive, at least 1)
 * @param end           Last task index (inclusive)
 * @param step          Increment between task indices
 * @param maxConcurrent Maximum tasks running at once (null = unlimited)
 */
public record JobArraySpec(
        JobSpec job,
        int start,
        int end,
        int step,
        Integer maxConcurrent
) {

    public JobArraySpec {
        Objects.requireNonNull(job, "job cannot be null");
        if (start < 1) {
            throw new IllegalArgumentException("start must be at least 1");
        }
        if (end < start) {
            throw new IllegalArgumentException("end must not be before start");
        }
        if (step < 1) {
            throw new IllegalArgumentException("step must be positive");
        }
        if (maxConcurrent != null && maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
    }

    /**
     * Creates an array of tasks {@code start..end} with step 1.
     */
    public static JobArraySpec of(JobSpec job, int start, int end) {
        return new JobArraySpec(job, start, end, 1, null);
    }

    /**
     * Parses a range of the form {@code start-end[:step]}, e.g. "1-100:2".
     */
    public static JobArraySpec parse(JobSpec job, String range) {
        Objects.requireNonNull(range, "range cannot be null");
        try {
            String[] rangeAndStep = range.trim().split(":", 2);
            String[] bounds = rangeAndStep[0].split("-", 2);
            int start = Integer.parseInt(bounds[0].trim());
            int end = bounds.length > 1 ? Integer.parseInt(bounds[1].trim()) : start;
            int step = rangeAndStep.length > 1 ? Integer.parseInt(rangeAndStep[1].trim()) : 1;
            return new JobArraySpec(job, start, end, step, null);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array range: " + range, e);
        }
    }

    /**
     * Returns a new spec limiting concurrently running tasks.
     */
    public JobArraySpec withMaxConcurrent(Integer max) {
        return new JobArraySpec(job, start, end, step, max);
    }

    /**
     * Returns every task index in the array, in ascending order.
     */
    public List<Integer> taskIndices() {
        List<Integer> indices = new ArrayList<>();
        for (int i = start; i <= end; i += step) {
            indices.add(i);
        }
        return indices;
    }

    /**
     * Returns the number of tasks in the array.
     */
    public int taskCount() {
        return (end - start) / step + 1;
    }

    /**
     * Formats the range as {@code start-end:step}.
     */
    public String rangeString() {
        return start + "-" + end + ":" + step;
    }
}
