package io.surfworks.hpcrunner.scheduler.pbs;

import java.util.Map;
import java.util.Objects;

/**
 * One {@code Job Id:} block of {@code qstat -f} output.
 *
 * @param jobId      Full PBS id, e.g. "1234.server" or "1234[3].server"
 * @param attributes Attribute values keyed by name ("job_state", "Resource_List.ncpus", ...)
 */
record PbsJobRecord(String jobId, Map<String, String> attributes) {

    PbsJobRecord {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        attributes = Map.copyOf(attributes);
    }

    String get(String name) {
        return attributes.get(name);
    }
}
