package io.surfworks.hpcrunner.scheduler.sge;

import java.time.Instant;
import java.util.Objects;

/**
 * One job as read from a {@code qstat} listing, XML or plain text.
 * Every field except the id is optional.
 *
 * @param jobId       JB_job_number
 * @param name        JB_name
 * @param user        JB_owner
 * @param state       Raw state code such as "r" or "qw"
 * @param queue       Queue name without the "@host" suffix
 * @param host        Host part of "queue@host", running jobs only
 * @param slots       Granted or requested slots
 * @param submitTime  JB_submission_time
 * @param startTime   JAT_start_time
 * @param arrayTaskId Task index or task range, verbatim
 * @param priority    Normalized priority as printed by qstat
 */
record SgeJobRecord(
        String jobId,
        String name,
        String user,
        String state,
        String queue,
        String host,
        Integer slots,
        Instant submitTime,
        Instant startTime,
        String arrayTaskId,
        String priority
) {

    SgeJobRecord {
        Objects.requireNonNull(jobId, "jobId cannot be null");
    }

    /**
     * Key that keeps the tasks of one array job apart in a listing.
     */
    String key() {
        return arrayTaskId == null ? jobId : jobId + "." + arrayTaskId;
    }
}
