package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ActiveJobQuery and CompletedJobQuery.
 */
class JobQueryTest {

    private static final Instant NOON = Instant.parse("2024-01-15T12:00:00Z");

    private static JobInfo finished(String id, Instant end, int exitCode) {
        return JobInfo.builder(id).user("alice").queue("all.q")
                .status(exitCode == 0 ? JobStatus.COMPLETED : JobStatus.FAILED)
                .endTime(end).exitCode(exitCode)
                .build();
    }

    // ===== ActiveJobQuery =====

    @Test
    void activeQueryDefaultsToActivePartition() {
        ActiveJobQuery query = ActiveJobQuery.all();

        assertTrue(query.matches(JobInfo.builder("1").status(JobStatus.PENDING).build()));
        assertTrue(query.matches(JobInfo.builder("2").status(JobStatus.UNKNOWN).build()));
        assertFalse(query.matches(JobInfo.builder("3").status(JobStatus.COMPLETED).build()));
    }

    @Test
    void activeQueryFiltersUserStatusAndQueue() {
        ActiveJobQuery query = ActiveJobQuery.forUser("alice")
                .withStatuses(Set.of(JobStatus.RUNNING))
                .withQueue("gpu");
        JobInfo match = JobInfo.builder("1").user("alice").status(JobStatus.RUNNING).queue("gpu").build();

        assertTrue(query.matches(match));
        assertFalse(query.matches(match.toBuilder().user("bob").build()));
        assertFalse(query.matches(match.toBuilder().status(JobStatus.PENDING).build()));
        assertFalse(query.matches(match.toBuilder().queue("cpu").build()));
    }

    // ===== CompletedJobQuery =====

    @Test
    void completedQueryTimeBoundsAreInclusive() {
        CompletedJobQuery query = CompletedJobQuery.recent().inTimeRange(NOON, NOON.plusSeconds(60));

        assertTrue(query.matches(finished("1", NOON, 0)));
        assertTrue(query.matches(finished("2", NOON.plusSeconds(60), 0)));
        assertFalse(query.matches(finished("3", NOON.minusSeconds(1), 0)));
        assertFalse(query.matches(JobInfo.builder("4").status(JobStatus.COMPLETED).build()));
    }

    @Test
    void completedQueryFiltersExitCodeAndQueue() {
        assertTrue(CompletedJobQuery.recent().withExitCode(1).matches(finished("1", NOON, 1)));
        assertFalse(CompletedJobQuery.recent().withExitCode(1).matches(finished("2", NOON, 0)));
        assertFalse(CompletedJobQuery.recent().withQueue("gpu.q").matches(finished("3", NOON, 0)));
        assertFalse(CompletedJobQuery.forUser("bob").matches(finished("4", NOON, 0)));
    }

    @Test
    void completedQueryValidation() {
        assertThrows(IllegalArgumentException.class, () -> CompletedJobQuery.recent().withLimit(0));
        assertThrows(IllegalArgumentException.class,
                () -> CompletedJobQuery.recent().inTimeRange(NOON, NOON.minusSeconds(1)));
        assertEquals(CompletedJobQuery.DEFAULT_LIMIT, CompletedJobQuery.recent().limit());
    }

    @Test
    void mostRecentFirstPutsUnfinishedLast() {
        List<JobInfo> jobs = new ArrayList<>(List.of(
                finished("old", NOON.minusSeconds(3600), 0),
                JobInfo.builder("none").status(JobStatus.FAILED).build(),
                finished("new", NOON, 0)));

        jobs.sort(CompletedJobQuery.MOST_RECENT_FIRST);

        assertEquals(List.of("new", "old", "none"), jobs.stream().map(JobInfo::jobId).toList());
    }
}
