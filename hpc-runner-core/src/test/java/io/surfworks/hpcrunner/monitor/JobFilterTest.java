package io.surfworks.hpcrunner.monitor;

import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.scheduler.ActiveJobQuery;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JobFilterTest {

    @Test
    void mineSubstitutesCurrentUser() {
        ActiveJobQuery query = JobFilter.mine().toQuery("alice");

        assertEquals("alice", query.user());
        assertNull(query.statuses());
        assertEquals(JobStatus.ACTIVE, query.effectiveStatuses());
    }

    @Test
    void allHasNoUser() {
        assertNull(JobFilter.all().toQuery("alice").user());
    }

    @Test
    void statusesAndQueueCarryOver() {
        JobFilter filter = JobFilter.mine().withStatuses(Set.of(JobStatus.RUNNING)).withQueue("gpu");

        assertEquals(new ActiveJobQuery("bob", Set.of(JobStatus.RUNNING), "gpu"), filter.toQuery("bob"));
    }

    @Test
    void filtersCompareByValue() {
        assertEquals(JobFilter.mine(), JobFilter.all().withScope(UserScope.MINE));
        assertNotEquals(JobFilter.mine(), JobFilter.mine().withQueue("gpu"));
    }
}
