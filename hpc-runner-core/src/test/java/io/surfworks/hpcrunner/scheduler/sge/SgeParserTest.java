package io.surfworks.hpcrunner.scheduler.sge;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for Grid Engine output parsing.
 */
@DisplayName("SgeParser")
class SgeParserTest {

    private static final String QSTAT_XML = """
            <?xml version='1.0'?>
            <job_info xmlns:xsd="http://arc.liv.ac.uk/repos/darcs/sge/source/dist/util/resources/schemas/qstat/qstat.xsd">
              <queue_info>
                <job_list state="running">
                  <JB_job_number>12345</JB_job_number>
                  <JAT_prio>0.55500</JAT_prio>
                  <JB_name>train_model</JB_name>
                  <JB_owner>alice</JB_owner>
                  <state>r</state>
                  <JAT_start_time>2024-01-15T10:30:00</JAT_start_time>
                  <queue_name>all.q@node1</queue_name>
                  <slots>4</slots>
                </job_list>
              </queue_info>
              <job_info>
                <job_list state="pending">
                  <JB_job_number>12346</JB_job_number>
                  <JAT_prio>0.00000</JAT_prio>
                  <JB_name>sweep</JB_name>
                  <JB_owner>bob</JB_owner>
                  <state>qw</state>
                  <JB_submission_time>2024-01-15T10:35:00</JB_submission_time>
                  <hard_req_queue>gpu.q</hard_req_queue>
                  <slots>1</slots>
                  <tasks>1-10:1</tasks>
                </job_list>
                <job_list state="pending">
                  <JB_name>no_number</JB_name>
                </job_list>
              </job_info>
            </job_info>
            """;

    private static Instant local(int year, int month, int day, int hour, int minute, int second) {
        return LocalDateTime.of(year, month, day, hour, minute, second)
                .atZone(ZoneId.systemDefault())
                .toInstant();
    }

    @Nested
    @DisplayName("qstat -xml")
    class QstatXml {

        @Test
        @DisplayName("collects running and pending jobs in document order")
        void collectsRunningAndPendingJobs() {
            Map<String, SgeJobRecord> jobs = SgeParser.parseQstatXml(QSTAT_XML);

            assertEquals(List.of("12345", "12346"), List.copyOf(jobs.keySet()));
        }

        @Test
        @DisplayName("running job fields are recovered exactly")
        void runningJobFields() {
            SgeJobRecord job = SgeParser.parseQstatXml(QSTAT_XML).get("12345");

            assertEquals("12345", job.jobId());
            assertEquals("train_model", job.name());
            assertEquals("alice", job.user());
            assertEquals("r", job.state());
            assertEquals("all.q", job.queue());
            assertEquals("node1", job.host());
            assertEquals(4, job.slots());
            assertEquals(local(2024, 1, 15, 10, 30, 0), job.startTime());
            assertNull(job.submitTime());
            assertNull(job.arrayTaskId());
            assertEquals("0.55500", job.priority());
        }

        @Test
        @DisplayName("pending job falls back to the requested queue")
        void pendingJobUsesHardRequestQueue() {
            SgeJobRecord job = SgeParser.parseQstatXml(QSTAT_XML).get("12346.1-10:1");

            assertEquals("gpu.q", job.queue());
            assertNull(job.host());
            assertEquals("1-10:1", job.arrayTaskId());
            assertEquals(local(2024, 1, 15, 10, 35, 0), job.submitTime());
        }

        @Test
        @DisplayName("converts to JobInfo with normalized status")
        void convertsToJobInfo() {
            SgeJobRecord record = SgeParser.parseQstatXml(QSTAT_XML).get("12345");
            Instant now = local(2024, 1, 15, 11, 0, 0);

            JobInfo job = SgeParser.toJobInfo(record, now);

            assertEquals("12345", job.jobId());
            assertEquals(JobStatus.RUNNING, job.status());
            assertEquals("all.q", job.queue());
            assertEquals("node1", job.node());
            assertEquals(4, job.cpu());
            assertEquals(Duration.ofMinutes(30), job.runtime());
        }

        @Test
        @DisplayName("epoch timestamps are accepted")
        void epochTimestamps() {
            String xml = """
                    <job_info><queue_info><job_list>
                      <JB_job_number>7</JB_job_number>
                      <JB_name>x</JB_name><JB_owner>u</JB_owner><state>r</state>
                      <JAT_start_time>1705314600</JAT_start_time>
                    </job_list></queue_info></job_info>
                    """;

            SgeJobRecord job = SgeParser.parseQstatXml(xml).get("7");

            assertEquals(Instant.ofEpochSecond(1705314600L), job.startTime());
        }

        @Test
        @DisplayName("malformed XML yields an empty mapping")
        void malformedXml() {
            assertTrue(SgeParser.parseQstatXml("<job_info><queue_info><job_list>").isEmpty());
            assertTrue(SgeParser.parseQstatXml("not xml at all").isEmpty());
            assertTrue(SgeParser.parseQstatXml("").isEmpty());
            assertTrue(SgeParser.parseQstatXml(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("plain qstat")
    class QstatPlain {

        private static final String OUTPUT = """
                job-ID  prior   name       user         state submit/start at     queue                          slots ja-task-ID
                -----------------------------------------------------------------------------------------------------------------
                  12345 0.55500 train      alice        r     01/15/2024 10:30:00 all.q@node1                        4
                  12346 0.00000 sweep      bob          qw    01/15/2024 10:35:00                                    1 1-10:1
                  short line
                """;

        @Test
        @DisplayName("skips header lines and short data lines")
        void skipsHeaderAndShortLines() {
            Map<String, SgeJobRecord> jobs = SgeParser.parseQstatPlain(OUTPUT);

            assertEquals(List.of("12345", "12346"), List.copyOf(jobs.keySet()));
        }

        @Test
        @DisplayName("lines before the dash separator are never data")
        void nothingBeforeSeparator() {
            String output = "12345 0.5 name user r 01/15/2024 10:30:00 all.q@n1 1\n";

            assertTrue(SgeParser.parseQstatPlain(output).isEmpty());
        }

        @Test
        @DisplayName("running job reads start time, queue and host")
        void runningJob() {
            SgeJobRecord job = SgeParser.parseQstatPlain(OUTPUT).get("12345");

            assertEquals("train", job.name());
            assertEquals("alice", job.user());
            assertEquals("all.q", job.queue());
            assertEquals("node1", job.host());
            assertEquals(4, job.slots());
            assertEquals(local(2024, 1, 15, 10, 30, 0), job.startTime());
            assertNull(job.submitTime());
        }

        @Test
        @DisplayName("pending job without a queue column is read by position")
        void pendingJobWithoutQueue() {
            SgeJobRecord job = SgeParser.parseQstatPlain(OUTPUT).get("12346");

            assertEquals("1", job.queue());
            assertNull(job.slots());
            assertNull(job.arrayTaskId());
            assertEquals(local(2024, 1, 15, 10, 35, 0), job.submitTime());
            assertNull(job.startTime());
        }

        @Test
        @DisplayName("queue, slots and task id by position")
        void fullLine() {
            String output = "header\n----\n  777 0.5 sweep bob r 01/15/2024 10:35:00 gpu.q@node2 8 3\n";

            SgeJobRecord job = SgeParser.parseQstatPlain(output).get("777.3");

            assertEquals("gpu.q", job.queue());
            assertEquals("node2", job.host());
            assertEquals(8, job.slots());
            assertEquals("3", job.arrayTaskId());
        }

        @Test
        @DisplayName("non-numeric slots token leaves slots unset")
        void nonNumericSlots() {
            String output = "header\n----\n  12346 0.5 sweep bob qw 01/15/2024 10:35:00 1 1-10:1\n";

            SgeJobRecord job = SgeParser.parseQstatPlain(output).get("12346");

            assertEquals("1", job.queue());
            assertNull(job.slots());
        }

        @Test
        @DisplayName("five tokens are enough")
        void minimalLine() {
            String output = "header\n----\n42 0.1 job carol qw\n";

            SgeJobRecord job = SgeParser.parseQstatPlain(output).get("42");

            assertEquals("carol", job.user());
            assertEquals("qw", job.state());
            assertNull(job.queue());
            assertNull(job.slots());
        }
    }

    @Nested
    @DisplayName("qacct")
    class Qacct {

        private static final String RECORD = """
                ==============================================================
                qname        all.q
                hostname     node1
                group        users
                owner        alice
                jobname      train_model
                jobnumber    12345
                taskid       undefined
                qsub_time    Mon Jan 15 10:00:00 2024
                start_time   Mon Jan 15 10:30:00 2024
                end_time     Mon Jan 15 11:30:00 2024
                slots        4
                failed       0
                exit_status  0
                ru_wallclock 3600s
                maxvmem      2.000G
                """;

        @Test
        @DisplayName("reads key and value separated by whitespace")
        void keyValuePairs() {
            Map<String, String> info = SgeParser.parseQacct(RECORD);

            assertEquals("all.q", info.get("qname"));
            assertEquals("Mon Jan 15 10:30:00 2024", info.get("start_time"));
            assertEquals("3600s", info.get("ru_wallclock"));
        }

        @Test
        @DisplayName("lines without a value are ignored")
        void linesWithoutValue() {
            Map<String, String> info = SgeParser.parseQacct("jobnumber 1\nlonely\n");

            assertEquals(Map.of("jobnumber", "1"), info);
        }

        @Test
        @DisplayName("splits a dump into records on separator rows")
        void splitsRecords() {
            String dump = RECORD + """
                    ==============================================================
                    jobnumber    12346
                    exit_status  1
                    failed       0
                    """;

            List<Map<String, String>> records = SgeParser.parseQacctRecords(dump);

            assertEquals(2, records.size());
            assertEquals("12345", records.get(0).get("jobnumber"));
            assertEquals("12346", records.get(1).get("jobnumber"));
        }

        @Test
        @DisplayName("successful record converts to a completed job")
        void completedJob() {
            JobInfo job = SgeParser.qacctToJobInfo(SgeParser.parseQacct(RECORD));

            assertEquals("12345", job.jobId());
            assertEquals("train_model", job.name());
            assertEquals("alice", job.user());
            assertEquals(JobStatus.COMPLETED, job.status());
            assertEquals(0, job.exitCode());
            assertEquals("all.q", job.queue());
            assertEquals("node1", job.node());
            assertEquals(4, job.cpu());
            assertEquals("2.000G", job.memory());
            assertEquals(local(2024, 1, 15, 10, 0, 0), job.submitTime());
            assertEquals(local(2024, 1, 15, 10, 30, 0), job.startTime());
            assertEquals(local(2024, 1, 15, 11, 30, 0), job.endTime());
            assertEquals(Duration.ofHours(1), job.runtime());
            assertNull(job.arrayTaskId());
        }

        @Test
        @DisplayName("non-zero exit or failure code means FAILED")
        void failedJob() {
            assertEquals(JobStatus.FAILED, SgeParser.qacctToJobInfo(
                    Map.of("jobnumber", "1", "exit_status", "2", "failed", "0")).status());
            assertEquals(JobStatus.FAILED, SgeParser.qacctToJobInfo(
                    Map.of("jobnumber", "1", "exit_status", "0", "failed", "100 : assumedly after job")).status());
        }

        @Test
        @DisplayName("record without job number is dropped")
        void missingJobNumber() {
            assertNull(SgeParser.qacctToJobInfo(Map.of("qname", "all.q")));
        }

        @Test
        @DisplayName("single-digit days padded with two spaces parse")
        void paddedCtime() {
            assertEquals(local(2024, 1, 5, 9, 0, 0), SgeParser.parseQacctTime("Fri Jan  5 09:00:00 2024"));
        }
    }

    @Nested
    @DisplayName("qstat -j")
    class QstatJobDetail {

        private static final String DETAIL = """
                ==============================================================
                job_number:                 12345
                job_name:                   train_model
                stdout_path_list:           NONE:NONE:/home/alice/train.out
                stderr_path_list:           NONE:NONE:/home/alice/train.err
                hard resource_list:         h_rt=3600,mem_free=16G
                jid_predecessor_list:       12300,12301
                scheduling info:            queue instance "gpu.q@node2" dropped
                                            because it is full
                """;

        @Test
        @DisplayName("keys may contain spaces and continuation lines are ignored")
        void keysWithSpaces() {
            Map<String, String> info = SgeParser.parseQstatJobDetail(DETAIL);

            assertEquals("12345", info.get("job_number"));
            assertEquals("h_rt=3600,mem_free=16G", info.get("hard resource_list"));
            assertEquals("queue instance \"gpu.q@node2\" dropped", info.get("scheduling info"));
            assertEquals(7, info.size());
        }

        @Test
        @DisplayName("extracts paths, dependencies and resources")
        void fieldHelpers() {
            Map<String, String> info = SgeParser.parseQstatJobDetail(DETAIL);

            assertEquals(Path.of("/home/alice/train.out"), SgeParser.parsePathList(info.get("stdout_path_list")));
            assertEquals(List.of("12300", "12301"), SgeParser.parseDependencies(info.get("jid_predecessor_list")));
            assertEquals("16G", SgeParser.parseResource(info.get("hard resource_list"), "mem_free"));
            assertNull(SgeParser.parseResource(info.get("hard resource_list"), "gpu"));
        }
    }

    @Nested
    @DisplayName("state mapping")
    class StateMapping {

        @ParameterizedTest
        @CsvSource({
                "r, RUNNING", "t, RUNNING", "Rr, RUNNING", "Rt, RUNNING",
                "qw, PENDING", "hqw, PENDING",
                "s, PENDING", "ts, PENDING", "S, PENDING", "tS, PENDING",
                "Eqw, FAILED",
                "dr, CANCELLED", "dt, CANCELLED"
        })
        void mappedStates(String state, JobStatus expected) {
            assertEquals(expected, SgeParser.stateToStatus(state));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "x", "running", "hRwq", "E"})
        void unmappedStatesAreUnknown(String state) {
            assertEquals(JobStatus.UNKNOWN, SgeParser.stateToStatus(state));
        }

        @Test
        void nullStateIsUnknown() {
            assertEquals(JobStatus.UNKNOWN, SgeParser.stateToStatus(null));
        }
    }

    @Nested
    @DisplayName("qsub output")
    class QsubOutput {

        @Test
        void plainJob() {
            assertEquals(Optional.of("12345"),
                    SgeParser.parseQsubOutput("Your job 12345 (\"x\") has been submitted"));
        }

        @Test
        void jobArray() {
            assertEquals(Optional.of("9000"),
                    SgeParser.parseQsubOutput("Your job-array 9000.1-10:1 (\"x\") submitted"));
        }

        @Test
        void unparsable() {
            assertEquals(Optional.empty(), SgeParser.parseQsubOutput("Unable to run job: denied"));
            assertEquals(Optional.empty(), SgeParser.parseQsubOutput(null));
        }
    }
}
