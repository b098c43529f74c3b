package io.surfworks.hpcrunner.scheduler.sge;

import io.surfworks.hpcrunner.config.SgeConfig;
import io.surfworks.hpcrunner.job.ArrayJobResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobResult;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.job.OutputStreamKind;
import io.surfworks.hpcrunner.scheduler.AccountingNotAvailableException;
import io.surfworks.hpcrunner.scheduler.ActiveJobQuery;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.SchedulerException;
import io.surfworks.hpcrunner.scheduler.SubmissionException;
import io.surfworks.hpcrunner.testing.FakeCommandExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SgeScheduler against canned command output.
 */
class SgeSchedulerTest {

    private static final String QSTAT_XML = """
            <?xml version='1.0'?>
            <job_info>
              <queue_info>
                <job_list state="running">
                  <JB_job_number>12345</JB_job_number>
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
                  <JB_name>sweep</JB_name>
                  <JB_owner>bob</JB_owner>
                  <state>qw</state>
                  <JB_submission_time>2024-01-15T10:35:00</JB_submission_time>
                  <slots>1</slots>
                </job_list>
              </job_info>
            </job_info>
            """;

    private static final String QSTAT_J = """
            ==============================================================
            job_number:                 12345
            job_name:                   train_model
            stdout_path_list:           NONE:NONE:/home/alice/train.out
            stderr_path_list:           NONE:NONE:/home/alice/train.err
            hard resource_list:         h_rt=3600,mem_free=16G
            jid_predecessor_list:       12000,12001
            """;

    private static final String QACCT = """
            ==============================================================
            qname        all.q
            hostname     node1
            owner        alice
            jobname      first
            jobnumber    200
            taskid       undefined
            qsub_time    Mon Jan 15 09:00:00 2024
            start_time   Mon Jan 15 09:01:00 2024
            end_time     Mon Jan 15 09:11:00 2024
            slots        1
            failed       0
            exit_status  0
            ru_wallclock 600s
            ==============================================================
            qname        all.q
            hostname     node2
            owner        alice
            jobname      second
            jobnumber    201
            taskid       undefined
            qsub_time    Mon Jan 15 10:00:00 2024
            start_time   Mon Jan 15 10:01:00 2024
            end_time     Mon Jan 15 10:02:00 2024
            slots        1
            failed       0
            exit_status  2
            ru_wallclock 60s
            """;

    private FakeCommandExecutor executor;
    private SgeScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = new FakeCommandExecutor();
        scheduler = new SgeScheduler(SgeConfig.defaults(), executor,
                FakeCommandExecutor.binaries("qsub", "qstat", "qacct"), Duration.ofSeconds(5));
    }

    // ===== Command generation =====

    @Test
    void submitCommandUsesConfiguredResourceNames() {
        JobSpec spec = JobSpec.builder("align", "bwa mem ref.fa reads.fq")
                .queue("all.q")
                .cpu(8)
                .memory("4G")
                .timeLimit(Duration.ofMinutes(90))
                .mergeOutput(true)
                .dependencies(List.of("11", "12"))
                .build();

        List<String> cmd = scheduler.buildSubmitCommand(spec);

        assertEquals(List.of(
                "qsub", "-N", "align",
                "-q", "all.q", "-pe", "smp", "8", "-l", "mem_free=4G", "-l", "h_rt=1:30:00",
                "-cwd", "-j", "y", "-hold_jid", "11,12"
        ), cmd);
    }

    @Test
    void customParallelEnvironmentIsUsed() {
        SgeScheduler custom = new SgeScheduler(new SgeConfig("mpi", "h_vmem", "s_rt"), executor,
                FakeCommandExecutor.binaries(), Duration.ofSeconds(5));

        List<String> cmd = custom.buildSubmitCommand(JobSpec.builder("j", "true").cpu(2).memory("1G").build());

        assertTrue(String.join(" ", cmd).contains("-pe mpi 2 -l h_vmem=1G"));
    }

    @Test
    void scriptSelectsBashShell() {
        String script = scheduler.generateScript(JobSpec.builder("j", "echo hi").build());

        assertTrue(script.startsWith("#!/bin/bash\n#$ -S /bin/bash\n"));
        assertTrue(script.endsWith("echo hi\n"));
    }

    // ===== Submission =====

    @Test
    void submitParsesQsubAnswer() throws SchedulerException {
        executor.respond("qsub", "Your job 4711 (\"align\") has been submitted\n");

        JobResult result = scheduler.submit(JobSpec.builder("align", "true").build());

        assertEquals("4711", result.jobId());
        assertEquals("sge", result.scheduler());
    }

    @Test
    void arraySubmissionAppendsTaskRangeAndLimit() throws SchedulerException {
        executor.respond("qsub", "Your job-array 4712.1-5:2 (\"sweep\") has been submitted\n");
        JobArraySpec array = JobArraySpec.parse(JobSpec.builder("sweep", "./run.sh").build(), "1-5:2")
                .withMaxConcurrent(3);

        ArrayJobResult result = scheduler.submitArray(array);

        List<String> cmd = executor.lastCall().command();
        assertEquals(List.of("-t", "1-5:2", "-tc", "3"), cmd.subList(cmd.size() - 4, cmd.size()));
        assertEquals(List.of("4712.1", "4712.3", "4712.5"), result.taskJobIds());
    }

    @Test
    void qsubRefusalIsSubmissionError() {
        executor.respond("qsub", 1, "", "Unable to run job: unknown queue \"nope.q\".");

        assertThrows(SubmissionException.class,
                () -> scheduler.submit(JobSpec.builder("j", "true").queue("nope.q").build()));
    }

    // ===== Listings =====

    @Test
    void listActiveJobsReadsXml() throws SchedulerException {
        executor.respond("qstat -xml", QSTAT_XML);

        List<JobInfo> jobs = scheduler.listActiveJobs(ActiveJobQuery.all());

        assertEquals(2, jobs.size());
        JobInfo running = jobs.get(0);
        assertEquals("12345", running.jobId());
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals("all.q", running.queue());
        assertEquals("node1", running.node());
        assertEquals(JobStatus.PENDING, jobs.get(1).status());
    }

    @Test
    void truncatedXmlListingIsAnError() {
        executor.respond("qstat -xml", QSTAT_XML.substring(0, QSTAT_XML.indexOf("<JB_name>train")));

        SchedulerException e = assertThrows(SchedulerException.class,
                () -> scheduler.listActiveJobs(ActiveJobQuery.all()));
        assertTrue(e.getMessage().contains("malformed"));
        assertFalse(executor.wasRun("qstat -u *"));
        assertEquals(JobStatus.UNKNOWN, scheduler.status("12345"));
    }

    @Test
    void wellFormedEmptyXmlListsNoJobs() throws SchedulerException {
        executor.respond("qstat -xml", "<?xml version='1.0'?>\n<job_info><queue_info/><job_info/></job_info>\n");

        assertTrue(scheduler.listActiveJobs(ActiveJobQuery.all()).isEmpty());
    }

    @Test
    void listActiveJobsFallsBackToPlainQstat() throws SchedulerException {
        executor.respond("qstat -xml", 2, "", "invalid option argument \"-xml\"");
        executor.respond("qstat -u", """
                job-ID  prior   name       user         state submit/start at     queue                          slots ja-task-ID
                -----------------------------------------------------------------------------------------------------------------
                  12345 0.55500 train      alice        r     01/15/2024 10:30:00 all.q@node1                        4
                """);

        List<JobInfo> jobs = scheduler.listActiveJobs(ActiveJobQuery.forUser("alice"));

        assertEquals(1, jobs.size());
        assertEquals("train", jobs.get(0).name());
        assertTrue(executor.wasRun("qstat -u *"));
    }

    @Test
    void historyPassesOwnerAndDayWindow() throws SchedulerException {
        executor.respond("qacct", QACCT);
        Instant since = Instant.now().minus(3, ChronoUnit.DAYS).minus(1, ChronoUnit.HOURS);

        scheduler.listCompletedJobs(CompletedJobQuery.forUser("alice").inTimeRange(since, null));

        List<String> cmd = executor.lastCall().command();
        assertEquals(List.of("qacct", "-o", "alice", "-d", "4", "-j"), cmd);
    }

    @Test
    void historyIsNewestFirstWithExitCodes() throws SchedulerException {
        executor.respond("qacct", QACCT);

        List<JobInfo> jobs = scheduler.listCompletedJobs(CompletedJobQuery.recent());

        assertEquals(List.of("201", "200"), jobs.stream().map(JobInfo::jobId).toList());
        assertEquals(JobStatus.FAILED, jobs.get(0).status());
        assertEquals(2, jobs.get(0).exitCode());
        assertEquals(Duration.ofMinutes(10), jobs.get(1).runtime());
    }

    @Test
    void historyWithoutQacctIsUnavailable() {
        SgeScheduler noAccounting = new SgeScheduler(SgeConfig.defaults(), executor,
                FakeCommandExecutor.binaries("qsub", "qstat"), Duration.ofSeconds(5));

        assertThrows(AccountingNotAvailableException.class,
                () -> noAccounting.listCompletedJobs(CompletedJobQuery.recent()));
        assertEquals(0, executor.callCount());
    }

    // ===== Single-job queries =====

    @Test
    void liveJobDetailsIncludeQstatJ() throws SchedulerException {
        executor.respond("qstat -xml", QSTAT_XML);
        executor.respond("qstat -j 12345", QSTAT_J);

        JobInfo job = scheduler.jobDetails("12345");

        assertEquals("16G", job.memory());
        assertEquals(List.of("12000", "12001"), job.dependencies());
        assertEquals(Optional.of(Path.of("/home/alice/train.err")),
                scheduler.outputPath("12345", OutputStreamKind.STDERR));
    }

    @Test
    void finishedJobComesFromAccounting() {
        executor.respond("qstat -xml", QSTAT_XML);
        executor.respond("qacct -j 201", QACCT);

        assertEquals(JobStatus.FAILED, scheduler.status("201"));
        assertEquals(2, scheduler.exitCode("201").getAsInt());
    }

    @Test
    void jobUnknownToQacctIsUnknown() {
        executor.respond("qstat -xml", QSTAT_XML);
        executor.respond("qacct", 1, "", "error: job id 999 not found");

        assertEquals(JobStatus.UNKNOWN, scheduler.status("999"));
    }

    @Test
    void cancelRunsQdelForActiveJob() {
        executor.respond("qstat -xml", QSTAT_XML);
        executor.respond("qstat -j", 1, "", "");
        executor.respond("qdel", "alice has registered the job 12345 for deletion");

        assertTrue(scheduler.cancel("12345"));
        assertEquals(List.of("qdel", "12345"), executor.lastCall().command());
    }

    @Test
    void cancelOfUnknownJobDoesNothing() {
        executor.respond("qstat -xml", QSTAT_XML);
        executor.respond("qacct", 1, "", "error: job id 999 not found");

        assertFalse(scheduler.cancel("999"));
        assertFalse(executor.wasRun("qdel"));
    }
}
