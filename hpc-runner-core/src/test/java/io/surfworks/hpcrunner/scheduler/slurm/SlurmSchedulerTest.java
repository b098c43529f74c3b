package io.surfworks.hpcrunner.scheduler.slurm;

import io.surfworks.hpcrunner.config.SlurmConfig;
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
import io.surfworks.hpcrunner.scheduler.JobNotFoundException;
import io.surfworks.hpcrunner.scheduler.SchedulerException;
import io.surfworks.hpcrunner.scheduler.SubmissionException;
import io.surfworks.hpcrunner.testing.FakeCommandExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SlurmScheduler against canned command output.
 */
class SlurmSchedulerTest {

    private FakeCommandExecutor executor;
    private SlurmScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = new FakeCommandExecutor();
        scheduler = new SlurmScheduler(SlurmConfig.defaults(), executor,
                FakeCommandExecutor.binaries("sbatch", "squeue", "sacct"), Duration.ofSeconds(5));
    }

    private static JobSpec trainingJob() {
        return JobSpec.builder("train", "python train.py")
                .queue("gpu")
                .cpu(4)
                .memory("16G")
                .gpu(2)
                .timeLimit(Duration.ofHours(2))
                .dependencies(List.of("100", "101"))
                .environment(Map.of("OMP_NUM_THREADS", "4"))
                .rawArgs("slurm", List.of("--exclusive"))
                .rawArgs("sge", List.of("-l", "ignored"))
                .build();
    }

    // ===== Command generation =====

    @Test
    void submitCommandCarriesResourcesAndDependencies() {
        List<String> cmd = scheduler.buildSubmitCommand(trainingJob());

        assertEquals(List.of(
                "sbatch", "--parsable", "--job-name=train",
                "--partition=gpu", "--cpus-per-task=4", "--mem=16G", "--time=2:00:00", "--gres=gpu:2",
                "--dependency=afterok:100:101", "--exclusive"
        ), cmd);
    }

    @Test
    void configuredPartitionIsTheDefault() {
        SlurmScheduler withPartition = new SlurmScheduler(new SlurmConfig("batch"), executor,
                FakeCommandExecutor.binaries(), Duration.ofSeconds(5));

        List<String> cmd = withPartition.buildSubmitCommand(JobSpec.builder("j", "true").build());

        assertTrue(cmd.contains("--partition=batch"));
    }

    @Test
    void mergedOutputOmitsErrorFile() {
        JobSpec spec = JobSpec.builder("j", "true")
                .stdoutPath(Path.of("/tmp/out.log"))
                .stderrPath(Path.of("/tmp/err.log"))
                .mergeOutput(true)
                .build();

        List<String> cmd = scheduler.buildSubmitCommand(spec);

        assertTrue(cmd.contains("--output=/tmp/out.log"));
        assertFalse(cmd.stream().anyMatch(a -> a.startsWith("--error")));
    }

    @Test
    void scriptExportsEnvironmentBeforeCommand() {
        String script = scheduler.generateScript(trainingJob());

        assertTrue(script.startsWith("#!/bin/bash\n"));
        assertTrue(script.indexOf("export OMP_NUM_THREADS='4'") < script.indexOf("python train.py"));
    }

    // ===== Submission =====

    @Test
    void submitFeedsScriptAndParsesId() throws SchedulerException {
        executor.respond("sbatch", "4242\n");

        JobResult result = scheduler.submit(trainingJob());

        assertEquals("4242", result.jobId());
        assertEquals(JobStatus.PENDING, result.status());
        assertEquals("slurm", result.scheduler());
        assertTrue(executor.lastCall().stdin().contains("python train.py"));
    }

    @Test
    void rejectedSubmissionThrows() {
        executor.respond("sbatch", 1, "", "sbatch: error: invalid partition specified: gpu");

        SubmissionException e = assertThrows(SubmissionException.class, () -> scheduler.submit(trainingJob()));
        assertTrue(e.getMessage().contains("invalid partition"));
    }

    @Test
    void unparsableSubmissionOutputThrows() {
        executor.respond("sbatch", "something unexpected");

        assertThrows(SubmissionException.class, () -> scheduler.submit(trainingJob()));
    }

    @Test
    void arraySubmissionAddsRangeAndThrottle() throws SchedulerException {
        executor.respond("sbatch", "777");
        JobArraySpec array = JobArraySpec.of(JobSpec.builder("sweep", "./run.sh").build(), 1, 10)
                .withMaxConcurrent(2);

        ArrayJobResult result = scheduler.submitArray(array);

        assertEquals("777", result.baseJobId());
        assertEquals("--array=1-10:1%2", executor.lastCall().command().get(2));
        assertEquals("777.3", result.taskJobId(3));
    }

    @Test
    void interactiveRunUsesSrun() throws SchedulerException {
        executor.respond("srun", 3, "", "");

        JobResult result = scheduler.submit(JobSpec.builder("shell", "hostname").build(), true);

        assertEquals(JobResult.INTERACTIVE_ID, result.jobId());
        assertEquals(3, result.exitCode());
        assertEquals(JobStatus.FAILED, result.status());
        assertTrue(executor.lastCall().interactive());
        assertTrue(executor.lastCall().command().contains("--pty"));
    }

    // ===== Listings =====

    @Test
    void listActiveJobsFiltersClientSide() throws SchedulerException {
        executor.respond("squeue -h -a", SlurmParserTest.SQUEUE);

        List<JobInfo> bobs = scheduler.listActiveJobs(ActiveJobQuery.forUser("bob"));

        assertEquals(2, bobs.size());
        assertTrue(bobs.stream().allMatch(j -> j.user().equals("bob")));
        assertEquals(1, executor.callCount());
    }

    @Test
    void failingListingRaises() {
        executor.respond("squeue", 1, "", "slurm_load_jobs error: Unable to contact slurm controller");

        assertThrows(SchedulerException.class, () -> scheduler.listActiveJobs(ActiveJobQuery.all()));
    }

    @Test
    void completedJobsAreSortedAndLimited() throws SchedulerException {
        executor.respond("sacct", SlurmParserTest.SACCT);

        List<JobInfo> jobs = scheduler.listCompletedJobs(CompletedJobQuery.recent().withLimit(2));

        assertEquals(List.of("1236", "1235"), jobs.stream().map(JobInfo::jobId).toList());
        assertTrue(executor.lastCall().command().contains("-a"));
    }

    @Test
    void completedJobsForUserPassUserFlag() throws SchedulerException {
        executor.respond("sacct", SlurmParserTest.SACCT);

        scheduler.listCompletedJobs(CompletedJobQuery.forUser("alice").withExitCode(1));

        List<String> cmd = executor.lastCall().command();
        assertEquals("alice", cmd.get(cmd.indexOf("-u") + 1));
    }

    @Test
    void completedJobsWithoutSacctFailBeforeRunningAnything() {
        SlurmScheduler noAccounting = new SlurmScheduler(SlurmConfig.defaults(), executor,
                FakeCommandExecutor.binaries("sbatch", "squeue"), Duration.ofSeconds(5));

        assertFalse(noAccounting.hasAccounting());
        assertThrows(AccountingNotAvailableException.class,
                () -> noAccounting.listCompletedJobs(CompletedJobQuery.recent()));
        assertEquals(0, executor.callCount());
    }

    // ===== Single-job queries =====

    @Test
    void jobDetailsPrefersLiveListingAndAddsOutputPaths() throws SchedulerException {
        executor.respond("squeue -h -j 1234", SlurmParserTest.SQUEUE.lines().findFirst().orElseThrow());
        executor.respond("scontrol show job 1234", "JobId=1234 StdOut=/home/alice/train.out StdErr=/home/alice/train.err");

        JobInfo job = scheduler.jobDetails("1234");

        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals(Path.of("/home/alice/train.out"), job.stdoutPath());
        assertEquals(Optional.of(Path.of("/home/alice/train.err")),
                scheduler.outputPath("1234", OutputStreamKind.STDERR));
    }

    @Test
    void jobDetailsFallsBackToAccounting() throws SchedulerException {
        executor.respond("squeue -h -j", 1, "", "slurm_load_jobs error: Invalid job id specified");
        executor.respond("sacct", SlurmParserTest.SACCT);

        JobInfo job = scheduler.jobDetails("1235");

        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(1, scheduler.exitCode("1235").getAsInt());
    }

    @Test
    void unknownJobIsNotFoundAndStatusUnknown() {
        executor.respond("squeue -h -j", 1, "", "Invalid job id specified");
        executor.respond("sacct", "");

        assertThrows(JobNotFoundException.class, () -> scheduler.jobDetails("999"));
        assertEquals(JobStatus.UNKNOWN, scheduler.status("999"));
    }

    @Test
    void cancelUsesSlurmTaskIdForm() {
        executor.respond("squeue -h -j 5001_3", SlurmParserTest.SQUEUE.lines().skip(2).findFirst().orElseThrow());
        executor.respond("scontrol", 1, "", "");
        executor.respond("scancel", "");

        assertTrue(scheduler.cancel("5001.3"));
        assertEquals(List.of("scancel", "5001_3"), executor.lastCall().command());
    }

    @Test
    void cancelOfFinishedJobIsRefused() {
        executor.respond("squeue -h -j", 1, "", "Invalid job id specified");
        executor.respond("sacct", SlurmParserTest.SACCT);

        assertFalse(scheduler.cancel("1234"));
        assertFalse(executor.wasRun("scancel"));
    }
}
