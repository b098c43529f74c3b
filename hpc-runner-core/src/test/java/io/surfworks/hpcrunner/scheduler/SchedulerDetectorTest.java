package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.testing.FakeCommandExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SchedulerDetector")
class SchedulerDetectorTest {

    private FakeCommandExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new FakeCommandExecutor();
    }

    private SchedulerDetector detector(Map<String, String> env, String... binaries) {
        return new SchedulerDetector(env, FakeCommandExecutor.binaries(binaries), executor);
    }

    @Test
    @DisplayName("environment override beats everything, lower-cased")
    void environmentOverrideWins() {
        SchedulerDetector detector = detector(Map.of("HPC_SCHEDULER", " PBS ", "SGE_ROOT", "/opt/sge"),
                "qsub", "sbatch", "squeue");

        assertEquals("pbs", detector.detect("slurm"));
        assertEquals(0, executor.callCount());
    }

    @Test
    @DisplayName("configured name is used when there is no override")
    void configuredNameIsUsed() {
        assertEquals("slurm", detector(Map.of(), "qsub").detect("Slurm"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"auto", "AUTO", " ", ""})
    @DisplayName("auto and blank configuration fall through to probing")
    void autoFallsThrough(String configured) {
        assertEquals("local", detector(Map.of()).detect(configured));
    }

    @Test
    @DisplayName("SGE_ROOT with qsub means Grid Engine")
    void sgeRootMeansGridEngine() {
        assertEquals("sge", detector(Map.of("SGE_ROOT", "/opt/sge"), "qsub").detect());
        assertFalse(executor.wasRun("qstat"));
    }

    @Test
    @DisplayName("qstat -help banner identifies Grid Engine without SGE_ROOT")
    void qstatBannerIdentifiesGridEngine() {
        executor.respond("qstat -help", "SGE 8.1.9\nusage: qstat [options]");

        assertEquals("sge", detector(Map.of(), "qsub", "qstat").detect());
        assertTrue(executor.wasRun("qstat -help"));
    }

    @Test
    @DisplayName("sbatch and squeue mean Slurm")
    void slurmBinaries() {
        assertEquals("slurm", detector(Map.of(), "sbatch", "squeue").detect());
        assertEquals("local", detector(Map.of(), "sbatch").detect());
    }

    @Test
    @DisplayName("qsub with PBS_CONF_FILE means PBS")
    void pbsConfFile() {
        executor.respond("qstat -help", 2, "", "qstat: invalid option -- 'h'");

        assertEquals("pbs", detector(Map.of("PBS_CONF_FILE", "/etc/pbs.conf"), "qsub").detect());
    }

    @Test
    @DisplayName("Slurm is preferred over an unidentified qsub")
    void slurmBeforePbs() {
        SchedulerDetector detector = detector(Map.of("PBS_CONF_FILE", "/etc/pbs.conf"), "qsub", "sbatch", "squeue");

        assertEquals("slurm", detector.detect());
    }

    @Test
    @DisplayName("a hung probe counts as a negative answer")
    void probeTimeoutIsNegative() {
        executor.timeOut("qstat");

        assertEquals("local", detector(Map.of(), "qsub").detect());
    }
}
