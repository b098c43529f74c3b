package io.surfworks.hpcrunner.job;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of what to run - the "recipe" for a batch job.
 *
 * @param name         Human-readable job name
 * @param command      Shell command line executed by the job
 * @param queue        Queue or partition (null = scheduler default)
 * @param cpu          Number of cores / slots (null = scheduler default)
 * @param memory       Memory request such as "16G" (null = scheduler default)
 * @param gpu          Number of GPUs (null = none requested)
 * @param timeLimit    Wall-clock limit (null = scheduler default)
 * @param workDir      Working directory (null = current directory)
 * @param stdoutPath   Standard output file (null = scheduler default)
 * @param stderrPath   Standard error file (null = scheduler default)
 * @param mergeOutput  Whether stderr is merged into stdout
 * @param environment  Additional environment variables exported by the job script
 * @param dependencies Ids of jobs that must finish successfully first
 * @param rawArgs      Extra native arguments keyed by scheduler name ("sge", "slurm", ...)
 */
public record JobSpec(
        String name,
        String command,
        String queue,
        Integer cpu,
        String memory,
        Integer gpu,
        Duration timeLimit,
        Path workDir,
        Path stdoutPath,
        Path stderrPath,
        boolean mergeOutput,
        Map<String, String> environment,
        List<String> dependencies,
        Map<String, List<String>> rawArgs
) {

    public JobSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(command, "command cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (command.isBlank()) {
            throw new IllegalArgumentException("command cannot be blank");
        }
        if (cpu != null && cpu <= 0) {
            throw new IllegalArgumentException("cpu must be positive");
        }
        if (gpu != null && gpu < 0) {
            throw new IllegalArgumentException("gpu must be non-negative");
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }

        environment = environment == null ? Map.of() : Map.copyOf(environment);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (rawArgs == null) {
            rawArgs = Map.of();
        } else {
            Map<String, List<String>> copy = new HashMap<>();
            rawArgs.forEach((k, v) -> copy.put(k.toLowerCase(), List.copyOf(v)));
            rawArgs = Map.copyOf(copy);
        }
    }

    /**
     * Creates a builder for a job running the given command.
     */
    public static Builder builder(String name, String command) {
        return new Builder(name, command);
    }

    /**
     * Returns the native arguments registered for a scheduler, or an empty list.
     */
    public List<String> rawArgs(String schedulerName) {
        return rawArgs.getOrDefault(schedulerName.toLowerCase(), List.of());
    }

    /**
     * Returns true if this job requests GPUs.
     */
    public boolean requiresGpu() {
        return gpu != null && gpu > 0;
    }

    /**
     * Builder for JobSpec.
     */
    public static class Builder {
        private final String name;
        private final String command;
        private String queue;
        private Integer cpu;
        private String memory;
        private Integer gpu;
        private Duration timeLimit;
        private Path workDir;
        private Path stdoutPath;
        private Path stderrPath;
        private boolean mergeOutput;
        private Map<String, String> environment;
        private List<String> dependencies;
        private final Map<String, List<String>> rawArgs = new HashMap<>();

        private Builder(String name, String command) {
            this.name = name;
            this.command = command;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder cpu(Integer cpu) {
            this.cpu = cpu;
            return this;
        }

        public Builder memory(String memory) {
            this.memory = memory;
            return this;
        }

        public Builder gpu(Integer gpu) {
            this.gpu = gpu;
            return this;
        }

        public Builder timeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder stdoutPath(Path stdoutPath) {
            this.stdoutPath = stdoutPath;
            return this;
        }

        public Builder stderrPath(Path stderrPath) {
            this.stderrPath = stderrPath;
            return this;
        }

        public Builder mergeOutput(boolean mergeOutput) {
            this.mergeOutput = mergeOutput;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder rawArgs(String schedulerName, List<String> args) {
            this.rawArgs.put(schedulerName.toLowerCase(), args);
            return this;
        }

        public JobSpec build() {
            return new JobSpec(
                    name, command, queue, cpu, memory, gpu, timeLimit,
                    workDir, stdoutPath, stderrPath, mergeOutput,
                    environment, dependencies, rawArgs
            );
        }
    }
}
