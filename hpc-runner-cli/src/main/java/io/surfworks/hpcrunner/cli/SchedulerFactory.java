package io.surfworks.hpcrunner.cli;

import io.surfworks.hpcrunner.config.HpcConfig;
import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandBinaryResolver;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.exec.PathBinaryResolver;
import io.surfworks.hpcrunner.exec.ProcessCommandExecutor;
import io.surfworks.hpcrunner.exec.SshCommandExecutor;
import io.surfworks.hpcrunner.scheduler.Scheduler;
import io.surfworks.hpcrunner.scheduler.SchedulerDetector;
import io.surfworks.hpcrunner.scheduler.SchedulerRegistry;

import java.util.logging.Logger;

/**
 * Chooses and creates the scheduler a command runs against.
 */
interface SchedulerFactory {

    /**
     * Resolves the scheduler name. An explicit name wins; otherwise the
     * environment override, the configured name and detection apply in turn.
     *
     * @param requested Name given on the command line, or null
     */
    String resolveName(String requested);

    /**
     * Creates a scheduler by resolved name.
     *
     * @throws IllegalArgumentException if no scheduler has that name
     */
    Scheduler open(String name);

    /**
     * Creates the factory used by the command line: builtin schedulers driven
     * through local processes, or over SSH when the config names a head node.
     */
    static SchedulerFactory forConfig(HpcConfig config) {
        Logger log = Logger.getLogger(SchedulerFactory.class.getName());
        CommandExecutor executor;
        BinaryResolver resolver;
        if (config.ssh() != null) {
            executor = new SshCommandExecutor(config.ssh());
            resolver = new CommandBinaryResolver(executor);
            log.fine(() -> "Running scheduler commands on " + config.ssh().target());
        } else {
            executor = new ProcessCommandExecutor();
            resolver = new PathBinaryResolver();
        }
        SchedulerRegistry.registerBuiltins(config, executor, resolver);
        SchedulerDetector detector = new SchedulerDetector(System.getenv(), resolver, executor);

        return new SchedulerFactory() {
            @Override
            public String resolveName(String requested) {
                if (requested != null && !requested.isBlank()) {
                    return requested.strip().toLowerCase();
                }
                return detector.detect(config.scheduler());
            }

            @Override
            public Scheduler open(String name) {
                return SchedulerRegistry.get(name);
            }
        };
    }
}
