package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.config.HpcConfig;
import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.scheduler.local.LocalScheduler;
import io.surfworks.hpcrunner.scheduler.pbs.PbsScheduler;
import io.surfworks.hpcrunner.scheduler.sge.SgeScheduler;
import io.surfworks.hpcrunner.scheduler.slurm.SlurmScheduler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry for scheduler implementations.
 * Allows registration and lookup of schedulers by name.
 *
 * <p>Thread-safe. Schedulers are created on demand via factory functions.
 */
public final class SchedulerRegistry {

    private static final Map<String, Supplier<Scheduler>> FACTORIES = new ConcurrentHashMap<>();

    private SchedulerRegistry() {} // Utility class

    /**
     * Registers the SGE, Slurm, PBS and local schedulers.
     *
     * @param config   Backend settings and command timeout
     * @param executor Runs scheduler commands (locally or over SSH)
     * @param resolver Finds scheduler binaries where the commands run
     */
    public static void registerBuiltins(HpcConfig config, CommandExecutor executor, BinaryResolver resolver) {
        register(SgeScheduler.NAME,
                () -> new SgeScheduler(config.sge(), executor, resolver, config.commandTimeout()));
        register(SlurmScheduler.NAME,
                () -> new SlurmScheduler(config.slurm(), executor, resolver, config.commandTimeout()));
        register(PbsScheduler.NAME,
                () -> new PbsScheduler(config.pbs(), executor, resolver, config.commandTimeout()));
        register(LocalScheduler.NAME,
                () -> new LocalScheduler(config.local(), executor));
    }

    /**
     * Registers a scheduler factory.
     *
     * @param name    Scheduler name (e.g., "sge", "slurm")
     * @param factory Factory function that creates scheduler instances
     */
    public static void register(String name, Supplier<Scheduler> factory) {
        FACTORIES.put(name.toLowerCase(), factory);
    }

    /**
     * Unregisters a scheduler.
     */
    public static void unregister(String name) {
        FACTORIES.remove(name.toLowerCase());
    }

    /**
     * Checks if a scheduler is registered.
     */
    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(name.toLowerCase());
    }

    /**
     * Gets a new instance of a registered scheduler.
     *
     * @param name Scheduler name
     * @return A new scheduler instance
     * @throws IllegalArgumentException if the scheduler is not registered
     */
    public static Scheduler get(String name) {
        Supplier<Scheduler> factory = FACTORIES.get(name.toLowerCase());
        if (factory == null) {
            throw new IllegalArgumentException(
                    "Scheduler '" + name + "' not registered. Available: " + available());
        }
        return factory.get();
    }

    /**
     * Gets list of available scheduler names, sorted.
     */
    public static List<String> available() {
        return FACTORIES.keySet().stream().sorted().toList();
    }

    /**
     * Clears all registered schedulers (mainly for testing).
     */
    public static void clear() {
        FACTORIES.clear();
    }
}
