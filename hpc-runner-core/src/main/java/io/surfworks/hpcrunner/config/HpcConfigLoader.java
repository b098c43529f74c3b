package io.surfworks.hpcrunner.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves HpcConfig.
 *
 * <p>Missing keys keep their defaults. A file that cannot be read or parsed is
 * reported as a warning and the defaults are used instead.
 *
 * <p>CLI arguments are handled by the caller and merged into the config.
 */
public final class HpcConfigLoader {

    private static final Logger LOG = Logger.getLogger(HpcConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private HpcConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static HpcConfig load() {
        return load(HpcConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or defaults if the file is absent or unreadable
     */
    public static HpcConfig load(Path configFile) {
        HpcConfig defaults = HpcConfig.defaults();
        if (!Files.exists(configFile)) {
            return defaults;
        }
        try {
            return parse(JSON.readTree(configFile.toFile()), defaults);
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config file " + configFile, e);
            return defaults;
        }
    }

    /**
     * Saves configuration to the default config file.
     *
     * @throws IOException if saving fails
     */
    public static void save(HpcConfig config) throws IOException {
        save(config, HpcConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(HpcConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), toJson(config));
    }

    /**
     * Renders a configuration as the JSON tree written by {@link #save}.
     */
    public static ObjectNode toJson(HpcConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("scheduler", config.scheduler());
        root.put("refreshIntervalSeconds", config.refreshIntervalSeconds());
        root.put("commandTimeoutSeconds", config.commandTimeoutSeconds());

        ObjectNode sge = root.putObject("sge");
        sge.put("parallelEnvironment", config.sge().parallelEnvironment());
        sge.put("memoryResource", config.sge().memoryResource());
        sge.put("timeResource", config.sge().timeResource());

        ObjectNode slurm = root.putObject("slurm");
        if (config.slurm().partition() != null) {
            slurm.put("partition", config.slurm().partition());
        }

        root.putObject("pbs").put("jobHistory", config.pbs().jobHistory());
        root.putObject("local").put("maxConcurrentJobs", config.local().maxConcurrentJobs());

        if (config.ssh() != null) {
            ObjectNode ssh = root.putObject("ssh");
            ssh.put("host", config.ssh().host());
            ssh.put("user", config.ssh().user());
            if (config.ssh().keyPath() != null) {
                ssh.put("keyPath", config.ssh().keyPath().toString());
            }
            ssh.put("connectTimeoutSeconds", config.ssh().connectTimeoutSeconds());
        }
        return root;
    }

    static HpcConfig parse(JsonNode root, HpcConfig base) {
        HpcConfig config = base
                .withScheduler(getStringOrDefault(root, "scheduler", base.scheduler()))
                .withRefreshInterval(getIntOrDefault(root, "refreshIntervalSeconds", base.refreshIntervalSeconds()))
                .withCommandTimeout(getIntOrDefault(root, "commandTimeoutSeconds", base.commandTimeoutSeconds()));

        if (root.has("sge")) {
            JsonNode node = root.get("sge");
            SgeConfig sge = base.sge();
            config = config.withSge(new SgeConfig(
                    getStringOrDefault(node, "parallelEnvironment", sge.parallelEnvironment()),
                    getStringOrDefault(node, "memoryResource", sge.memoryResource()),
                    getStringOrDefault(node, "timeResource", sge.timeResource())
            ));
        }

        if (root.has("slurm")) {
            JsonNode node = root.get("slurm");
            config = config.withSlurm(new SlurmConfig(getStringOrDefault(node, "partition", null)));
        }

        if (root.has("pbs")) {
            JsonNode node = root.get("pbs");
            config = config.withPbs(new PbsConfig(node.path("jobHistory").asBoolean(base.pbs().jobHistory())));
        }

        if (root.has("local")) {
            JsonNode node = root.get("local");
            config = config.withLocal(new LocalConfig(
                    getIntOrDefault(node, "maxConcurrentJobs", base.local().maxConcurrentJobs())));
        }

        if (root.has("ssh")) {
            JsonNode node = root.get("ssh");
            if (node.has("host") && node.has("user")) {
                Path keyPath = node.has("keyPath") ? Path.of(node.get("keyPath").asText()) : null;
                config = config.withSsh(new SshConfig(
                        node.get("host").asText(),
                        node.get("user").asText(),
                        keyPath,
                        getIntOrDefault(node, "connectTimeoutSeconds", SshConfig.DEFAULT_CONNECT_TIMEOUT)
                ));
            } else {
                LOG.warning("Ignoring ssh section without host and user");
            }
        }

        return config;
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.hasNonNull(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }

    private static int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        if (node.hasNonNull(field)) {
            return node.get(field).asInt(defaultValue);
        }
        return defaultValue;
    }
}
