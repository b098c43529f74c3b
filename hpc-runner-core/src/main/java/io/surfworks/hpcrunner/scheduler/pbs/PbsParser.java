package io.surfworks.hpcrunner.scheduler.pbs;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for PBS Pro / Torque command output.
 */
public final class PbsParser {

    private static final Pattern QSUB_ID_PATTERN = Pattern.compile("^(\\d+(?:\\[\\d*\\])?(?:\\.[\\w.-]+)?)$");
    private static final Pattern ARRAY_INDEX_PATTERN = Pattern.compile("\\[(\\d+)\\]");
    private static final Pattern WALLTIME_PATTERN = Pattern.compile("^(\\d+):(\\d{1,2}):(\\d{1,2})$");
    private static final DateTimeFormatter CTIME =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US);

    private PbsParser() {
    }

    /**
     * Parses {@code qstat -f} output into one record per {@code Job Id:} block.
     *
     * <p>Attributes are {@code name = value} lines. Long values wrap onto
     * tab-indented continuation lines, which are joined to the previous value.
     */
    public static List<PbsJobRecord> parseQstatFull(String output) {
        List<PbsJobRecord> jobs = new ArrayList<>();
        if (output == null) {
            return jobs;
        }

        String jobId = null;
        Map<String, String> attributes = new LinkedHashMap<>();
        String lastKey = null;

        for (String line : output.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("Job Id:")) {
                if (jobId != null) {
                    jobs.add(new PbsJobRecord(jobId, attributes));
                }
                jobId = line.substring("Job Id:".length()).strip();
                attributes = new LinkedHashMap<>();
                lastKey = null;
                continue;
            }
            if (jobId == null) {
                continue;
            }

            int eq = line.indexOf(" = ");
            if (line.startsWith("\t") || eq < 0) {
                if (lastKey != null) {
                    attributes.put(lastKey, attributes.get(lastKey) + line.strip());
                }
                continue;
            }
            lastKey = line.substring(0, eq).strip();
            attributes.put(lastKey, line.substring(eq + 3).strip());
        }
        if (jobId != null) {
            jobs.add(new PbsJobRecord(jobId, attributes));
        }
        return jobs;
    }

    /**
     * Extracts the job id from {@code qsub} output: "1234.server", or "1234[].server" for arrays.
     */
    public static Optional<String> parseQsubOutput(String output) {
        if (output == null) {
            return Optional.empty();
        }
        for (String line : output.split("\n")) {
            Matcher m = QSUB_ID_PATTERN.matcher(line.strip());
            if (m.matches()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a PBS {@code job_state} letter to a normalized status.
     */
    public static JobStatus stateToStatus(String state) {
        if (state == null) {
            return JobStatus.UNKNOWN;
        }
        return switch (state.strip().toUpperCase(Locale.ROOT)) {
            case "Q", "W", "H", "T", "S", "U" -> JobStatus.PENDING;
            case "R", "E", "B" -> JobStatus.RUNNING;
            case "C", "X", "F" -> JobStatus.COMPLETED;
            default -> JobStatus.UNKNOWN;
        };
    }

    /**
     * Maps a state together with {@code Exit_status}: a finished job with a
     * non-zero exit status is FAILED.
     */
    public static JobStatus stateToStatus(String state, Integer exitStatus) {
        JobStatus status = stateToStatus(state);
        if (status == JobStatus.COMPLETED && exitStatus != null && exitStatus != 0) {
            return JobStatus.FAILED;
        }
        return status;
    }

    /**
     * Parses a PBS walltime ("HH:MM:SS", hours may exceed 24) or a plain second count.
     */
    static Duration parseWalltime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher m = WALLTIME_PATTERN.matcher(value.strip());
        if (m.matches()) {
            return Duration.ofHours(Long.parseLong(m.group(1)))
                    .plusMinutes(Long.parseLong(m.group(2)))
                    .plusSeconds(Long.parseLong(m.group(3)));
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.strip()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.strip().replaceAll("\\s+", " ");
        try {
            return LocalDateTime.parse(normalized, CTIME).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(normalized));
            } catch (NumberFormatException e2) {
                return null;
            }
        }
    }

    /**
     * Strips the "host:" prefix from an Output_Path/Error_Path value.
     */
    static Path parseOutputPath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        int colon = value.indexOf(':');
        String path = colon >= 0 ? value.substring(colon + 1) : value;
        return path.isBlank() ? null : Path.of(path);
    }

    /**
     * Extracts job ids from a {@code depend} value such as {@code afterok:12.srv:13.srv,afterany:14.srv}.
     */
    static List<String> parseDependencies(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        List<String> ids = new ArrayList<>();
        for (String clause : value.split(",")) {
            String[] parts = clause.split(":");
            for (int i = 1; i < parts.length; i++) {
                String id = parts[i].strip();
                int at = id.indexOf('@');
                ids.add(at >= 0 ? id.substring(0, at) : id);
            }
        }
        return ids.isEmpty() ? null : ids;
    }

    /**
     * First host of an {@code exec_host} value like {@code node1/0*4+node2/0*4}.
     */
    static String parseExecHost(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String first = value.split("\\+")[0];
        int slash = first.indexOf('/');
        return slash >= 0 ? first.substring(0, slash) : first;
    }

    static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Converts a {@code qstat -f} block to a JobInfo.
     */
    static JobInfo toJobInfo(PbsJobRecord job) {
        Integer exitStatus = parseInteger(job.get("Exit_status"));
        String owner = job.get("Job_Owner");
        if (owner != null && owner.contains("@")) {
            owner = owner.substring(0, owner.indexOf('@'));
        }

        Integer cpu = parseInteger(job.get("Resource_List.ncpus"));
        if (cpu == null) {
            cpu = parseInteger(job.get("resources_used.ncpus"));
        }

        Instant end = parseTime(job.get("obittime"));
        if (end == null) {
            end = parseTime(job.get("comp_time"));
        }

        String arrayIndex = job.get("array_index");
        if (arrayIndex == null) {
            Matcher m = ARRAY_INDEX_PATTERN.matcher(job.jobId());
            if (m.find()) {
                arrayIndex = m.group(1);
            }
        }

        return JobInfo.builder(job.jobId())
                .name(job.get("Job_Name"))
                .user(owner)
                .status(stateToStatus(job.get("job_state"), exitStatus))
                .queue(job.get("queue"))
                .submitTime(parseTime(job.get("qtime") != null ? job.get("qtime") : job.get("ctime")))
                .startTime(parseTime(job.get("stime")))
                .endTime(end)
                .runtime(parseWalltime(job.get("resources_used.walltime")))
                .cpu(cpu)
                .memory(job.get("Resource_List.mem"))
                .gpu(parseInteger(job.get("Resource_List.ngpus")))
                .exitCode(exitStatus)
                .stdoutPath(parseOutputPath(job.get("Output_Path")))
                .stderrPath(parseOutputPath(job.get("Error_Path")))
                .node(parseExecHost(job.get("exec_host")))
                .dependencies(parseDependencies(job.get("depend")))
                .arrayTaskId(arrayIndex)
                .build();
    }
}
