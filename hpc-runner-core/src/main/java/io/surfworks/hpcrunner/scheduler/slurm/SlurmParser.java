package io.surfworks.hpcrunner.scheduler.slurm;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
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
 * Parsers for Slurm command output.
 *
 * <p>Listings are requested in pipe-delimited form ({@code squeue -o} with
 * {@link #SQUEUE_FORMAT}, {@code sacct -P} with {@link #SACCT_FIELDS}), so
 * parsing is positional. Rows with too few fields are skipped.
 */
public final class SlurmParser {

    /** squeue output format: id, name, user, state, partition, submit, start, elapsed, cpus, memory, gres, nodes, dependency */
    public static final String SQUEUE_FORMAT = "%i|%j|%u|%T|%P|%V|%S|%M|%C|%m|%b|%N|%E";

    /** sacct fields, in the order {@link #parseSacct} expects them */
    public static final String SACCT_FIELDS =
            "JobID,JobName,User,State,Partition,Submit,Start,End,Elapsed,AllocCPUS,ReqMem,AllocTRES,NodeList,ExitCode";

    private static final Pattern SUBMITTED_PATTERN = Pattern.compile("Submitted batch job (\\d+)");
    private static final Pattern PARSABLE_PATTERN = Pattern.compile("^(\\d+)(?:;\\S+)?$");
    private static final Pattern GPU_PATTERN = Pattern.compile("gpu(?::[^:,=]+)?[:=](\\d+)");
    private static final Pattern DEPENDENCY_ID_PATTERN = Pattern.compile("^(\\d+(?:_\\d+)?)");

    private SlurmParser() {
    }

    // ===== Listings =====

    /**
     * Parses {@code squeue -h -o SQUEUE_FORMAT} output.
     */
    public static List<SlurmJobRecord> parseSqueue(String output) {
        List<SlurmJobRecord> jobs = new ArrayList<>();
        for (String line : lines(output)) {
            String[] f = line.split("\\|", -1);
            if (f.length < 13) {
                continue;
            }
            String[] id = splitArrayId(f[0].strip());
            jobs.add(new SlurmJobRecord(
                    id[0], id[1],
                    f[1], f[2], f[3], blankToNull(f[4]),
                    parseTime(f[5]), parseTime(f[6]), null,
                    parseElapsed(f[7]),
                    parseInteger(f[8]),
                    normalizeMemory(f[9]),
                    parseGpuCount(f[10]),
                    nodeList(f[11]),
                    parseDependencies(f[12]),
                    null
            ));
        }
        return jobs;
    }

    /**
     * Parses {@code sacct -P -n -X -o SACCT_FIELDS} output.
     * Job step rows ({@code 123.batch}) are skipped.
     */
    public static List<SlurmJobRecord> parseSacct(String output) {
        List<SlurmJobRecord> jobs = new ArrayList<>();
        for (String line : lines(output)) {
            String[] f = line.split("\\|", -1);
            if (f.length < 14 || f[0].contains(".")) {
                continue;
            }
            String[] id = splitArrayId(f[0].strip());
            jobs.add(new SlurmJobRecord(
                    id[0], id[1],
                    f[1], f[2], f[3], blankToNull(f[4]),
                    parseTime(f[5]), parseTime(f[6]), parseTime(f[7]),
                    parseElapsed(f[8]),
                    parseInteger(f[9]),
                    normalizeMemory(f[10]),
                    parseGpuCount(f[11]),
                    nodeList(f[12]),
                    null,
                    parseExitCode(f[13]).orElse(null)
            ));
        }
        return jobs;
    }

    /**
     * Parses {@code scontrol show job} output into Key=Value pairs.
     * Values run to the next whitespace; a key seen twice keeps its last value.
     */
    public static Map<String, String> parseScontrol(String output) {
        Map<String, String> info = new LinkedHashMap<>();
        if (output == null) {
            return info;
        }
        for (String token : output.strip().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq > 0) {
                info.put(token.substring(0, eq), token.substring(eq + 1));
            }
        }
        return info;
    }

    // ===== Submission =====

    /**
     * Extracts the job id from {@code sbatch} output: either
     * {@code Submitted batch job 123} or the {@code --parsable} form {@code 123[;cluster]}.
     */
    public static Optional<String> parseSbatchOutput(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher m = SUBMITTED_PATTERN.matcher(output);
        if (m.find()) {
            return Optional.of(m.group(1));
        }
        for (String line : lines(output)) {
            m = PARSABLE_PATTERN.matcher(line.strip());
            if (m.matches()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    // ===== Field parsers =====

    /**
     * Maps a Slurm job state, long or short form, to a normalized status.
     * Trailing qualifiers such as "CANCELLED by 1000" are ignored.
     */
    public static JobStatus stateToStatus(String state) {
        if (state == null || state.isBlank()) {
            return JobStatus.UNKNOWN;
        }
        String word = state.strip().split("[\\s+]")[0].toUpperCase(Locale.ROOT);
        return switch (word) {
            case "PENDING", "PD", "CONFIGURING", "CF", "REQUEUED", "RQ",
                 "REQUEUE_HOLD", "REQUEUE_FED", "RESV_DEL_HOLD", "SUSPENDED", "S" -> JobStatus.PENDING;
            case "RUNNING", "R", "COMPLETING", "CG", "STAGE_OUT", "SO", "SIGNALING", "SI" -> JobStatus.RUNNING;
            case "COMPLETED", "CD" -> JobStatus.COMPLETED;
            case "FAILED", "F", "NODE_FAIL", "NF", "OUT_OF_MEMORY", "OOM",
                 "BOOT_FAIL", "BF", "DEADLINE", "DL" -> JobStatus.FAILED;
            case "CANCELLED", "CA", "PREEMPTED", "PR", "REVOKED", "RV" -> JobStatus.CANCELLED;
            case "TIMEOUT", "TO" -> JobStatus.TIMEOUT;
            default -> JobStatus.UNKNOWN;
        };
    }

    /**
     * Parses elapsed times such as "0:05", "1:23:45" or "1-12:34:56".
     * Returns null for empty or unparsable values.
     */
    public static Duration parseElapsed(String elapsed) {
        if (elapsed == null || elapsed.isBlank() || "INVALID".equals(elapsed) || "UNLIMITED".equals(elapsed)) {
            return null;
        }
        try {
            String value = elapsed.strip();
            if (value.contains("-")) {
                String[] dayTime = value.split("-", 2);
                return Duration.ofDays(Long.parseLong(dayTime[0])).plus(parseHms(dayTime[1]));
            }
            return parseHms(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Duration parseHms(String hms) {
        String[] parts = hms.split(":");
        if (parts.length == 1) {
            return Duration.ofMinutes(Long.parseLong(parts[0]));
        } else if (parts.length == 2) {
            return Duration.ofMinutes(Long.parseLong(parts[0]))
                    .plusSeconds(Math.round(Double.parseDouble(parts[1])));
        } else if (parts.length == 3) {
            return Duration.ofHours(Long.parseLong(parts[0]))
                    .plusMinutes(Long.parseLong(parts[1]))
                    .plusSeconds(Math.round(Double.parseDouble(parts[2])));
        }
        throw new NumberFormatException("Bad elapsed time: " + hms);
    }

    /**
     * Parses an {@code ExitCode} value {@code code:signal} into the exit code.
     */
    public static Optional<Integer> parseExitCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String code = value.strip().split(":")[0];
        try {
            return Optional.of(Integer.valueOf(code));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses Slurm timestamps ("2024-01-15T10:30:00"); "Unknown", "N/A" and "None" give null.
     */
    static Instant parseTime(String value) {
        String v = blankToNull(value);
        if (v == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(v).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Splits "123_4" into {"123", "4"} and "123_[5-10%2]" into {"123", "5-10%2"}.
     */
    static String[] splitArrayId(String id) {
        int underscore = id.indexOf('_');
        if (underscore < 0) {
            return new String[]{id, null};
        }
        String task = id.substring(underscore + 1);
        if (task.startsWith("[") && task.endsWith("]")) {
            task = task.substring(1, task.length() - 1);
        }
        return new String[]{id.substring(0, underscore), task};
    }

    static Integer parseGpuCount(String gres) {
        if (gres == null) {
            return null;
        }
        Matcher m = GPU_PATTERN.matcher(gres);
        if (m.find()) {
            return parseInteger(m.group(1));
        }
        return null;
    }

    /**
     * Extracts job ids from a dependency expression such as
     * {@code afterok:123(unfulfilled),afterany:456_2}.
     */
    static List<String> parseDependencies(String value) {
        String v = blankToNull(value);
        if (v == null) {
            return null;
        }
        List<String> ids = new ArrayList<>();
        for (String clause : v.split("[,?]")) {
            String[] parts = clause.split(":");
            for (int i = 1; i < parts.length; i++) {
                Matcher m = DEPENDENCY_ID_PATTERN.matcher(parts[i]);
                if (m.find()) {
                    ids.add(m.group(1));
                }
            }
        }
        return ids.isEmpty() ? null : ids;
    }

    private static String normalizeMemory(String value) {
        String v = blankToNull(value);
        if (v == null || "0".equals(v)) {
            return null;
        }
        // ReqMem carries a per-node/per-cpu suffix on older releases
        if (v.endsWith("n") || v.endsWith("c")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String nodeList(String value) {
        String v = blankToNull(value);
        return v == null || v.startsWith("None") ? null : v;
    }

    static Integer parseInteger(String value) {
        String v = blankToNull(value);
        if (v == null) {
            return null;
        }
        try {
            return Integer.valueOf(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip();
        if (v.isEmpty() || "Unknown".equals(v) || "N/A".equals(v) || "None".equals(v) || "(null)".equals(v)) {
            return null;
        }
        return v;
    }

    private static List<String> lines(String output) {
        List<String> result = new ArrayList<>();
        if (output == null) {
            return result;
        }
        for (String line : output.split("\n")) {
            if (!line.isBlank()) {
                result.add(line);
            }
        }
        return result;
    }

    // ===== Conversion =====

    static JobInfo toJobInfo(SlurmJobRecord job) {
        return JobInfo.builder(job.jobId())
                .name(job.name())
                .user(job.user())
                .status(stateToStatus(job.state()))
                .queue(job.partition())
                .submitTime(job.submitTime())
                .startTime(job.startTime())
                .endTime(job.endTime())
                .runtime(job.elapsed())
                .cpu(job.cpus())
                .memory(job.memory())
                .gpu(job.gpus())
                .exitCode(job.exitCode())
                .node(job.nodes())
                .dependencies(job.dependencies())
                .arrayTaskId(job.arrayTaskId())
                .build();
    }
}
