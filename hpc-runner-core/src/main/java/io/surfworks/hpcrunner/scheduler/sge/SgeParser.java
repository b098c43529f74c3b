package io.surfworks.hpcrunner.scheduler.sge;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.io.SAXReader;

import java.io.StringReader;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for Grid Engine command output.
 *
 * <p>None of these methods throw on bad input: malformed or partial output
 * yields empty results, so a flaky {@code qstat} cannot break a polling loop.
 */
public final class SgeParser {

    private static final Logger LOG = Logger.getLogger(SgeParser.class.getName());

    private static final Pattern JOB_PATTERN = Pattern.compile("Your job (\\d+)");
    private static final Pattern JOB_ARRAY_PATTERN = Pattern.compile("Your job-array (\\d+)");

    private static final DateTimeFormatter PLAIN_TIME =
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.US);
    private static final DateTimeFormatter QACCT_CTIME =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US);
    private static final DateTimeFormatter QACCT_MILLIS =
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss.SSS", Locale.US);

    private SgeParser() {
    }

    // ===== qstat -xml =====

    /**
     * Parses {@code qstat -xml} output.
     *
     * <p>Running jobs (under {@code queue_info}) and pending jobs (under
     * {@code job_info}) are both collected, in document order. Elements without
     * a {@code JB_job_number} are dropped. Array tasks sharing a job number are
     * keyed as {@code jobId.task}, other jobs by their id.
     *
     * @param xml Raw command output
     * @return Records keyed by job id, empty if the document is malformed
     */
    public static Map<String, SgeJobRecord> parseQstatXml(String xml) {
        if (xml == null || xml.isBlank()) {
            return new LinkedHashMap<>();
        }
        return readQstatXml(xml).orElseGet(LinkedHashMap::new);
    }

    /**
     * Parses {@code qstat -xml} output, distinguishing a malformed document
     * from one that lists no jobs.
     *
     * @return Records as in {@link #parseQstatXml}, or empty if the document is not well-formed
     */
    static Optional<Map<String, SgeJobRecord>> readQstatXml(String xml) {
        Document doc;
        try {
            doc = SAXReader.createDefault().read(new StringReader(xml));
        } catch (DocumentException e) {
            LOG.fine(() -> "Discarding malformed qstat XML: " + e.getMessage());
            return Optional.empty();
        }

        Map<String, SgeJobRecord> jobs = new LinkedHashMap<>();
        List<Element> jobElements = new ArrayList<>();
        collectJobLists(doc.getRootElement(), jobElements);
        for (Element element : jobElements) {
            SgeJobRecord job = parseJobElement(element);
            if (job != null) {
                jobs.put(job.key(), job);
            }
        }
        return Optional.of(jobs);
    }

    private static void collectJobLists(Element element, List<Element> out) {
        for (Element child : element.elements()) {
            if ("job_list".equals(child.getName())) {
                out.add(child);
            } else {
                collectJobLists(child, out);
            }
        }
    }

    private static SgeJobRecord parseJobElement(Element element) {
        String jobId = text(element, "JB_job_number");
        if (jobId == null) {
            return null;
        }

        String queue = null;
        String host = null;
        String queueName = text(element, "queue_name");
        if (queueName != null) {
            int at = queueName.indexOf('@');
            queue = at >= 0 ? queueName.substring(0, at) : queueName;
            host = at >= 0 ? queueName.substring(at + 1) : null;
        } else {
            queue = text(element, "hard_req_queue");
        }

        return new SgeJobRecord(
                jobId,
                text(element, "JB_name"),
                text(element, "JB_owner"),
                text(element, "state"),
                queue,
                host,
                parseInteger(text(element, "slots")),
                parseTimestamp(text(element, "JB_submission_time")),
                parseTimestamp(text(element, "JAT_start_time")),
                text(element, "tasks"),
                text(element, "JAT_prio")
        );
    }

    private static String text(Element parent, String name) {
        String value = parent.elementTextTrim(name);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Parses a qstat timestamp: epoch seconds, or an ISO local date-time as
     * printed by newer Grid Engine releases. Returns null if neither applies.
     */
    static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value));
        } catch (NumberFormatException e) {
            try {
                return LocalDateTime.parse(value).atZone(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }

    // ===== plain qstat =====

    /**
     * Parses plain-text {@code qstat} output, the fallback when XML is unavailable.
     *
     * <p>Everything before the first line of dashes is header. Data lines are
     * split on whitespace: id, priority, name, user, state, submit/start date
     * and time, then queue at token 7, slots at token 8 and task id at token 9.
     * Columns are read by position only: a pending job with a blank queue
     * column shifts its slots into the queue position. Use {@code qstat -xml}
     * where exact fields matter. Lines with fewer than five tokens are skipped.
     *
     * @param output Raw command output
     * @return Records keyed as in {@link #parseQstatXml}
     */
    public static Map<String, SgeJobRecord> parseQstatPlain(String output) {
        Map<String, SgeJobRecord> jobs = new LinkedHashMap<>();
        if (output == null) {
            return jobs;
        }

        boolean dataStarted = false;
        for (String line : output.strip().split("\n")) {
            if (line.startsWith("-")) {
                dataStarted = true;
                continue;
            }
            if (!dataStarted) {
                continue;
            }

            String[] parts = line.trim().split("\\s+");
            if (parts.length < 5) {
                continue;
            }

            String state = parts[4];
            Instant when = parts.length >= 7 ? parseLocal(parts[5] + " " + parts[6], PLAIN_TIME) : null;
            boolean started = stateToStatus(state) == JobStatus.RUNNING;

            String queue = null;
            String host = null;
            if (parts.length > 7) {
                int at = parts[7].indexOf('@');
                queue = at >= 0 ? parts[7].substring(0, at) : parts[7];
                host = at >= 0 ? parts[7].substring(at + 1) : null;
            }
            Integer slots = parts.length > 8 ? parseInteger(parts[8]) : null;
            String task = parts.length > 9 ? parts[9] : null;

            SgeJobRecord job = new SgeJobRecord(
                    parts[0],
                    parts[2],
                    parts[3],
                    state,
                    queue,
                    host,
                    slots,
                    started ? null : when,
                    started ? when : null,
                    task,
                    parts[1]
            );
            jobs.put(job.key(), job);
        }
        return jobs;
    }

    private static Instant parseLocal(String value, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(value, format).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // ===== qacct =====

    /**
     * Parses one {@code qacct -j} record into key/value pairs.
     *
     * <p>Lines starting with {@code =} are record separators and skipped. The
     * first whitespace-delimited word of each other line is the key and the
     * trimmed remainder the value; lines without a value are ignored. Later
     * duplicates overwrite earlier ones.
     */
    public static Map<String, String> parseQacct(String output) {
        Map<String, String> info = new LinkedHashMap<>();
        if (output == null) {
            return info;
        }
        for (String line : output.strip().split("\n")) {
            putQacctLine(info, line);
        }
        return info;
    }

    /**
     * Splits a multi-job {@code qacct} dump into one map per record.
     */
    public static List<Map<String, String>> parseQacctRecords(String output) {
        List<Map<String, String>> records = new ArrayList<>();
        if (output == null) {
            return records;
        }

        Map<String, String> current = new LinkedHashMap<>();
        for (String line : output.split("\n")) {
            if (line.startsWith("=")) {
                if (!current.isEmpty()) {
                    records.add(current);
                    current = new LinkedHashMap<>();
                }
                continue;
            }
            putQacctLine(current, line);
        }
        if (!current.isEmpty()) {
            records.add(current);
        }
        return records;
    }

    private static void putQacctLine(Map<String, String> info, String line) {
        if (line.startsWith("=")) {
            return;
        }
        String[] parts = line.strip().split("\\s+", 2);
        if (parts.length == 2) {
            info.put(parts[0], parts[1].strip());
        }
    }

    /**
     * Converts a qacct record to a JobInfo, or null if it carries no job number.
     */
    static JobInfo qacctToJobInfo(Map<String, String> record) {
        String jobId = record.get("jobnumber");
        if (jobId == null || jobId.isBlank()) {
            return null;
        }

        Integer exitCode = parseInteger(record.get("exit_status"));
        String failed = record.getOrDefault("failed", "0");
        boolean success = exitCode != null && exitCode == 0 && failed.startsWith("0");

        Instant start = parseQacctTime(record.get("start_time"));
        Instant end = parseQacctTime(record.get("end_time"));
        Duration runtime = parseWallclock(record.get("ru_wallclock"));
        if (runtime == null && start != null && end != null) {
            runtime = Duration.between(start, end);
        }

        String taskId = record.get("taskid");
        return JobInfo.builder(jobId)
                .name(record.get("jobname"))
                .user(record.get("owner"))
                .status(success ? JobStatus.COMPLETED : JobStatus.FAILED)
                .queue(record.get("qname"))
                .submitTime(parseQacctTime(record.get("qsub_time")))
                .startTime(start)
                .endTime(end)
                .runtime(runtime)
                .cpu(parseInteger(record.get("slots")))
                .memory(nullIfUnset(record.get("maxvmem")))
                .exitCode(exitCode)
                .node(nullIfUnset(record.get("hostname")))
                .arrayTaskId(taskId == null || "undefined".equals(taskId) ? null : taskId)
                .build();
    }

    /**
     * Parses a qacct time stamp in either the classic ctime layout
     * ("Mon Jan  5 10:30:00 2024") or the numeric layout of newer releases.
     */
    static Instant parseQacctTime(String value) {
        value = nullIfUnset(value);
        if (value == null) {
            return null;
        }
        String normalized = value.replaceAll("\\s+", " ");
        for (DateTimeFormatter format : List.of(QACCT_CTIME, QACCT_MILLIS, PLAIN_TIME)) {
            Instant parsed = parseLocal(normalized, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return parseTimestamp(normalized);
    }

    private static Duration parseWallclock(String value) {
        if (value == null) {
            return null;
        }
        String digits = value.endsWith("s") ? value.substring(0, value.length() - 1) : value;
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(digits) * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String nullIfUnset(String value) {
        if (value == null || value.isBlank() || "-/-".equals(value) || "NONE".equals(value)) {
            return null;
        }
        return value;
    }

    // ===== qstat -j =====

    /**
     * Parses {@code qstat -j <id>} output into {@code key: value} pairs.
     * Keys may contain spaces ("hard resource_list"). Separator lines and
     * indented continuation lines are ignored.
     */
    public static Map<String, String> parseQstatJobDetail(String output) {
        Map<String, String> info = new LinkedHashMap<>();
        if (output == null) {
            return info;
        }
        for (String line : output.split("\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0 || line.startsWith("=") || Character.isWhitespace(line.charAt(0))) {
                continue;
            }
            String key = line.substring(0, colon).strip();
            info.put(key, line.substring(colon + 1).strip());
        }
        return info;
    }

    /**
     * Extracts a path from a {@code stdout_path_list}/{@code stderr_path_list}
     * value such as {@code NONE:NONE:/home/u/out.txt}.
     */
    static Path parsePathList(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String first = value.split(",")[0];
        int colon = first.lastIndexOf(':');
        String path = colon >= 0 ? first.substring(colon + 1) : first;
        return path.isBlank() ? null : Path.of(path);
    }

    /**
     * Extracts predecessor ids from a {@code jid_predecessor_list} value.
     */
    static List<String> parseDependencies(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Looks up one resource in a {@code hard resource_list} value such as
     * {@code h_rt=3600,mem_free=16G}.
     */
    static String parseResource(String resourceList, String resource) {
        if (resourceList == null) {
            return null;
        }
        for (String entry : resourceList.split(",")) {
            int eq = entry.indexOf('=');
            if (eq > 0 && entry.substring(0, eq).strip().equals(resource)) {
                return entry.substring(eq + 1).strip();
            }
        }
        return null;
    }

    // ===== states and ids =====

    /**
     * Maps a Grid Engine state code to a normalized status. Case-insensitive.
     *
     * <p>Suspended states ({@code s}, {@code ts}, {@code S}, {@code tS}) map to
     * {@link JobStatus#PENDING}: the job is held and not progressing.
     */
    public static JobStatus stateToStatus(String state) {
        if (state == null) {
            return JobStatus.UNKNOWN;
        }
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "r", "t", "rr", "rt" -> JobStatus.RUNNING;
            case "qw", "hqw" -> JobStatus.PENDING;
            case "eqw" -> JobStatus.FAILED;
            case "dr", "dt" -> JobStatus.CANCELLED;
            case "s", "ts", "ss" -> JobStatus.PENDING;
            default -> JobStatus.UNKNOWN;
        };
    }

    /**
     * Extracts the job id from {@code qsub} output.
     *
     * @return "12345" for {@code Your job 12345 ("x") has been submitted} or
     *         {@code Your job-array 12345.1-10:1 ...}; empty otherwise
     */
    public static Optional<String> parseQsubOutput(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher m = JOB_PATTERN.matcher(output);
        if (m.find()) {
            return Optional.of(m.group(1));
        }
        m = JOB_ARRAY_PATTERN.matcher(output);
        if (m.find()) {
            return Optional.of(m.group(1));
        }
        return Optional.empty();
    }

    /**
     * Converts a listing record to a JobInfo. Runtime is measured from the start time to {@code now}.
     */
    static JobInfo toJobInfo(SgeJobRecord job, Instant now) {
        Duration runtime = job.startTime() != null && !job.startTime().isAfter(now)
                ? Duration.between(job.startTime(), now)
                : null;
        return JobInfo.builder(job.jobId())
                .name(job.name())
                .user(job.user())
                .status(stateToStatus(job.state()))
                .queue(job.queue())
                .submitTime(job.submitTime())
                .startTime(job.startTime())
                .runtime(runtime)
                .cpu(job.slots())
                .node(job.host())
                .arrayTaskId(job.arrayTaskId())
                .build();
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
}
