package io.surfworks.hpcrunner.cli;

import io.surfworks.hpcrunner.job.JobInfo;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Plain-text rendering of job listings and job details.
 */
final class JobTable {

    static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private static final List<Column> COLUMNS = List.of(
            new Column("JOB ID", JobTable::displayId),
            new Column("NAME", JobInfo::name),
            new Column("USER", JobInfo::user),
            new Column("STATUS", job -> job.status().name()),
            new Column("QUEUE", job -> orDash(job.queue())),
            new Column("RUNTIME", JobInfo::runtimeDisplay),
            new Column("RESOURCES", JobInfo::resourcesDisplay),
            new Column("NODE", job -> orDash(job.node()))
    );

    private record Column(String header, Function<JobInfo, String> value) {
    }

    private JobTable() {
    }

    /**
     * Formats jobs as an aligned table with a header row. Columns are as wide
     * as their widest cell.
     */
    static String format(List<JobInfo> jobs) {
        int[] widths = new int[COLUMNS.size()];
        for (int i = 0; i < COLUMNS.size(); i++) {
            widths[i] = COLUMNS.get(i).header().length();
        }
        List<String[]> rows = new ArrayList<>();
        for (JobInfo job : jobs) {
            String[] row = new String[COLUMNS.size()];
            for (int i = 0; i < COLUMNS.size(); i++) {
                row[i] = COLUMNS.get(i).value().apply(job);
                widths[i] = Math.max(widths[i], row[i].length());
            }
            rows.add(row);
        }

        StringBuilder sb = new StringBuilder();
        String[] header = COLUMNS.stream().map(Column::header).toArray(String[]::new);
        appendRow(sb, header, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                line.append("  ");
            }
            line.append(String.format("%-" + widths[i] + "s", cells[i]));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }

    /**
     * Formats every known field of one job, one per line.
     */
    static String details(JobInfo job) {
        StringBuilder sb = new StringBuilder();
        field(sb, "Job ID", job.jobId());
        if (job.arrayTaskId() != null) {
            field(sb, "Array Task", job.arrayTaskId());
        }
        field(sb, "Name", job.name());
        field(sb, "User", job.user());
        field(sb, "Status", job.status().name());
        field(sb, "Queue", orDash(job.queue()));
        field(sb, "Node", orDash(job.node()));
        field(sb, "Submitted", formatTime(job.submitTime()));
        field(sb, "Started", formatTime(job.startTime()));
        field(sb, "Ended", formatTime(job.endTime()));
        field(sb, "Runtime", job.runtimeDisplay());
        field(sb, "Resources", job.resourcesDisplay());
        field(sb, "Exit Code", job.exitCode() == null ? JobInfo.NOT_AVAILABLE : job.exitCode().toString());
        field(sb, "Stdout", job.stdoutPath() == null ? JobInfo.NOT_AVAILABLE : job.stdoutPath().toString());
        field(sb, "Stderr", job.stderrPath() == null ? JobInfo.NOT_AVAILABLE : job.stderrPath().toString());
        if (job.dependencies() != null && !job.dependencies().isEmpty()) {
            field(sb, "Depends On", String.join(", ", job.dependencies()));
        }
        return sb.toString();
    }

    private static void field(StringBuilder sb, String label, String value) {
        sb.append(String.format("%-12s %s%n", label + ":", value));
    }

    static String displayId(JobInfo job) {
        return job.arrayTaskId() == null ? job.jobId() : job.jobId() + "." + job.arrayTaskId();
    }

    static String formatTime(Instant time) {
        return time == null ? JobInfo.NOT_AVAILABLE : TIME_FORMAT.format(time);
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? JobInfo.NOT_AVAILABLE : value;
    }
}
