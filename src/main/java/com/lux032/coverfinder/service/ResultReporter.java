package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.model.BatchSummary;
import com.lux032.coverfinder.model.FieldOutcome;
import com.lux032.coverfinder.model.WorkResult;
import com.lux032.coverfinder.model.WorkStatus;
import com.lux032.coverfinder.util.FileSystemUtils;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 结果输出（标准输出，每个文件一行）
 * 所有方法同步，保证多线程下每行完整输出
 */
public class ResultReporter {

    private final PrintStream out;

    public ResultReporter(PrintStream out) {
        this.out = out;
    }

    public synchronized void header(RunOptions options, int fileCount) {
        out.printf("[i] Processing %d file(s) in %s (recursive=%s, concurrency=%d) dry_run=%s force=%s update=%s tag=ID3v%s%n",
            fileCount, options.getDirectory(), options.isRecursive(), options.getConcurrency(),
            options.isDryRun(), options.isForce(), options.getUpdateFields(), options.getTagVersion().getLabel());
        out.flush();
    }

    public synchronized void noFiles(RunOptions options) {
        out.printf("[i] No .%s files found.%n", options.getExtension());
        out.flush();
    }

    public synchronized void report(WorkResult result) {
        out.println(format(result));
        out.flush();
    }

    public synchronized void summary(BatchSummary summary, boolean dryRun) {
        StringBuilder line = new StringBuilder()
            .append("[i] Done. ok=").append(summary.count(WorkStatus.OK))
            .append(" skip=").append(summary.count(WorkStatus.SKIP))
            .append(" miss=").append(summary.count(WorkStatus.MISS))
            .append(" err=").append(summary.count(WorkStatus.ERROR));
        if (dryRun) {
            line.append(" found=").append(summary.count(WorkStatus.FOUND));
        }
        line.append(" of ").append(summary.getTotalFiles());
        out.println();
        out.println(line);
        out.flush();
    }

    /**
     * 格式化单个结果行
     */
    static String format(WorkResult result) {
        String prefix = "[" + result.getStatus().getLabel() + "] " + result.getPath();
        switch (result.getStatus()) {
            case OK:
                return prefix + " (" + result.getSource() + ", wrote " + FileSystemUtils.humanBytes(result.getImageBytes())
                    + withDetail(result) + ")" + fieldNotes(result, false);
            case FOUND:
                return prefix + " (" + result.getSource() + ", would embed " + FileSystemUtils.humanBytes(result.getImageBytes())
                    + withDetail(result) + ")" + fieldNotes(result, true);
            case SKIP:
                return prefix + " (" + result.getDetail() + ")" + fieldNotes(result, false);
            default:
                return prefix + " (" + result.getDetail() + ")";
        }
    }

    private static String withDetail(WorkResult result) {
        return result.getDetail() == null ? "" : ", " + result.getDetail();
    }

    private static String fieldNotes(WorkResult result, boolean dryRun) {
        List<String> notes = new ArrayList<>();
        for (FieldOutcome outcome : result.getFieldOutcomes()) {
            if (!outcome.isAttempted()) {
                continue;
            }
            String name = outcome.getField().getOptionName();
            if (dryRun) {
                if (outcome.getAction().mutates()) {
                    notes.add(name + " would write '" + outcome.getValue() + "'");
                } else {
                    notes.add(name + " kept");
                }
            } else {
                notes.add(name + "=" + (outcome.isApplied() ? "set" : "kept") + " ('" + outcome.getValue() + "')");
            }
        }
        return notes.isEmpty() ? "" : ", " + String.join(", ", notes);
    }
}
