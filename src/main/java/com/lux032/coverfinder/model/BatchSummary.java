package com.lux032.coverfinder.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 一次批处理的汇总
 * 只由收集结果的线程写入
 */
public class BatchSummary {

    private final int totalFiles;
    private final Map<WorkStatus, Integer> counts = new EnumMap<>(WorkStatus.class);

    public BatchSummary(int totalFiles) {
        this.totalFiles = totalFiles;
        for (WorkStatus status : WorkStatus.values()) {
            counts.put(status, 0);
        }
    }

    public void record(WorkResult result) {
        counts.merge(result.getStatus(), 1, Integer::sum);
    }

    public int count(WorkStatus status) {
        return counts.get(status);
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    /**
     * 已得到结果的文件数（停止后可能小于总数）
     */
    public int getCompleted() {
        int sum = 0;
        for (int value : counts.values()) {
            sum += value;
        }
        return sum;
    }

    @Override
    public String toString() {
        return String.format("BatchSummary{ok=%d, skip=%d, miss=%d, err=%d, found=%d, total=%d}",
            count(WorkStatus.OK), count(WorkStatus.SKIP), count(WorkStatus.MISS),
            count(WorkStatus.ERROR), count(WorkStatus.FOUND), totalFiles);
    }
}
