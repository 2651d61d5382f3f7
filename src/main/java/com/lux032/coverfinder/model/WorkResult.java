package com.lux032.coverfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个文件的最终结果
 */
@Value
@Builder
public class WorkResult {

    Path path;
    WorkStatus status;
    String source;
    String detail;
    /** 写入（或 dry-run 下将要写入）的封面字节数 */
    int imageBytes;
    @Singular
    List<FieldOutcome> fieldOutcomes;

    public static WorkResult error(Path path, String detail) {
        return WorkResult.builder()
            .path(path)
            .status(WorkStatus.ERROR)
            .detail(detail)
            .build();
    }

    public static WorkResult miss(Path path) {
        return WorkResult.builder()
            .path(path)
            .status(WorkStatus.MISS)
            .detail("no cover/details found")
            .build();
    }

    public FieldOutcome outcomeFor(TagField field) {
        for (FieldOutcome outcome : fieldOutcomes) {
            if (outcome.getField() == field) {
                return outcome;
            }
        }
        return null;
    }
}
