package com.lux032.coverfinder.config;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Set;

/**
 * 一次运行的命令行选项
 * 不可变，显式传给每个文件任务
 */
@Value
@Builder(toBuilder = true)
public class RunOptions {

    Path directory;
    @Builder.Default
    String extension = "mp3";
    boolean recursive;
    @Builder.Default
    int concurrency = 4;
    boolean dryRun;
    boolean force;
    @Singular
    Set<TagField> updateFields;
    @Builder.Default
    TagVersion tagVersion = TagVersion.ID3_V23;

    /**
     * 该字段是否指定了 --update-xxx
     */
    public boolean isUpdateEnabled(TagField field) {
        return updateFields.contains(field);
    }
}
