package com.lux032.coverfinder.service;

import com.lux032.coverfinder.config.RunOptions;
import com.lux032.coverfinder.model.FieldOutcome;
import com.lux032.coverfinder.model.ResolvedRecord;
import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.WriteAction;
import com.lux032.coverfinder.model.WriteReport;
import com.lux032.coverfinder.tag.TagStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 标签写入服务
 * 按 {@link WritePolicy} 决定每个字段和封面的动作，有修改时只保存一次
 */
@Slf4j
public class TagWriterService {

    private final RunOptions options;

    public TagWriterService(RunOptions options) {
        this.options = options;
    }

    /**
     * 将解析结果应用到文件标签
     * dry-run 时只计算决定，不修改任何内容
     */
    public WriteReport apply(TagStore store, ResolvedRecord record) {
        List<Decision> decisions = new ArrayList<>();
        WriteAction artworkAction;
        try {
            for (TagField field : TagField.writableFields()) {
                String value = record.valueFor(field);
                WriteAction action = WritePolicy.decide(value != null, store.has(field),
                    options.isUpdateEnabled(field), options.isForce());
                decisions.add(new Decision(field, value, action));
            }
            artworkAction = WritePolicy.decideArtwork(record.hasImage(), store.hasArtwork(), options.isForce());
        } catch (RuntimeException e) {
            log.warn("Failed to read existing tags of {}: {}", store.getPath().getFileName(), e.getMessage());
            return failure("read failed: " + e.getMessage(), decisions, WriteAction.NONE);
        }

        int imageBytes = artworkAction.mutates() ? record.getImageData().length : 0;

        if (options.isDryRun()) {
            return report(decisions, artworkAction, imageBytes, false);
        }

        boolean changed = false;
        try {
            for (Decision decision : decisions) {
                if (decision.action.mutates()) {
                    store.deleteAll(decision.field);
                    store.add(decision.field, decision.value);
                    changed = true;
                }
            }
            if (artworkAction.mutates()) {
                store.replaceArtwork(record.getImageData(), record.getContentType());
                changed = true;
            }
            if (changed) {
                store.persist(options.getTagVersion());
            }
        } catch (Exception e) {
            log.warn("Failed to write tags to {}: {}", store.getPath().getFileName(), e.getMessage());
            return failure("write failed: " + e.getMessage(), decisions, artworkAction);
        }

        return report(decisions, artworkAction, imageBytes, changed);
    }

    private WriteReport report(List<Decision> decisions, WriteAction artworkAction, int imageBytes, boolean persisted) {
        WriteReport.WriteReportBuilder builder = WriteReport.builder()
            .success(true)
            .artworkAction(artworkAction)
            .imageBytes(imageBytes)
            .persisted(persisted);
        for (Decision decision : decisions) {
            builder.fieldOutcome(new FieldOutcome(decision.field, decision.value, decision.action,
                persisted && decision.action.mutates()));
        }
        return builder.build();
    }

    private static WriteReport failure(String message, List<Decision> decisions, WriteAction artworkAction) {
        WriteReport.WriteReportBuilder builder = WriteReport.builder()
            .success(false)
            .message(message)
            .artworkAction(artworkAction);
        for (Decision decision : decisions) {
            builder.fieldOutcome(new FieldOutcome(decision.field, decision.value, decision.action, false));
        }
        return builder.build();
    }

    private static final class Decision {
        private final TagField field;
        private final String value;
        private final WriteAction action;

        private Decision(TagField field, String value, WriteAction action) {
            this.field = field;
            this.value = value;
            this.action = action;
        }
    }
}
