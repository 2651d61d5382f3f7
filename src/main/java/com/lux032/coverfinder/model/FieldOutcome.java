package com.lux032.coverfinder.model;

import lombok.Value;

/**
 * 单个字段的写入结果
 */
@Value
public class FieldOutcome {
    TagField field;
    String value;
    WriteAction action;
    /** 新值已实际保存到文件中 */
    boolean applied;

    public boolean isAttempted() {
        return action != WriteAction.NONE;
    }
}
