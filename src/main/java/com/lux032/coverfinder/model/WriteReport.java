package com.lux032.coverfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次标签写入的结果
 * 写入失败不会抛出异常，而是 success=false 并带上原因
 */
@Value
@Builder
public class WriteReport {

    boolean success;
    String message;
    @Singular
    List<FieldOutcome> fieldOutcomes;
    WriteAction artworkAction;
    /** 写入（或将要写入）的封面字节数 */
    int imageBytes;
    /** 文件是否被实际保存 */
    boolean persisted;

    public boolean isArtworkKept() {
        return artworkAction == WriteAction.KEEP;
    }
}
