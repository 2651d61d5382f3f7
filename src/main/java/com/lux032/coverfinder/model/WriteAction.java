package com.lux032.coverfinder.model;

/**
 * 写入策略对单个字段（或封面）给出的决定
 */
public enum WriteAction {

    /** 未发现新值，不做任何尝试 */
    NONE,

    /** 原值缺失，写入新值 */
    WRITE,

    /** 保留原值 */
    KEEP,

    /** 覆盖原值 */
    OVERWRITE;

    /**
     * 是否会修改标签
     */
    public boolean mutates() {
        return this == WRITE || this == OVERWRITE;
    }
}
