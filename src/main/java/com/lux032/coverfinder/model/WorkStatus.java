package com.lux032.coverfinder.model;

/**
 * 单个文件的最终处理结果
 * 各状态互斥，每个文件恰好对应一个
 */
public enum WorkStatus {

    /**
     * 已找到并写入（或无封面可写，但标签已处理）
     */
    OK("OK"),

    /**
     * 文件已有封面且未指定 --force，跳过封面写入
     */
    SKIP("SKIP"),

    /**
     * 两个数据源都没有可用结果，不是错误
     */
    MISS("MISS"),

    /**
     * 本地读写失败或处理过程中出现未预期的异常
     */
    ERROR("ERR"),

    /**
     * 仅 dry-run：找到结果，但不修改文件
     */
    FOUND("FOUND");

    private final String label;

    WorkStatus(String label) {
        this.label = label;
    }

    /**
     * 输出行前缀中使用的标记
     */
    public String getLabel() {
        return label;
    }
}
