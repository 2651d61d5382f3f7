package com.lux032.coverfinder.model;

/**
 * 单个文件处理过程中的状态
 * NEW → META_READ → RESOLVING → {MISS | RESOLVED}
 * RESOLVED → {WRITE_SKIPPED | WRITE_ATTEMPTED → {OK | ERROR}}，dry-run 时 RESOLVED → FOUND
 */
public enum FileState {
    NEW,
    META_READ,
    RESOLVING,
    MISS,
    RESOLVED,
    WRITE_SKIPPED,
    WRITE_ATTEMPTED,
    FOUND,
    OK,
    ERROR
}
