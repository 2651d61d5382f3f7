package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.WriteAction;

/**
 * 字段写入策略表
 *
 * <pre>
 * 发现新值 | 已有值 | --update-x | --force | 动作
 * 否       | 任意   | 任意       | 任意    | NONE
 * 是       | 否     | 任意       | 任意    | WRITE
 * 是       | 是     | 关         | 任意    | KEEP
 * 是       | 是     | 开         | 关      | KEEP
 * 是       | 是     | 开         | 开      | OVERWRITE
 * </pre>
 */
public final class WritePolicy {

    private WritePolicy() {
    }

    public static WriteAction decide(boolean discovered, boolean existing, boolean update, boolean force) {
        if (!discovered) {
            return WriteAction.NONE;
        }
        if (!existing) {
            return WriteAction.WRITE;
        }
        return update && force ? WriteAction.OVERWRITE : WriteAction.KEEP;
    }

    /**
     * 封面不需要 --update 开关，只看 --force
     * 已有封面且未指定 --force 时总是 KEEP，即使没有找到新图片
     */
    public static WriteAction decideArtwork(boolean resolvedImage, boolean existingArtwork, boolean force) {
        if (existingArtwork && !force) {
            return WriteAction.KEEP;
        }
        if (!resolvedImage) {
            return WriteAction.NONE;
        }
        return existingArtwork ? WriteAction.OVERWRITE : WriteAction.WRITE;
    }
}
