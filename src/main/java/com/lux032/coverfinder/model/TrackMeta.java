package com.lux032.coverfinder.model;

import lombok.Value;

/**
 * 单个文件的识别信息（艺术家/专辑/标题）
 * 每个文件构建一次，之后不再修改
 */
@Value
public class TrackMeta {
    String artist;
    String album;
    String title;

    public static TrackMeta empty() {
        return new TrackMeta(null, null, null);
    }

    public boolean hasArtist() {
        return isPresent(artist);
    }

    public boolean hasAlbum() {
        return isPresent(album);
    }

    public boolean hasTitle() {
        return isPresent(title);
    }

    /**
     * 三个字段全部缺失
     */
    public boolean isBlank() {
        return !hasArtist() && !hasAlbum() && !hasTitle();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
