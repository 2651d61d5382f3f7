package com.lux032.coverfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 数据源返回的候选结果（封面 + 描述信息）
 * 只在解析阶段存在，选中后转换为 {@link ResolvedRecord}
 */
@Value
@Builder
public class Candidate {

    byte[] imageData;
    String contentType;
    String source;

    String albumTitle;
    String releaseDate;
    @Singular
    List<String> genres;
    String artistName;
    String trackTitle;
    Integer trackNumber;
    Integer trackCount;

    public boolean hasImage() {
        return imageData != null && imageData.length > 0;
    }

    public int getImageSize() {
        return imageData == null ? 0 : imageData.length;
    }

    @Override
    public String toString() {
        return String.format("Candidate{source='%s', album='%s', image=%d bytes}",
            source, albumTitle, getImageSize());
    }
}
