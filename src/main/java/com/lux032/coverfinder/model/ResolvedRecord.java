package com.lux032.coverfinder.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 被接受的候选结果
 * 每个文件至多一个；不存在表示未命中（miss），不是错误
 */
@Value
public class ResolvedRecord {

    Candidate candidate;

    /**
     * 规范化后的流派列表，第一个为主流派
     */
    List<String> genres;

    public static ResolvedRecord of(Candidate candidate) {
        return new ResolvedRecord(candidate, normalizeGenres(candidate.getGenres()));
    }

    public String getSource() {
        return candidate.getSource();
    }

    public boolean hasImage() {
        return candidate.hasImage();
    }

    public byte[] getImageData() {
        return candidate.getImageData();
    }

    public String getContentType() {
        return candidate.getContentType();
    }

    public String getPrimaryGenre() {
        return genres.isEmpty() ? null : genres.get(0);
    }

    /**
     * 曲目号，有总数时为 "n/total"
     */
    public String getTrackValue() {
        Integer number = candidate.getTrackNumber();
        if (number == null || number <= 0) {
            return null;
        }
        Integer count = candidate.getTrackCount();
        if (count != null && count > 0) {
            return number + "/" + count;
        }
        return String.valueOf(number);
    }

    /**
     * 取某个字段要写入的值
     * @return 未发现时返回 null
     */
    public String valueFor(TagField field) {
        String value;
        switch (field) {
            case ALBUM:
                value = candidate.getAlbumTitle();
                break;
            case DATE:
                value = candidate.getReleaseDate();
                break;
            case GENRE:
                value = getPrimaryGenre();
                break;
            case ARTIST:
                value = candidate.getArtistName();
                break;
            case TITLE:
                value = candidate.getTrackTitle();
                break;
            case TRACK:
                value = getTrackValue();
                break;
            default:
                value = null;
        }
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    static List<String> normalizeGenres(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String genre : raw) {
            if (genre != null && !genre.trim().isEmpty()) {
                seen.add(genre.trim());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(seen));
    }
}
