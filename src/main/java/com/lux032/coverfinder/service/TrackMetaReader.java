package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TrackMeta;
import com.lux032.coverfinder.tag.TagStore;
import com.lux032.coverfinder.util.FileSystemUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * 从文件标签和文件名构建查询信息，不访问网络
 */
@Slf4j
public class TrackMetaReader {

    /**
     * @param store 文件标签，无法读取时为 null
     */
    public TrackMeta read(Path path, TagStore store) {
        String artist = null;
        String album = null;
        String title = null;

        if (store != null) {
            artist = store.getFirst(TagField.ARTIST);
            if (artist == null) {
                artist = store.getFirst(TagField.ALBUM_ARTIST);
            }
            album = store.getFirst(TagField.ALBUM);
            title = store.getFirst(TagField.TITLE);
        }

        String stem = FileSystemUtils.stem(path);
        if (artist == null && album == null && title == null) {
            String[] split = splitArtistTitle(stem);
            if (split != null) {
                log.debug("Using file name for lookup: artist='{}', title='{}'", split[0], split[1]);
                return new TrackMeta(split[0], null, split[1]);
            }
        }
        if (title == null) {
            title = stem;
        }
        return new TrackMeta(artist, album, title);
    }

    /**
     * 拆分 "艺术家 - 标题" 形式的文件名
     * 优先使用第一个 " - "，没有时接受不带空格的 "-"
     * @return [artist, title]，无法拆分时返回 null
     */
    static String[] splitArtistTitle(String stem) {
        if (stem == null) {
            return null;
        }
        int index = stem.indexOf(" - ");
        int separatorLength = 3;
        if (index < 0) {
            index = stem.indexOf('-');
            separatorLength = 1;
        }
        if (index < 0) {
            return null;
        }
        String artist = stem.substring(0, index).trim();
        String title = stem.substring(index + separatorLength).trim();
        if (artist.isEmpty() || title.isEmpty()) {
            return null;
        }
        return new String[]{artist, title};
    }
}
