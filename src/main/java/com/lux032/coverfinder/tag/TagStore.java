package com.lux032.coverfinder.tag;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个音频文件的内嵌标签
 * 修改只发生在内存中，调用 {@link #persist(TagVersion)} 后才写回文件
 */
public interface TagStore {

    Path getPath();

    /**
     * 读取某个字段的全部值
     * @return 没有值时为空列表
     */
    List<String> getAll(TagField field);

    /**
     * 第一个非空值
     */
    default String getFirst(TagField field) {
        for (String value : getAll(field)) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }

    default boolean has(TagField field) {
        return getFirst(field) != null;
    }

    /**
     * 删除某个字段的所有值
     */
    void deleteAll(TagField field) throws TagStoreException;

    void add(TagField field, String value) throws TagStoreException;

    int artworkCount();

    default boolean hasArtwork() {
        return artworkCount() > 0;
    }

    /**
     * 用一张正面封面替换全部已有图片
     */
    void replaceArtwork(byte[] data, String mimeType) throws TagStoreException;

    /**
     * 以指定 ID3 版本写回文件
     */
    void persist(TagVersion version) throws TagStoreException;
}
