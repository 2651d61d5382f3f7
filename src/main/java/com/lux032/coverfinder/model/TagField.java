package com.lux032.coverfinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 标签字段
 * 前六个字段可写入，ALBUM_ARTIST 仅在读取时作为艺术家的后备
 */
public enum TagField {

    ALBUM("album", true),
    DATE("year", true),
    GENRE("genre", true),
    ARTIST("artist", true),
    TITLE("title", true),
    TRACK("track", true),
    ALBUM_ARTIST("albumartist", false);

    private static final List<TagField> WRITABLE;

    static {
        List<TagField> fields = new ArrayList<>();
        for (TagField field : values()) {
            if (field.writable) {
                fields.add(field);
            }
        }
        WRITABLE = Collections.unmodifiableList(fields);
    }

    private final String optionName;
    private final boolean writable;

    TagField(String optionName, boolean writable) {
        this.optionName = optionName;
        this.writable = writable;
    }

    /**
     * 命令行与输出中使用的名称，如 --update-year
     */
    public String getOptionName() {
        return optionName;
    }

    /**
     * 按写入顺序返回全部可写字段
     */
    public static List<TagField> writableFields() {
        return WRITABLE;
    }

    /**
     * 根据命令行名称查找字段
     * @return 找不到或字段只读时返回 null
     */
    public static TagField fromOptionName(String name) {
        for (TagField field : WRITABLE) {
            if (field.optionName.equalsIgnoreCase(name)) {
                return field;
            }
        }
        return null;
    }
}
