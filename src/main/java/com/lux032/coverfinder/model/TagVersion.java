package com.lux032.coverfinder.model;

/**
 * 保存时使用的 ID3v2 版本，非 MP3 格式忽略
 */
public enum TagVersion {
    ID3_V23("2.3"),
    ID3_V24("2.4");

    private final String label;

    TagVersion(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TagVersion fromLabel(String label) {
        for (TagVersion version : values()) {
            if (version.label.equals(label)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unsupported tag version: " + label + " (expected 2.3 or 2.4)");
    }
}
