package com.lux032.coverfinder.tag;

import java.nio.file.Path;

/**
 * 打开文件的标签
 */
@FunctionalInterface
public interface TagStoreFactory {

    TagStoreFactory JAUDIOTAGGER = JaudiotaggerTagStore::open;

    TagStore open(Path path) throws TagStoreException;
}
