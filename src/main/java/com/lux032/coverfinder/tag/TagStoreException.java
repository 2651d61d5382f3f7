package com.lux032.coverfinder.tag;

/**
 * 标签读取、修改或保存失败
 */
public class TagStoreException extends Exception {

    public TagStoreException(String message) {
        super(message);
    }

    public TagStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
