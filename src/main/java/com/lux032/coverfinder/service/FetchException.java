package com.lux032.coverfinder.service;

import java.io.IOException;

/**
 * 请求最终失败
 * statusCode 为 0 表示传输层错误（连接、DNS、超时）
 */
public class FetchException extends IOException {

    private final int statusCode;

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransportFailure() {
        return statusCode == 0;
    }
}
