package com.lux032.coverfinder.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 国际化工具类
 * 用于加载和获取多语言资源
 */
@Slf4j
public final class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static volatile Properties messages;
    private static volatile String currentLanguage = DEFAULT_LANGUAGE;

    private I18nUtil() {
    }

    /**
     * 初始化国际化资源
     * @param language 语言代码，如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        Properties loaded = new Properties();
        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.warn("i18n resource file not found: {}, falling back to English", resourceFile);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            }
            return;
        }
        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
            messages = loaded;
            currentLanguage = language;
            log.debug("Loaded i18n resource file: {}", resourceFile);
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            }
        }
    }

    /**
     * 获取国际化消息
     * @return 找不到时返回键本身
     */
    public static String getMessage(String key) {
        if (messages == null) {
            init(currentLanguage);
        }
        Properties current = messages;
        return current == null ? key : current.getProperty(key, key);
    }
}
