package com.lux032.coverfinder.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文件系统工具类
 */
@Slf4j
public final class FileSystemUtils {

    private FileSystemUtils() {
    }

    /**
     * 列出目录下指定扩展名的音频文件（不区分大小写），按路径排序
     * @param recursive 是否包含子文件夹
     */
    public static List<Path> listAudioFiles(Path directory, String extension, boolean recursive) throws IOException {
        String suffix = "." + extension.toLowerCase(Locale.ROOT);
        int depth = recursive ? Integer.MAX_VALUE : 1;
        try (Stream<Path> paths = Files.walk(directory, depth)) {
            List<Path> files = paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                .sorted()
                .collect(Collectors.toList());
            log.debug("Found {} *{} file(s) under {} (recursive={})", files.size(), suffix, directory, recursive);
            return files;
        }
    }

    /**
     * 去掉扩展名的文件名
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    /**
     * 字节数转换为可读形式，如 40.0KB
     */
    public static String humanBytes(long bytes) {
        double value = bytes;
        String[] units = {"B", "KB", "MB", "GB"};
        for (int i = 0; i < units.length; i++) {
            if (value < 1024.0 || i == units.length - 1) {
                return String.format(Locale.ROOT, "%.1f%s", value, units[i]);
            }
            value /= 1024.0;
        }
        return bytes + "B";
    }
}
