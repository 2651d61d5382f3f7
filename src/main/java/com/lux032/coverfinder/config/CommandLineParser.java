package com.lux032.coverfinder.config;

import com.lux032.coverfinder.model.TagField;
import com.lux032.coverfinder.model.TagVersion;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行参数解析
 * 参数错误时抛出 IllegalArgumentException，由 Main 打印用法并退出
 */
public final class CommandLineParser {

    private static final String UPDATE_PREFIX = "--update-";

    private CommandLineParser() {
    }

    /**
     * 是否请求了帮助
     */
    public static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    public static RunOptions parse(String[] args) {
        RunOptions.RunOptionsBuilder builder = RunOptions.builder();
        String directory = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-p":
                case "--path":
                    directory = requireValue(args, ++i, arg);
                    break;
                case "-r":
                case "--recursive":
                    builder.recursive(true);
                    break;
                case "-n":
                case "--concurrency":
                    builder.concurrency(parseConcurrency(requireValue(args, ++i, arg)));
                    break;
                case "--dry-run":
                    builder.dryRun(true);
                    break;
                case "--force":
                    builder.force(true);
                    break;
                case "--id3v24":
                    builder.tagVersion(TagVersion.ID3_V24);
                    break;
                case "--tag-version":
                    builder.tagVersion(TagVersion.fromLabel(requireValue(args, ++i, arg)));
                    break;
                case "--ext":
                    builder.extension(normalizeExtension(requireValue(args, ++i, arg)));
                    break;
                default:
                    if (arg.startsWith(UPDATE_PREFIX)) {
                        TagField field = TagField.fromOptionName(arg.substring(UPDATE_PREFIX.length()));
                        if (field == null) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        builder.updateField(field);
                    } else if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if (directory == null) {
                        directory = arg;
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
            }
        }

        if (directory == null || directory.trim().isEmpty()) {
            throw new IllegalArgumentException("Target directory is required");
        }
        return builder.directory(expandHome(directory.trim())).build();
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
            "Usage: coverfinder <directory> [options]",
            "  -p, --path <dir>          folder containing audio files",
            "  -r, --recursive           scan subfolders",
            "  -n, --concurrency <n>     parallel workers (default 4)",
            "      --dry-run             search and report only, never modify files",
            "      --force               overwrite existing cover art and (with --update-*) tags",
            "      --update-album        allow replacing an existing album tag (with --force)",
            "      --update-year         allow replacing an existing date tag (with --force)",
            "      --update-genre        allow replacing an existing genre tag (with --force)",
            "      --update-artist       allow replacing an existing artist tag (with --force)",
            "      --update-title        allow replacing an existing title tag (with --force)",
            "      --update-track        allow replacing an existing track number (with --force)",
            "      --tag-version <v>     ID3 version to save: 2.3 (default) or 2.4",
            "      --id3v24              same as --tag-version 2.4",
            "      --ext <extension>     file extension to scan (default mp3)",
            "  -h, --help                show this help");
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseConcurrency(String value) {
        try {
            return Math.max(1, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Concurrency must be an integer: " + value, e);
        }
    }

    private static String normalizeExtension(String value) {
        String ext = value.trim().toLowerCase();
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        if (ext.isEmpty()) {
            throw new IllegalArgumentException("Extension must not be empty");
        }
        return ext;
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }
}
