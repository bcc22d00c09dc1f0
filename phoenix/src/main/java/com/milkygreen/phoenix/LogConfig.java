package com.milkygreen.phoenix;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 的初始化
 *
 * 日志级别通过系统属性控制：
 * - phoenix.logLevel=SEVERE|WARNING|INFO|FINE|FINER|FINEST，默认 WARNING
 */
final class LogConfig {

    static final String LEVEL_PROPERTY = "phoenix.logLevel";

    private static volatile boolean configured;

    private LogConfig() {
    }

    static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY));

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new CompactFormatter());
            }
        }
    }

    /**
     * 解析日志级别，无法识别时用默认的 WARNING
     */
    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.WARNING;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.WARNING;
        }
    }

    /**
     * 单行格式：时间 级别 类名 - 消息
     */
    static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(record.getLevel().getName()).append(' ')
                    .append(shortLoggerName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');
            return out.toString();
        }

        static String shortLoggerName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            int lastDot = loggerName.lastIndexOf('.');
            return lastDot >= 0 ? loggerName.substring(lastDot + 1) : loggerName;
        }
    }
}
