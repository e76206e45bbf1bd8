package com.sitescraper.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * CLI 실행용 java.util.logging 설정. SLF4J 호출은 slf4j-jdk14 를 거쳐 여기 핸들러로 온다.
 * 콘솔(stderr) + {@code <outputDir>/logs/app-%g.log} 사이즈 롤링.
 * <pre>
 *  -Dss.log.level=debug|info|warn|error   (--log-level 이 우선)
 *  -Dss.log.sizeMb=2  -Dss.log.files=5
 *  -Dss.log.console=false                 콘솔 끄기
 * </pre>
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;

    /** 한 프로세스에 한 번만 적용된다 */
    public static synchronized void configure(Path outputDir, String levelOverride) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(levelOverride != null ? levelOverride : System.getProperty("ss.log.level"));
        Formatter fmt = new LineFormatter();

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (!"false".equalsIgnoreCase(System.getProperty("ss.log.console"))) {
            root.addHandler(handler(new ConsoleHandler(), level, fmt));
        }

        Path logDir = outputDir.resolve("logs");
        try {
            Files.createDirectories(logDir);
            int limit = intProp("ss.log.sizeMb", 2) * 1024 * 1024;
            FileHandler file = new FileHandler(logDir.resolve("app-%g.log").toString(), limit, intProp("ss.log.files", 5), true);
            root.addHandler(handler(file, level, fmt));
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "log file unavailable under " + logDir, e);
        }
        Logger.getLogger(LogSetup.class.getName()).fine(() -> "logging ready: level=" + level + ", dir=" + logDir.toAbsolutePath());
    }

    private static Handler handler(Handler h, Level level, Formatter fmt) {
        h.setLevel(level);
        h.setFormatter(fmt);
        return h;
    }

    /** debug/trace/warn/error 별칭 + JUL 이름. 모르는 값이나 null 이면 INFO */
    public static Level levelOf(String s) {
        if (s == null || s.isBlank()) return Level.INFO;
        String v = s.trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN": return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(v); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int intProp(String key, int def) {
        String s = System.getProperty(key);
        if (s == null || s.isBlank()) return def;
        try {
            return Math.max(1, Integer.parseInt(s.trim()));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** "2024-05-01 10:15:30.123 INFO  [worker-1] c.s.core.crawler.Crawler - msg" */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(160);
            sb.append(String.format(Locale.ROOT, "%1$tF %1$tT.%1$tL %2$-5s [%3$s] %4$s - %5$s%n",
                    r.getMillis(), shortLevel(r.getLevel()), Thread.currentThread().getName(),
                    abbreviate(r.getLoggerName()), formatMessage(r)));
            if (r.getThrown() != null) {
                StringWriter sw = new StringWriter(256);
                r.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }

        private static String shortLevel(Level l) {
            if (l.intValue() >= Level.SEVERE.intValue()) return "ERROR";
            if (l.intValue() >= Level.WARNING.intValue()) return "WARN";
            if (l.intValue() >= Level.INFO.intValue()) return "INFO";
            return "DEBUG";
        }

        /** com.sitescraper.core.crawler.Crawler → c.s.core.crawler.Crawler */
        private static String abbreviate(String name) {
            if (name == null) return "";
            String[] parts = name.split("\\.");
            if (parts.length <= 3) return name;
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (sb.length() > 0) sb.append('.');
                sb.append(i < 2 && !parts[i].isEmpty() ? parts[i].substring(0, 1) : parts[i]);
            }
            return sb.toString();
        }
    }
}
