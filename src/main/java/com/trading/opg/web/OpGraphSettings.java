package com.trading.opg.web;

import com.trading.opg.engine.ExecutionConfig;

import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Server settings. Read from {@code opgraph.properties} on the classpath;
 * any {@code -Dopgraph.*} system property overrides the file.
 */
@Getter
@ToString
public final class OpGraphSettings {
    public static final String RESOURCE = "opgraph.properties";
    public static final String PREFIX = "opgraph.";

    private final String host;
    private final int port;
    private final int concurrency;
    private final int retryBudget;
    private final int ringBufferSize;
    private final int historyLimit;

    OpGraphSettings(Properties props) {
        this.host = props.getProperty(PREFIX + "host", "127.0.0.1");
        this.port = intValue(props, "port", 8080);
        this.concurrency = intValue(props, "concurrency", 4);
        this.retryBudget = intValue(props, "retryBudget", 3);
        this.ringBufferSize = intValue(props, "ringBufferSize", 1024);
        this.historyLimit = intValue(props, "historyLimit", 256);
    }

    /** Classpath file first, then system properties on top. */
    public static OpGraphSettings load() {
        Properties props = new Properties();
        try (InputStream in = OpGraphSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX))
                props.setProperty(name, System.getProperty(name));
        }
        return new OpGraphSettings(props);
    }

    public static OpGraphSettings of(Properties props) {
        return new OpGraphSettings(props);
    }

    public ExecutionConfig executionConfig() {
        return ExecutionConfig.builder()
                .concurrency(concurrency)
                .retryBudget(retryBudget)
                .build();
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank())
            return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
        }
    }
}
