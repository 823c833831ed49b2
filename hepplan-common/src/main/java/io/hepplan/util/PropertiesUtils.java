package io.hepplan.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Properties;

public class PropertiesUtils {

    public static long getLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Illegal value of [%s]: %s", key, value), e);
        }
    }

    public static int getInt(Properties properties, String key, int defaultValue) {
        long value = getLong(properties, key, defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(String.format("Value of [%s] out of range: %d", key, value));
        }
        return (int) value;
    }

    /**
     * Load properties from classpath, return null if the resource is not there.
     */
    public static Properties loadRs(String s) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(s)) {
            if (in == null) {
                return null;
            }
            Properties p = new Properties();
            p.load(in);
            return p;
        }
    }

    public static Properties load(Path path) throws IOException {
        Properties p = new Properties();
        try (InputStream in = Channels.newInputStream(FileChannel.open(path, StandardOpenOption.READ))) {
            p.load(in);
        }
        return p;
    }
}
