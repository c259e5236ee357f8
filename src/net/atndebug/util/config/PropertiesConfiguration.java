package net.atndebug.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static PropertiesConfiguration fromFile(File path)
            throws IOException {
        InputStream in = new FileInputStream(path);
        try {
            return new PropertiesConfiguration(loadProperties(in));
        } finally {
            in.close();
        }
    }

    public static PropertiesConfiguration fromResource(ClassLoader loader,
            String name) throws IOException {
        InputStream in = loader.getResourceAsStream(name);
        if (in == null)
            throw new FileNotFoundException("Resource " + name +
                                            " not found");
        try {
            return new PropertiesConfiguration(loadProperties(in));
        } finally {
            in.close();
        }
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        Reader rd = new InputStreamReader(in, StandardCharsets.UTF_8);
        ret.load(rd);
        return ret;
    }

}
