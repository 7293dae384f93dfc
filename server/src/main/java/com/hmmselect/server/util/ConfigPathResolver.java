package com.hmmselect.server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

public class ConfigPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigPathResolver.class);

    public static final String CONFIG_PROPERTY = "hmmselect.config.file";
    public static final String CONFIG_RESOURCE = "/selector_config.json";

    /**
     * Opens the selector configuration: the file named by the {@code hmmselect.config.file}
     * system property if set, otherwise the classpath resource. Returns null if neither exists.
     */
    public static InputStream openSelectorConfig() throws IOException {
        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            if (file.isFile()) {
                logger.info("Reading selector config from {}", file.getAbsolutePath());
                return new FileInputStream(file);
            }
            logger.warn("Config file {} does not exist, trying classpath", sysProp);
        }

        // 2. Check Classpath
        InputStream is = ConfigPathResolver.class.getResourceAsStream(CONFIG_RESOURCE);
        if (is != null) {
            logger.debug("Reading selector config from classpath {}", CONFIG_RESOURCE);
        }
        return is;
    }
}
