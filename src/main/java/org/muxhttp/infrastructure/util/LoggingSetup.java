package org.muxhttp.infrastructure.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/** Installs logging.properties from the classpath, unless a config file was given on the command line. */
public final class LoggingSetup {

    private static final String RESOURCE = "logging.properties";

    private LoggingSetup() {}

    public static void install() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = LoggingSetup.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LoggingSetup.class.getName()).warning("cannot load " + RESOURCE + ": " + e.getMessage());
        }
    }
}
