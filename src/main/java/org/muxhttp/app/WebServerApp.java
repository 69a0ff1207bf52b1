package org.muxhttp.app;

import org.muxhttp.infrastructure.config.ConfigLoader;
import org.muxhttp.infrastructure.config.ServerConfig;
import org.muxhttp.infrastructure.util.LoggingSetup;
import org.muxhttp.server.MuxServer;

import java.util.logging.Logger;

/** Usage: {@code WebServerApp [port] [config.json]} (defaults from webserver.json on the classpath). */
public class WebServerApp {

    private static final Logger LOGGER = Logger.getLogger(WebServerApp.class.getName());

    public static void main(String[] args) throws Exception {
        LoggingSetup.install();
        ServerConfig config = ConfigLoader.fromArgs(args, "webserver.json");
        LOGGER.info("[Server] " + config);

        MuxServer server = MuxServer.webServer(config);
        server.start(config.port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                LOGGER.warning("[Server] shutdown failed: " + e.getMessage());
            }
        }, "server-shutdown"));

        Thread.currentThread().join(); // serve until the process is stopped
    }
}
