package org.muxhttp.app;

import org.muxhttp.infrastructure.config.ConfigLoader;
import org.muxhttp.infrastructure.config.ServerConfig;
import org.muxhttp.infrastructure.util.LoggingSetup;
import org.muxhttp.server.MuxServer;

import java.util.logging.Logger;

/** Usage: {@code ProxyApp [port] [config.json]} (defaults from proxy.json on the classpath). */
public class ProxyApp {

    private static final Logger LOGGER = Logger.getLogger(ProxyApp.class.getName());

    public static void main(String[] args) throws Exception {
        LoggingSetup.install();
        ServerConfig config = ConfigLoader.fromArgs(args, "proxy.json");
        LOGGER.info("[Proxy] " + config);

        MuxServer proxy = MuxServer.proxy(config);
        proxy.start(config.port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                proxy.close();
            } catch (Exception e) {
                LOGGER.warning("[Proxy] shutdown failed: " + e.getMessage());
            }
        }, "proxy-shutdown"));

        Thread.currentThread().join();
    }
}
