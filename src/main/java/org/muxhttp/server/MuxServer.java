package org.muxhttp.server;

import org.muxhttp.api.impl.handlers.ForwardingRelayHandler;
import org.muxhttp.api.impl.handlers.StaticFileHandler;
import org.muxhttp.api.interfaces.IHttpHandler;
import org.muxhttp.api.interfaces.IHttpServer;
import org.muxhttp.domain.interfaces.IOriginResolver;
import org.muxhttp.infrastructure.config.ServerConfig;
import org.muxhttp.infrastructure.impl.FileSystemResourceStore;
import org.muxhttp.infrastructure.impl.FixedOriginResolver;
import org.muxhttp.infrastructure.impl.HostHeaderOriginResolver;
import org.muxhttp.infrastructure.util.ContentTypes;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Paths;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accept loop shared by the web server and the proxy; they differ only in the
 * {@link IHttpHandler} behind it. Connection readers and request workers all run on
 * one cached pool, so threads are reused but never capped.
 */
public final class MuxServer implements IHttpServer {

    private static final Logger LOGGER = Logger.getLogger(MuxServer.class.getName());

    private final String name;
    private final ServerConfig config;
    private final IHttpHandler handler;
    private final Set<ConnectionHandler> connections = ConcurrentHashMap.newKeySet();

    private volatile boolean closed;
    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;

    public MuxServer(String name, ServerConfig config, IHttpHandler handler) {
        this.name = name;
        this.config = config;
        this.handler = handler;
    }

    /** Serves files from {@code config.rootDir}. */
    public static MuxServer webServer(ServerConfig config) {
        FileSystemResourceStore store = new FileSystemResourceStore(Paths.get(config.rootDir), config.restricted);
        return new MuxServer("Server", config,
                new StaticFileHandler(store, config.defaultFile, new ContentTypes(config.contentTypes)));
    }

    /** Relays to {@code upstreamHost:upstreamPort}, or to the Host header's origin when no upstream is set. */
    public static MuxServer proxy(ServerConfig config) {
        IOriginResolver resolver = config.upstreamHost != null
                ? new FixedOriginResolver(config.upstreamHost, config.upstreamPort)
                : new HostHeaderOriginResolver(config.upstreamPort);
        return new MuxServer("Proxy", config, new ForwardingRelayHandler(resolver, config.upstreamConnectTimeoutMs));
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (serverSocket != null) throw new IllegalStateException(name + " already started");
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(config.host, port));
        serverSocket = ss;
        workers = Executors.newCachedThreadPool(new NamedThreads(name.toLowerCase()));

        acceptThread = new Thread(this::acceptLoop, name.toLowerCase() + "-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("[" + name + "] listening on " + config.host + ":" + ss.getLocalPort());
    }

    @Override
    public synchronized int port() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    /** Number of connections not yet closed. */
    public int openConnections() {
        return connections.size();
    }

    @Override
    public synchronized void close() throws IOException, InterruptedException {
        if (closed || serverSocket == null) return;
        closed = true;
        serverSocket.close();
        for (ConnectionHandler c : connections) {
            c.abort();
        }
        workers.shutdown();
        if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
        acceptThread.join(1000);
        LOGGER.info("[" + name + "] stopped");
    }

    private void acceptLoop() {
        while (!closed) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (!closed) LOGGER.log(Level.SEVERE, "[" + name + "] accept failed", e);
                return;
            }

            ConnectionHandler conn = new ConnectionHandler(client, handler, config, workers);
            connections.add(conn);
            try {
                workers.execute(() -> {
                    try {
                        conn.run();
                    } finally {
                        connections.remove(conn);
                    }
                });
            } catch (RejectedExecutionException e) {
                connections.remove(conn);
                conn.abort();
                return;
            }
        }
    }

    private static final class NamedThreads implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        NamedThreads(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
