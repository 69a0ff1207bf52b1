package org.muxhttp.infrastructure.config;

import org.muxhttp.framing.FrameFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the web server and the proxy, filled from JSON by Gson. Field
 * initialisers are the defaults for keys the file leaves out.
 */
public class ServerConfig {

    // listener
    public String host = "127.0.0.1";
    public int port = 8080;
    public String serverName = "TestServer/1.0";

    // static files (web server only)
    public String rootDir = ".";
    public String defaultFile = "test.html";
    public List<String> restricted = new ArrayList<>(List.of("private.html"));
    public Map<String, String> contentTypes = new LinkedHashMap<>();

    // connections and framing
    public int maxFramePayload = 1024;
    public FrameFormat frameFormat = FrameFormat.LENGTH_PREFIXED;
    /** Socket read deadline per connection; 0 waits forever. */
    public int readTimeoutMs = 0;
    public int maxHeaderBytes = 64 * 1024;

    // relay (proxy only); upstreamHost null means "use the Host header"
    public String upstreamHost = null;
    public int upstreamPort = 8080;
    public int upstreamConnectTimeoutMs = 5000;
    public int relayBufferSize = 4096;

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port + ", rootDir=" + rootDir
                + ", frameFormat=" + frameFormat + ", maxFramePayload=" + maxFramePayload
                + ", upstream=" + (upstreamHost == null ? "<Host header>" : upstreamHost + ":" + upstreamPort) + '}';
    }
}
