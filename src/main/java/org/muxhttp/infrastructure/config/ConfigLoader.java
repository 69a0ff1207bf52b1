package org.muxhttp.infrastructure.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Loads {@link ServerConfig} from JSON. A missing file or resource yields the defaults;
 * a present but broken one is an error.
 */
public final class ConfigLoader {
    private static final Gson gson = new Gson();

    private ConfigLoader() {}

    public static ServerConfig fromFile(Path file) {
        if (!Files.exists(file)) return validate(new ServerConfig());
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(r, file.toString());
        } catch (IOException e) {
            throw new InvalidConfigException("cannot read " + file, e);
        }
    }

    public static ServerConfig fromResource(String resource) {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) return validate(new ServerConfig());
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(r, resource);
        } catch (IOException e) {
            throw new InvalidConfigException("cannot read " + resource, e);
        }
    }

    public static ServerConfig fromJson(String json) {
        try {
            ServerConfig c = gson.fromJson(json, ServerConfig.class);
            return validate(c == null ? new ServerConfig() : c);
        } catch (JsonParseException e) {
            throw new InvalidConfigException("invalid config JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Command-line handling shared by the entry points: {@code [port] [config.json]}.
     * Without a file argument the named classpath resource is used.
     */
    public static ServerConfig fromArgs(String[] args, String defaultResource) {
        ServerConfig c = args.length > 1 ? fromFile(Path.of(args[1])) : fromResource(defaultResource);
        if (args.length > 0) {
            try {
                c.port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                throw new InvalidConfigException("port must be a number, got '" + args[0] + "'", e);
            }
        }
        return validate(c);
    }

    public static ServerConfig validate(ServerConfig c) {
        if (c.port < 0 || c.port > 65535) throw new InvalidConfigException("port out of range: " + c.port);
        if (c.upstreamPort <= 0 || c.upstreamPort > 65535) {
            throw new InvalidConfigException("upstreamPort out of range: " + c.upstreamPort);
        }
        if (c.maxFramePayload <= 0) throw new InvalidConfigException("maxFramePayload must be positive");
        if (c.frameFormat == null) throw new InvalidConfigException("frameFormat must be DELIMITED or LENGTH_PREFIXED");
        if (c.readTimeoutMs < 0) throw new InvalidConfigException("readTimeoutMs must not be negative");
        if (c.maxHeaderBytes < 64) throw new InvalidConfigException("maxHeaderBytes too small: " + c.maxHeaderBytes);
        if (c.relayBufferSize <= 0) throw new InvalidConfigException("relayBufferSize must be positive");
        if (c.upstreamConnectTimeoutMs < 0) throw new InvalidConfigException("upstreamConnectTimeoutMs must not be negative");
        if (c.rootDir == null || c.defaultFile == null || c.defaultFile.isEmpty()) {
            throw new InvalidConfigException("rootDir and defaultFile are required");
        }
        if (c.restricted == null) c.restricted = new ArrayList<>();
        if (c.contentTypes == null) c.contentTypes = new LinkedHashMap<>();
        if (c.serverName == null) c.serverName = "TestServer/1.0";
        if (c.host == null) c.host = "127.0.0.1";
        return c;
    }

    private static ServerConfig parse(Reader r, String source) {
        try {
            ServerConfig c = gson.fromJson(r, ServerConfig.class);
            return validate(c == null ? new ServerConfig() : c);
        } catch (JsonParseException e) {
            throw new InvalidConfigException("invalid config in " + source + ": " + e.getMessage(), e);
        }
    }
}
