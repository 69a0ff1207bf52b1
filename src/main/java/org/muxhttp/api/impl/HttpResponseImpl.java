package org.muxhttp.api.impl;

import org.muxhttp.api.interfaces.http.HttpResponse;
import org.muxhttp.domain.model.HttpStatus;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class HttpResponseImpl implements HttpResponse {
    private int status = 200;
    private String reason = "OK";
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body = new byte[0];
    private InputStream passthrough;

    @Override
    public void status(int code, String reason) {
        this.status = code;
        this.reason = reason;
    }

    public void status(HttpStatus s) {
        status(s.code(), s.reason());
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes;
    }

    @Override
    public void passthrough(InputStream raw) {
        this.passthrough = raw;
    }

    /** Sets status and the stock HTML body for it. */
    public static HttpResponseImpl of(HttpStatus s) {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(s);
        if (s.defaultBody() != null) {
            res.body(s.defaultBody());
        }
        return res;
    }

    /** 500 with the failure detail appended, as the error page shows it. */
    public static HttpResponseImpl internalError(Throwable error) {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(HttpStatus.INTERNAL_SERVER_ERROR);
        String detail = error.getMessage() != null ? error.getMessage() : error.toString();
        res.body(HttpStatus.INTERNAL_SERVER_ERROR.defaultBody() + "<p>" + detail + "</p>");
        return res;
    }

    // getters used by writer
    public int status() { return status; }
    public String reason() { return reason; }
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }

    /** Non-null when the handler supplied a raw response instead of status/headers/body. */
    public InputStream passthrough() { return passthrough; }
}
