package org.muxhttp.api.impl;

/**
 * Thrown when a request head cannot be decoded (wrong token count on the request line,
 * a header line without a colon). Fatal for that message only.
 */
public class MalformedRequestException extends Exception {
    public MalformedRequestException(String message) {
        super(message);
    }
}
