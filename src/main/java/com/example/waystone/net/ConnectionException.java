package com.example.waystone.net;

import java.io.IOException;

/**
 * Raised when a client connection can no longer be read from: timeout,
 * reset, end of stream or an interrupt from the client. The connection is
 * always closed by the time this is thrown.
 */
public class ConnectionException extends IOException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
