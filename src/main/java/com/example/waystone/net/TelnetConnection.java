package com.example.waystone.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client link. Owns the transport exclusively and offers line-oriented
 * I/O with server-side echo and in-band line editing.
 *
 * Writes may come from any thread (broadcasts); reads come only from the
 * thread running this connection's {@link ClientHandler}.
 */
public class TelnetConnection {
    private static final Logger logger = LoggerFactory.getLogger(TelnetConnection.class);

    private static final int IGNORED = 0;
    private static final int INTERRUPT = 1;
    private static final int LITERAL_IAC = 2;

    private final UUID id = UUID.randomUUID();
    private final String remoteAddress;
    private final Instant connectedAt = Instant.now();
    private final InputStream in;
    private final OutputStream out;
    private final Closeable transport;
    private final int maxLineLength;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Session session;
    // a CR ended the previous line; its LF or NUL partner may still be on the wire
    private boolean swallowLineFeed = false;

    /**
     * Wrap an accepted socket. The read timeout applies to every blocking
     * read, so it bounds the time a client may stay silent.
     */
    public TelnetConnection(Socket socket, int readTimeoutMillis, int maxLineLength) throws IOException {
        this(new BufferedInputStream(socket.getInputStream()),
             new BufferedOutputStream(socket.getOutputStream()),
             socket.getInetAddress() != null ? socket.getInetAddress().getHostAddress() : "unknown",
             socket,
             maxLineLength);
        socket.setSoTimeout(readTimeoutMillis);
        socket.setTcpNoDelay(true);
    }

    public TelnetConnection(InputStream in, OutputStream out, String remoteAddress, int maxLineLength) {
        this(in, out, remoteAddress, () -> {
            in.close();
            out.close();
        }, maxLineLength);
    }

    private TelnetConnection(InputStream in, OutputStream out, String remoteAddress, Closeable transport, int maxLineLength) {
        this.in = in;
        this.out = out;
        this.remoteAddress = remoteAddress;
        this.transport = transport;
        this.maxLineLength = maxLineLength;
        logger.info("Connection {} created from {}", id, remoteAddress);
    }

    public UUID getId() { return id; }
    public String getRemoteAddress() { return remoteAddress; }
    public Instant getConnectedAt() { return connectedAt; }
    public Session getSession() { return session; }

    void setSession(Session session) {
        this.session = session;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Ask the client to let the server echo, switching it to character mode.
     */
    public void negotiateServerEcho() {
        writeRaw(TelnetProtocol.serverEchoNegotiation());
    }

    /**
     * Write text, converting bare LF to CRLF. Does nothing once closed; a
     * transport failure closes the connection instead of propagating.
     */
    public void send(String text) {
        if (closed.get()) {
            logger.warn("Send on closed connection {}", id);
            return;
        }
        writeRaw(TelnetProtocol.normalizeLineEndings(text).getBytes(StandardCharsets.UTF_8));
    }

    public void sendLine(String text) {
        send((text == null ? "" : text) + TelnetProtocol.CRLF);
    }

    /**
     * Block until the client finishes a line.
     *
     * @param echo whether typed characters are echoed back
     * @return the line with surrounding whitespace trimmed
     * @throws ConnectionException on timeout, reset, end of stream or interrupt;
     *         the connection is closed in every case
     */
    public String readLine(boolean echo) throws ConnectionException {
        if (closed.get()) {
            throw new ConnectionException("Connection is closed");
        }
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        while (true) {
            int b = readByte();
            if (b == TelnetProtocol.IAC) {
                int action = handleTelnetCommand();
                if (action == INTERRUPT) {
                    throw fail("Read cancelled by client", null);
                }
                if (action == IGNORED) continue;
                // IAC IAC is a literal 0xFF data byte
            }

            if (swallowLineFeed) {
                swallowLineFeed = false;
                if (b == TelnetProtocol.LF || b == TelnetProtocol.NUL) continue;
            }

            if (b == TelnetProtocol.CR || b == TelnetProtocol.LF) {
                swallowLineFeed = b == TelnetProtocol.CR;
                writeRaw(TelnetProtocol.CRLF.getBytes(StandardCharsets.US_ASCII));
                return new String(buf.toByteArray(), StandardCharsets.UTF_8).trim();
            }
            if (b == TelnetProtocol.CTRL_C) {
                throw fail("Read cancelled by client", null);
            }
            if (b == TelnetProtocol.BACKSPACE || b == TelnetProtocol.DEL) {
                if (buf.size() > 0) {
                    eraseLastCharacter(buf);
                    if (echo) writeRaw(TelnetProtocol.ERASE_SEQUENCE.getBytes(StandardCharsets.US_ASCII));
                }
                continue;
            }
            if (b < TelnetProtocol.PRINTABLE_MIN) {
                continue;
            }
            if (buf.size() >= maxLineLength) {
                continue;
            }
            buf.write(b);
            if (echo) writeRaw(new byte[] {(byte) b});
        }
    }

    public String readLine() throws ConnectionException {
        return readLine(true);
    }

    public String readPassword() throws ConnectionException {
        return readLine(false);
    }

    /**
     * Close the transport. Safe to call any number of times.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        logger.info("Connection {} from {} closing", id, remoteAddress);
        try {
            transport.close();
        } catch (IOException e) {
            logger.debug("Error closing connection {}: {}", id, e.getMessage());
        }
    }

    private void writeRaw(byte[] data) {
        if (closed.get()) return;
        synchronized (writeLock) {
            try {
                out.write(data);
                out.flush();
            } catch (IOException e) {
                logger.warn("Send failed on connection {}: {}", id, e.getMessage());
                close();
            }
        }
    }

    private int readByte() throws ConnectionException {
        int b;
        try {
            b = in.read();
        } catch (SocketTimeoutException e) {
            logger.warn("Read timeout on connection {}", id);
            throw fail("Read timeout", e);
        } catch (IOException e) {
            if (closed.get()) {
                throw new ConnectionException("Connection is closed", e);
            }
            logger.info("Connection {} lost: {}", id, e.getMessage());
            throw fail("Connection lost", e);
        }
        if (b < 0) {
            throw fail("Connection closed by peer", null);
        }
        return b;
    }

    private int handleTelnetCommand() throws ConnectionException {
        int cmd = readByte();
        switch (cmd) {
            case TelnetProtocol.WILL:
            case TelnetProtocol.WONT:
            case TelnetProtocol.DO:
            case TelnetProtocol.DONT:
                readByte();
                return IGNORED;
            case TelnetProtocol.SB:
                skipSubnegotiation();
                return IGNORED;
            case TelnetProtocol.IP:
                return INTERRUPT;
            case TelnetProtocol.IAC:
                return LITERAL_IAC;
            default:
                return IGNORED;
        }
    }

    private void skipSubnegotiation() throws ConnectionException {
        boolean sawIac = false;
        while (true) {
            int b = readByte();
            if (sawIac && b == TelnetProtocol.SE) return;
            sawIac = b == TelnetProtocol.IAC && !sawIac;
        }
    }

    private static void eraseLastCharacter(ByteArrayOutputStream buf) {
        byte[] bytes = buf.toByteArray();
        int end = bytes.length - 1;
        // step back over UTF-8 continuation bytes (10xxxxxx)
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        buf.reset();
        buf.write(bytes, 0, end);
    }

    private ConnectionException fail(String reason, Throwable cause) {
        close();
        return new ConnectionException(reason, cause);
    }

    @Override
    public String toString() {
        return "TelnetConnection(" + id + ", " + remoteAddress + ")";
    }
}
