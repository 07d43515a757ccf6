package com.example.waystone.net;

/**
 * Telnet (RFC 854) command bytes and the control characters the line
 * editor reacts to.
 */
public final class TelnetProtocol {

    public static final int IAC = 255;
    public static final int DONT = 254;
    public static final int DO = 253;
    public static final int WONT = 252;
    public static final int WILL = 251;
    public static final int SB = 250;
    public static final int IP = 244;
    public static final int SE = 240;

    public static final int OPT_ECHO = 1;
    public static final int OPT_SUPPRESS_GO_AHEAD = 3;

    public static final int NUL = 0x00;
    public static final int CTRL_C = 0x03;
    public static final int BACKSPACE = 0x08;
    public static final int LF = 0x0A;
    public static final int CR = 0x0D;
    public static final int DEL = 0x7F;
    public static final int PRINTABLE_MIN = 0x20;

    public static final String CRLF = "\r\n";

    /** Erases the character left of the cursor on a VT100-style terminal. */
    public static final String ERASE_SEQUENCE = "\b \b";

    private TelnetProtocol() {
    }

    /**
     * Negotiation sent when a client attaches: the server will echo and
     * go-ahead is suppressed, which puts conformant clients into
     * character-at-a-time mode.
     */
    public static byte[] serverEchoNegotiation() {
        return new byte[] {
            (byte) IAC, (byte) WILL, (byte) OPT_ECHO,
            (byte) IAC, (byte) WILL, (byte) OPT_SUPPRESS_GO_AHEAD
        };
    }

    /**
     * Replace bare LF with CRLF, leaving existing CRLF pairs untouched.
     */
    public static String normalizeLineEndings(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(text.length() + 16);
        char prev = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n' && prev != '\r') {
                sb.append('\r');
            }
            sb.append(ch);
            prev = ch;
        }
        return sb.toString();
    }
}
