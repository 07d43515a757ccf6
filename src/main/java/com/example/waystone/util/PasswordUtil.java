package com.example.waystone.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Account credentials: a per-account random salt and the PBKDF2 digest of
 * the password, each kept Base64-encoded in its own column.
 */
public final class PasswordUtil {
    private static final Logger logger = LoggerFactory.getLogger(PasswordUtil.class);

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int ITERATIONS = 65536;
    private static final int KEY_BITS = 256;
    private static final int SALT_BYTES = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    /** Salt and digest for one password, ready to store. */
    public static final class Credentials {
        private final String salt;
        private final String hash;

        private Credentials(String salt, String hash) {
            this.salt = salt;
            this.hash = hash;
        }

        public String getSalt() { return salt; }
        public String getHash() { return hash; }
    }

    private PasswordUtil() {
    }

    /**
     * Salt and digest a new password. The caller's array is left untouched.
     */
    public static Credentials createCredentials(char[] password) {
        byte[] salt = new byte[SALT_BYTES];
        RANDOM.nextBytes(salt);
        Base64.Encoder b64 = Base64.getEncoder();
        return new Credentials(b64.encodeToString(salt), b64.encodeToString(derive(password, salt)));
    }

    /**
     * Check a login attempt against stored credentials, in time independent
     * of where the digests differ. Unreadable stored values never match.
     */
    public static boolean verify(char[] attempt, String storedSalt, String storedHash) {
        byte[] salt;
        byte[] expected;
        try {
            salt = Base64.getDecoder().decode(storedSalt);
            expected = Base64.getDecoder().decode(storedHash);
        } catch (IllegalArgumentException e) {
            logger.warn("Stored credentials are not valid Base64: {}", e.getMessage());
            return false;
        }
        return MessageDigest.isEqual(expected, derive(attempt, salt));
    }

    private static byte[] derive(char[] password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password, salt, ITERATIONS, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
