package com.lantromipis.pgasync.postgresprotocol.utils;

import com.lantromipis.pgasync.postgresprotocol.exception.PgAuthenticationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class PasswordUtils {

    private static final String MD5_DIGEST_NAME = "MD5";
    private static final String MD5_PASSWORD_PREFIX = "md5";

    /**
     * Password for MD5 auth method: {@code "md5" + md5hex(md5hex(password + user) + salt)}.
     */
    public static String encodeMd5Password(String user, String password, byte[] salt) {
        try {
            MessageDigest md5 = MessageDigest.getInstance(MD5_DIGEST_NAME);

            md5.update(password.getBytes(StandardCharsets.UTF_8));
            md5.update(user.getBytes(StandardCharsets.UTF_8));
            String passwordAndUserHash = HexFormat.of().formatHex(md5.digest());

            md5.update(passwordAndUserHash.getBytes(StandardCharsets.US_ASCII));
            md5.update(salt);

            return MD5_PASSWORD_PREFIX + HexFormat.of().formatHex(md5.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new PgAuthenticationException("MD5 digest is not available. ", e);
        }
    }

    private PasswordUtils() {
    }
}
