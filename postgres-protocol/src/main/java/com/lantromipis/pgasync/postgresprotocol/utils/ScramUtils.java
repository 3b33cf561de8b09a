package com.lantromipis.pgasync.postgresprotocol.utils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ScramUtils {

    private static final byte[] INT_1 = new byte[]{0, 0, 0, 1};

    public static byte[] computeHmac(final byte[] keyBytes, String hmacName, final String string) throws InvalidKeyException, NoSuchAlgorithmException {
        return computeHmac(keyBytes, hmacName, string.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] computeHmac(final byte[] keyBytes, String hmacName, final byte[] bytes) throws InvalidKeyException, NoSuchAlgorithmException {
        Mac mac = createHmac(keyBytes, hmacName);

        mac.update(bytes);
        return mac.doFinal();
    }

    public static byte[] digest(final byte[] bytes, String digestName) throws NoSuchAlgorithmException {
        return MessageDigest.getInstance(digestName).digest(bytes);
    }

    /**
     * Hi() function from RFC 5802.
     */
    public static byte[] generateSaltedPassword(final String password,
                                                byte[] salt,
                                                int iterationsCount,
                                                String hmacName) throws InvalidKeyException, NoSuchAlgorithmException {
        Mac mac = createHmac(password.getBytes(StandardCharsets.UTF_8), hmacName);

        mac.update(salt);
        mac.update(INT_1);
        byte[] result = mac.doFinal();

        byte[] previous = null;
        for (int i = 1; i < iterationsCount; i++) {
            mac.update(previous != null ? previous : result);
            previous = mac.doFinal();
            for (int x = 0; x < result.length; x++) {
                result[x] ^= previous[x];
            }
        }

        return result;
    }

    public static Mac createHmac(final byte[] keyBytes, String hmacName) throws NoSuchAlgorithmException, InvalidKeyException {
        SecretKeySpec key = new SecretKeySpec(keyBytes, hmacName);
        Mac mac = Mac.getInstance(hmacName);
        mac.init(key);
        return mac;
    }

    public static byte[] xor(final byte[] first, final byte[] second) {
        byte[] ret = first.clone();
        for (int i = 0; i < ret.length; i++) {
            ret[i] ^= second[i];
        }
        return ret;
    }

    private ScramUtils() {
    }
}
