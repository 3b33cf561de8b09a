package com.lantromipis.pgasync.postgresprotocol.constant;

import java.util.regex.Pattern;

public class PostgresProtocolScramConstants {
    public static final String SASL_SHA_256_AUTH_MECHANISM_NAME = "SCRAM-SHA-256";
    public static final String SHA256_DIGEST_NAME = "SHA-256";
    public static final String SHA256_HMAC_NAME = "HmacSHA256";

    public static final String GS2_HEADER = "n,,";
    public static final String CLIENT_KEY = "Client Key";
    public static final String SERVER_KEY = "Server Key";

    public static final String CLIENT_FIRST_MESSAGE_BARE_FORMAT = "n=*,r=%s";
    public static final String CLIENT_FINAL_MESSAGE_WITHOUT_PROOF_FORMAT = "c=%s,r=%s";
    public static final String CLIENT_FINAL_MESSAGE_FORMAT = "%s,p=%s";

    public static final Pattern SERVER_FIRST_MESSAGE_PATTERN = Pattern.compile("r=([^,]*),s=([^,]*),i=(\\d+).*$");
    public static final int SERVER_FIRST_MESSAGE_SERVER_NONCE_MATCHER_GROUP = 1;
    public static final int SERVER_FIRST_MESSAGE_SALT_MATCHER_GROUP = 2;
    public static final int SERVER_FIRST_MESSAGE_ITERATION_COUNT_MATCHER_GROUP = 3;

    public static final Pattern SERVER_FINAL_MESSAGE_PATTERN = Pattern.compile("v=([^,]*).*$");
    public static final int SERVER_FINAL_MESSAGE_SIGNATURE_MATCHER_GROUP = 1;

    private PostgresProtocolScramConstants() {
    }
}
