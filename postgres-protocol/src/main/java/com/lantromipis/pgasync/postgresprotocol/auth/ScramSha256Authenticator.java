package com.lantromipis.pgasync.postgresprotocol.auth;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolScramConstants;
import com.lantromipis.pgasync.postgresprotocol.exception.PgAuthenticationException;
import com.lantromipis.pgasync.postgresprotocol.utils.ScramUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.UUID;
import java.util.regex.Matcher;

/**
 * Client side of SCRAM-SHA-256 exchange. One instance per authentication attempt.
 */
@Slf4j
public class ScramSha256Authenticator {

    private enum SaslAuthStatus {
        NOT_STARTED,
        FIRST_CLIENT_MESSAGE_SENT,
        LAST_CLIENT_MESSAGE_SENT,
        COMPLETED
    }

    private final String password;
    private final String clientNonce;

    private String clientFirstMessageBare;
    private byte[] saltedPassword;
    private String authMessage;

    private SaslAuthStatus authStatus = SaslAuthStatus.NOT_STARTED;

    public ScramSha256Authenticator(String password) {
        this(password, UUID.randomUUID().toString().replace("-", ""));
    }

    public ScramSha256Authenticator(String password, String clientNonce) {
        this.password = password;
        this.clientNonce = clientNonce;
    }

    /**
     * @return data for SASLInitialResponse, including GS2 header
     */
    public String createClientFirstMessage() {
        if (!SaslAuthStatus.NOT_STARTED.equals(authStatus)) {
            throw new IllegalStateException("SCRAM exchange already started");
        }

        clientFirstMessageBare = String.format(PostgresProtocolScramConstants.CLIENT_FIRST_MESSAGE_BARE_FORMAT, clientNonce);
        authStatus = SaslAuthStatus.FIRST_CLIENT_MESSAGE_SENT;

        return PostgresProtocolScramConstants.GS2_HEADER + clientFirstMessageBare;
    }

    /**
     * Processes server-first-message from AuthenticationSASLContinue.
     *
     * @return client-final-message for SASLResponse
     */
    public String handleServerFirstMessage(String serverFirstMessage) {
        if (!SaslAuthStatus.FIRST_CLIENT_MESSAGE_SENT.equals(authStatus)) {
            throw new PgAuthenticationException("Unexpected SASL continue message in state " + authStatus);
        }

        Matcher serverFirstMessageMatcher = PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_PATTERN.matcher(serverFirstMessage);
        if (!serverFirstMessageMatcher.matches()) {
            throw new PgAuthenticationException("Malformed SCRAM server first message: " + serverFirstMessage);
        }

        String serverNonce = serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_SERVER_NONCE_MATCHER_GROUP);

        if (!serverNonce.startsWith(clientNonce)) {
            throw new PgAuthenticationException("SCRAM server nonce does not start with client nonce");
        }

        byte[] salt = decodeBase64(serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_SALT_MATCHER_GROUP));
        int iterationCount = Integer.parseInt(serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_ITERATION_COUNT_MATCHER_GROUP));

        String g2HeaderEncoded = Base64.getEncoder().encodeToString(PostgresProtocolScramConstants.GS2_HEADER.getBytes(StandardCharsets.US_ASCII));

        String clientFinalMessageWithoutProof = String.format(
                PostgresProtocolScramConstants.CLIENT_FINAL_MESSAGE_WITHOUT_PROOF_FORMAT,
                g2HeaderEncoded,
                serverNonce
        );
        authMessage = clientFirstMessageBare + "," + serverFirstMessage + "," + clientFinalMessageWithoutProof;

        try {
            saltedPassword = ScramUtils.generateSaltedPassword(password, salt, iterationCount, PostgresProtocolScramConstants.SHA256_HMAC_NAME);

            byte[] clientKey = ScramUtils.computeHmac(saltedPassword, PostgresProtocolScramConstants.SHA256_HMAC_NAME, PostgresProtocolScramConstants.CLIENT_KEY);
            byte[] storedKey = ScramUtils.digest(clientKey, PostgresProtocolScramConstants.SHA256_DIGEST_NAME);
            byte[] clientSignature = ScramUtils.computeHmac(storedKey, PostgresProtocolScramConstants.SHA256_HMAC_NAME, authMessage);
            byte[] clientProof = ScramUtils.xor(clientKey, clientSignature);

            authStatus = SaslAuthStatus.LAST_CLIENT_MESSAGE_SENT;

            return String.format(
                    PostgresProtocolScramConstants.CLIENT_FINAL_MESSAGE_FORMAT,
                    clientFinalMessageWithoutProof,
                    Base64.getEncoder().encodeToString(clientProof)
            );
        } catch (GeneralSecurityException e) {
            throw new PgAuthenticationException("Failed to compute SCRAM client proof. ", e);
        }
    }

    /**
     * Verifies server signature from AuthenticationSASLFinal.
     */
    public void handleServerFinalMessage(String serverFinalMessage) {
        if (!SaslAuthStatus.LAST_CLIENT_MESSAGE_SENT.equals(authStatus)) {
            throw new PgAuthenticationException("Unexpected SASL final message in state " + authStatus);
        }

        Matcher serverFinalMessageMatcher = PostgresProtocolScramConstants.SERVER_FINAL_MESSAGE_PATTERN.matcher(serverFinalMessage);
        if (!serverFinalMessageMatcher.matches()) {
            throw new PgAuthenticationException("Malformed SCRAM server final message: " + serverFinalMessage);
        }

        byte[] receivedSignature = decodeBase64(serverFinalMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FINAL_MESSAGE_SIGNATURE_MATCHER_GROUP));

        try {
            byte[] serverKey = ScramUtils.computeHmac(saltedPassword, PostgresProtocolScramConstants.SHA256_HMAC_NAME, PostgresProtocolScramConstants.SERVER_KEY);
            byte[] expectedSignature = ScramUtils.computeHmac(serverKey, PostgresProtocolScramConstants.SHA256_HMAC_NAME, authMessage);

            if (!MessageDigest.isEqual(expectedSignature, receivedSignature)) {
                throw new PgAuthenticationException("SCRAM server signature does not match");
            }
        } catch (GeneralSecurityException e) {
            throw new PgAuthenticationException("Failed to compute SCRAM server signature. ", e);
        }

        authStatus = SaslAuthStatus.COMPLETED;
        log.debug("SCRAM-SHA-256 server signature verified");
    }

    public boolean isCompleted() {
        return SaslAuthStatus.COMPLETED.equals(authStatus);
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new PgAuthenticationException("Invalid base64 value in SCRAM server message: " + value, e);
        }
    }
}
