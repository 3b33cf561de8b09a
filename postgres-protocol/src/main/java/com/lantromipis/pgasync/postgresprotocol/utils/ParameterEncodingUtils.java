package com.lantromipis.pgasync.postgresprotocol.utils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Converts positional statement parameters to Postgres text format.
 */
public class ParameterEncodingUtils {

    private static final String BYTEA_HEX_PREFIX = "\\x";

    public static List<byte[]> encodeTextParameters(List<?> parameters) {
        if (parameters == null) {
            return List.of();
        }

        List<byte[]> ret = new ArrayList<>(parameters.size());
        for (Object parameter : parameters) {
            ret.add(encodeTextParameter(parameter));
        }

        return ret;
    }

    public static byte[] encodeTextParameter(Object parameter) {
        if (parameter == null) {
            return null;
        }

        if (parameter instanceof byte[] bytes) {
            return (BYTEA_HEX_PREFIX + HexFormat.of().formatHex(bytes)).getBytes(StandardCharsets.UTF_8);
        }

        if (parameter instanceof Boolean bool) {
            return (bool ? "true" : "false").getBytes(StandardCharsets.UTF_8);
        }

        return String.valueOf(parameter).getBytes(StandardCharsets.UTF_8);
    }

    private ParameterEncodingUtils() {
    }
}
