package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields shared by ErrorResponse and NoticeResponse.
 * <a href="https://www.postgresql.org/docs/current/protocol-error-fields.html">Field list</a>
 */
@Getter
@Setter
@ToString
public abstract class ServerReportFields {
    private String severity;
    private String code;
    private String message;
    private String detail;
    private String hint;
    private String position;
    private String where;
    /**
     * All received fields by their marker, including the ones without dedicated getter.
     */
    private Map<Character, String> allFields = new LinkedHashMap<>();
}
