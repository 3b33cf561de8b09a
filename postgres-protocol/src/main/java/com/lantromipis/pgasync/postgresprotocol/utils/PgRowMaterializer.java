package com.lantromipis.pgasync.postgresprotocol.utils;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.lantromipis.pgasync.postgresprotocol.exception.MessageDecodingException;
import com.lantromipis.pgasync.postgresprotocol.model.PgRow;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.DataRow;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.RowDescription;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Zips column descriptions with data row values. Only bool columns are converted, everything else stays in text format.
 */
public class PgRowMaterializer {

    public static PgRow materialize(RowDescription rowDescription, DataRow dataRow) {
        List<RowDescription.FieldDescription> fields = rowDescription == null
                ? List.of()
                : rowDescription.getFieldDescriptions();
        List<byte[]> columns = dataRow.getColumns();

        if (fields.size() != columns.size()) {
            throw new MessageDecodingException(
                    "Data row has " + columns.size() + " columns, but row description has " + fields.size() + " columns."
            );
        }

        List<String> names = new ArrayList<>(fields.size());
        List<Object> values = new ArrayList<>(fields.size());

        for (int i = 0; i < fields.size(); i++) {
            RowDescription.FieldDescription field = fields.get(i);
            names.add(field.getFieldName());
            values.add(convertValue(field, columns.get(i)));
        }

        return new PgRow(names, values);
    }

    private static Object convertValue(RowDescription.FieldDescription field, byte[] raw) {
        if (raw == null) {
            return null;
        }

        String text = new String(raw, StandardCharsets.UTF_8);

        if (field.getFieldDataTypeOid() == PostgresProtocolGeneralConstants.BOOL_TYPE_OID) {
            return convertBool(field, text);
        }

        return text;
    }

    private static Boolean convertBool(RowDescription.FieldDescription field, String text) {
        if (PostgresProtocolGeneralConstants.BOOL_TRUE_TEXT.equals(text)) {
            return Boolean.TRUE;
        }
        if (PostgresProtocolGeneralConstants.BOOL_FALSE_TEXT.equals(text)) {
            return Boolean.FALSE;
        }
        throw new MessageDecodingException(
                "Unexpected value '" + text + "' in bool column " + field.getFieldName() + ". Only text format is supported."
        );
    }

    private PgRowMaterializer() {
    }
}
