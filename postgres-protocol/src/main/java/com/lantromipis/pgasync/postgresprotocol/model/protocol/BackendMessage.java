package com.lantromipis.pgasync.postgresprotocol.model.protocol;

/**
 * Message sent by Postgres server to client. Every kind is listed here, so {@link BackendMessageVisitor} implementations
 * must handle all of them.
 */
public sealed interface BackendMessage permits AuthenticationRequest, BackendKeyData, BindComplete, CloseComplete,
        CommandComplete, CopyInResponse, CopyOutResponse, DataRow, EmptyQueryResponse, ErrorResponse, NoData,
        NoticeResponse, ParameterDescription, ParameterStatus, ParseComplete, PortalSuspended, ReadyForQuery,
        RowDescription, UnknownMessage {

    byte getMessageMarker();

    void accept(BackendMessageVisitor visitor);
}
