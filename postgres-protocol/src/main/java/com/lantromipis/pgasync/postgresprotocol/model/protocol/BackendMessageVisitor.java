package com.lantromipis.pgasync.postgresprotocol.model.protocol;

public interface BackendMessageVisitor {

    void visitAuthenticationRequest(AuthenticationRequest message);

    void visitBackendKeyData(BackendKeyData message);

    void visitParameterStatus(ParameterStatus message);

    void visitRowDescription(RowDescription message);

    void visitDataRow(DataRow message);

    void visitCommandComplete(CommandComplete message);

    void visitReadyForQuery(ReadyForQuery message);

    void visitErrorResponse(ErrorResponse message);

    void visitNoticeResponse(NoticeResponse message);

    void visitEmptyQueryResponse(EmptyQueryResponse message);

    void visitParseComplete(ParseComplete message);

    void visitBindComplete(BindComplete message);

    void visitCloseComplete(CloseComplete message);

    void visitNoData(NoData message);

    void visitParameterDescription(ParameterDescription message);

    void visitPortalSuspended(PortalSuspended message);

    void visitCopyInResponse(CopyInResponse message);

    void visitCopyOutResponse(CopyOutResponse message);

    void visitUnknownMessage(UnknownMessage message);
}
