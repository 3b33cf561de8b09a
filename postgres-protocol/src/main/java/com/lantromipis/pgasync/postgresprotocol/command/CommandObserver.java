package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.model.PgRow;

/**
 * Receives results of command. At most one of {@link #onComplete()} and {@link #onError(Throwable)} is called.
 */
public interface CommandObserver {

    void onNext(PgRow row);

    void onError(Throwable throwable);

    void onComplete();
}
