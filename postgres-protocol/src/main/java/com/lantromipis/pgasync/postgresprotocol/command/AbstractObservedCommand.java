package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.model.PgRow;

/**
 * Base for commands which deliver rows to observer. Becomes inactive after terminal event or cancel, so the observer
 * gets exactly one terminal event and nothing after cancel.
 */
public abstract class AbstractObservedCommand {

    private final CommandObserver observer;
    private boolean active = true;

    protected AbstractObservedCommand(CommandObserver observer) {
        this.observer = observer;
    }

    public boolean isActive() {
        return active;
    }

    public boolean shouldWaitForComplete() {
        return true;
    }

    public boolean isObserved() {
        return true;
    }

    public void next(PgRow row) {
        if (active) {
            observer.onNext(row);
        }
    }

    public void complete() {
        if (active) {
            active = false;
            observer.onComplete();
        }
    }

    public void error(Throwable throwable) {
        if (active) {
            active = false;
            observer.onError(throwable);
        }
    }

    public void cancel() {
        active = false;
    }
}
