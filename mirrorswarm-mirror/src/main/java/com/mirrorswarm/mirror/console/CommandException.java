package com.mirrorswarm.mirror.console;

/**
 * A console command failed. The message has been posted to the console
 * channel by the time this is thrown.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        /** Malformed argument. */
        FORMAT,
        /** The referenced message does not exist in any monitored channel. */
        NOT_FOUND,
        /** The operator declined or did not confirm in time. */
        CANCELLED,
        /** The operation itself failed. */
        FAILED
    }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CommandException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
