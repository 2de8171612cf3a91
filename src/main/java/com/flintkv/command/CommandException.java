package com.flintkv.command;

/**
 * Exception thrown for a recognized but invalid command invocation.
 * The message is sent to the client verbatim as a RESP error; the
 * connection stays open.
 */
public class CommandException extends RuntimeException {

    public static final String UNKNOWN_COMMAND = "ERR unknown command";
    public static final String WRONG_ARITY = "ERR wrong number of arguments";

    public CommandException(String message) {
        super(message);
    }

    public static CommandException unknownCommand() {
        return new CommandException(UNKNOWN_COMMAND);
    }

    public static CommandException wrongArity() {
        return new CommandException(WRONG_ARITY);
    }
}
