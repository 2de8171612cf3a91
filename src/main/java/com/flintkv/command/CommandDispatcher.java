package com.flintkv.command;

import com.flintkv.config.ServerConfig;
import com.flintkv.core.Entry;
import com.flintkv.core.KVStore;
import com.flintkv.network.protocol.Command;
import com.flintkv.network.protocol.Reply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Executes decoded commands against the keyspace and the server config.
 * Holds no state of its own; safe to share between connections.
 *
 * Supported commands (names are case-insensitive):
 * <ul>
 *   <li>{@code PING} - replies PONG, arguments ignored</li>
 *   <li>{@code ECHO message}</li>
 *   <li>{@code SET key value [PX milliseconds]}</li>
 *   <li>{@code GET key}</li>
 *   <li>{@code CONFIG GET parameter}</li>
 * </ul>
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String INTERNAL_ERROR = "ERR internal error";

    private final KVStore store;
    private final ServerConfig config;

    public CommandDispatcher(KVStore store, ServerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * Execute a command and produce its reply. Never throws: invalid
     * invocations and unexpected failures both become error replies.
     *
     * @param command the decoded command
     * @return the reply to send
     */
    public Reply dispatch(Command command) {
        try {
            switch (command.getNormalizedName()) {
                case "PING":
                    return Reply.pong();
                case "ECHO":
                    return handleEcho(command);
                case "SET":
                    return handleSet(command);
                case "GET":
                    return handleGet(command);
                case "CONFIG":
                    return handleConfig(command);
                default:
                    logger.debug("Unknown command: {}", command.getName());
                    throw CommandException.unknownCommand();
            }
        } catch (CommandException e) {
            return Reply.error(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error processing command {}: {}", command.getName(), e.toString(), e);
            return Reply.error(INTERNAL_ERROR);
        }
    }

    private Reply handleEcho(Command command) {
        if (command.argCount() != 1) {
            throw CommandException.wrongArity();
        }
        return Reply.bulkString(command.arg(0));
    }

    private Reply handleSet(Command command) {
        long ttlMillis;
        if (command.argCount() == 2) {
            ttlMillis = 0;
        } else if (command.argCount() == 4) {
            ttlMillis = parseExpiry(command.arg(2), command.arg(3));
        } else {
            throw CommandException.unknownCommand();
        }
        store.set(command.arg(0), command.arg(1), ttlMillis);
        return Reply.ok();
    }

    /**
     * Parse a {@code PX milliseconds} clause. Zero means no expiry.
     */
    private long parseExpiry(String option, String amount) {
        if (!"PX".equalsIgnoreCase(option)) {
            throw CommandException.unknownCommand();
        }
        long millis;
        try {
            millis = Long.parseLong(amount);
        } catch (NumberFormatException e) {
            throw CommandException.unknownCommand();
        }
        if (millis < 0) {
            throw CommandException.unknownCommand();
        }
        return millis;
    }

    private Reply handleGet(Command command) {
        if (command.argCount() != 1) {
            throw CommandException.wrongArity();
        }
        Optional<Entry> entry = store.get(command.arg(0));
        return entry.map(e -> Reply.bulkString(e.getValue())).orElseGet(Reply::nullReply);
    }

    private Reply handleConfig(Command command) {
        if (command.argCount() == 0) {
            throw CommandException.wrongArity();
        }
        if (!"GET".equalsIgnoreCase(command.arg(0))) {
            throw CommandException.unknownCommand();
        }
        if (command.argCount() != 2) {
            throw CommandException.wrongArity();
        }
        String name = command.arg(1);
        return Reply.array(name, config.get(name).orElse(""));
    }
}
