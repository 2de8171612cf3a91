package com.flintkv.network.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable command object representing a client request.
 * The name keeps the case the client sent; dispatch compares it case-insensitively.
 */
public final class Command {

    private final String name;
    private final List<String> args;

    /**
     * Create a new command.
     *
     * @param name the command name as received
     * @param args the ordered arguments following the name
     */
    public Command(String name, List<String> args) {
        if (name == null) {
            throw new IllegalArgumentException("Command name cannot be null");
        }
        this.name = name;
        this.args = args != null ? List.copyOf(args) : Collections.emptyList();
    }

    /**
     * Create a command from its tokens, name first.
     */
    public static Command of(String name, String... args) {
        return new Command(name, Arrays.asList(args));
    }

    public String getName() {
        return name;
    }

    /**
     * Get the upper-cased command name used for dispatch.
     */
    public String getNormalizedName() {
        return name.toUpperCase(Locale.ROOT);
    }

    public List<String> getArgs() {
        return args;
    }

    public int argCount() {
        return args.size();
    }

    /**
     * Get an argument by position.
     *
     * @param index zero-based argument position (the name is not counted)
     */
    public String arg(int index) {
        return args.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Command command = (Command) o;
        return name.equals(command.name) && args.equals(command.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return "Command{" +
               "name=" + name +
               ", argCount=" + args.size() +
               '}';
    }
}
