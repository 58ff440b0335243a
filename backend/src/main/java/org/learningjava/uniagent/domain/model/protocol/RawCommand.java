package org.learningjava.uniagent.domain.model.protocol;

/**
 * A {@code [[NAME: argument]]} line as found in the engine output.
 * Name is upper-cased, argument trimmed (empty when absent).
 */
public record RawCommand(String name, String argument) {

    public RawCommand {
        name = name == null ? "" : name;
        argument = argument == null ? "" : argument;
    }
}
