package com.inp2ops.core.translator;

import java.util.List;
import java.util.Objects;

/**
 * Commands of one entity block.
 *
 * @param kind which block
 * @param commands commands in output order
 */
public record CommandBlock(
    BlockKind kind,
    List<Command> commands
) {
    public CommandBlock {
        Objects.requireNonNull(kind, "kind must not be null");
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
