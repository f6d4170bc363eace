package com.inp2ops.core.translator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, structured translation output: one {@link CommandBlock} per {@link BlockKind}, in enum order.
 *
 * @param blocks all blocks in output order, empty ones included
 */
public record CommandSequence(List<CommandBlock> blocks) {

    public CommandSequence {
        Objects.requireNonNull(blocks, "blocks must not be null");
        blocks = List.copyOf(blocks);
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).kind().ordinal() != i) {
                throw new IllegalArgumentException("blocks must cover every kind in order, found "
                    + blocks.get(i).kind() + " at position " + i);
            }
        }
        if (blocks.size() != BlockKind.values().length) {
            throw new IllegalArgumentException("expected " + BlockKind.values().length + " blocks");
        }
    }

    /**
     * Builds a sequence from per-kind command lists; missing kinds become empty blocks.
     *
     * @param commands commands by block
     * @return the sequence
     */
    public static CommandSequence of(Map<BlockKind, List<Command>> commands) {
        Map<BlockKind, List<Command>> byKind = new EnumMap<>(BlockKind.class);
        byKind.putAll(commands);
        List<CommandBlock> blocks = new ArrayList<>();
        for (BlockKind kind : BlockKind.values()) {
            blocks.add(new CommandBlock(kind, byKind.getOrDefault(kind, List.of())));
        }
        return new CommandSequence(blocks);
    }

    /**
     * Returns the commands of one block.
     *
     * @param kind block kind
     * @return commands, possibly empty
     */
    public List<Command> commands(BlockKind kind) {
        return blocks.get(kind.ordinal()).commands();
    }

    /**
     * Returns all commands of one type across every block.
     *
     * @param type command type
     * @param <T> command type
     * @return matching commands in output order
     */
    public <T extends Command> List<T> commandsOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (CommandBlock block : blocks) {
            for (Command command : block.commands()) {
                if (type.isInstance(command)) {
                    result.add(type.cast(command));
                }
            }
        }
        return result;
    }
}
