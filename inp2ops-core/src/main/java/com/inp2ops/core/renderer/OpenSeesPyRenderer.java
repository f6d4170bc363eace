package com.inp2ops.core.renderer;

import com.inp2ops.core.translator.Command;
import com.inp2ops.core.translator.CommandBlock;
import com.inp2ops.core.translator.CommandSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders command sequences as OpenSeesPy scripts.
 *
 * <p>The script imports {@code openseespy.opensees}, then writes every block under a {@code # Title} comment
 * followed by a blank line, in the fixed block order of the sequence. Each command kind has exactly one
 * formatting rule; numbers follow {@link ScriptNumbers}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ScriptRenderer renderer = new OpenSeesPyRenderer();
 * String script = renderer.render(result.commands());
 * }</pre>
 *
 * @see <a href="https://openseespydoc.readthedocs.io/">OpenSeesPy Documentation</a>
 */
public class OpenSeesPyRenderer implements ScriptRenderer {

    private static final Logger log = LoggerFactory.getLogger(OpenSeesPyRenderer.class);

    // Renderer identification
    private static final String RENDERER_ID = "openseespy";
    private static final String RENDERER_DISPLAY_NAME = "OpenSeesPy Script Renderer";
    private static final String FILE_EXTENSION = "py";

    // Script layout
    private static final String HEADER_COMMENT = "# Translated OpenSeesPy model";
    private static final String IMPORT_LINE = "from openseespy.opensees import *";
    private static final String COMMENT_PREFIX = "# ";
    private static final String NEWLINE = "\n";
    private static final String ARGUMENT_SEPARATOR = ", ";

    @Override
    public String getId() {
        return RENDERER_ID;
    }

    @Override
    public String getDisplayName() {
        return RENDERER_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public String render(CommandSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        StringBuilder script = new StringBuilder();
        script.append(HEADER_COMMENT).append(NEWLINE);
        script.append(IMPORT_LINE).append(NEWLINE);
        script.append(NEWLINE);

        for (CommandBlock block : sequence.blocks()) {
            script.append(COMMENT_PREFIX).append(block.kind().title()).append(NEWLINE);
            for (Command command : block.commands()) {
                for (String line : lines(command)) {
                    script.append(line).append(NEWLINE);
                }
            }
            script.append(NEWLINE);
        }

        log.debug("Rendered {} characters of OpenSeesPy script", script.length());
        return script.toString();
    }

    /**
     * Formats one command.
     *
     * @param command the command
     * @return the lines it renders to
     */
    List<String> lines(Command command) {
        if (command instanceof Command.CommentCommand c) {
            return List.of(COMMENT_PREFIX + c.text());
        }
        if (command instanceof Command.ModelInitCommand m) {
            return List.of("wipe()",
                call("model", List.of("basic", "-ndm", m.ndm(), "-ndf", m.ndf())));
        }
        if (command instanceof Command.NodeCommand n) {
            return List.of(call("node", List.of(n.id(), n.x(), n.y(), n.z())));
        }
        if (command instanceof Command.MaterialCommand m) {
            String name = m.category() == Command.MaterialCategory.ND ? "nDMaterial" : "uniaxialMaterial";
            List<Object> args = new ArrayList<>();
            args.add(m.type());
            args.add(m.tag());
            args.addAll(m.parameters());
            return List.of(call(name, args));
        }
        if (command instanceof Command.SectionCommand s) {
            List<Object> args = new ArrayList<>();
            args.add(s.type());
            args.add(s.tag());
            args.addAll(s.parameters());
            return List.of(call("section", args));
        }
        if (command instanceof Command.GeomTransfCommand g) {
            List<Object> args = new ArrayList<>();
            args.add(g.type());
            args.add(g.tag());
            args.addAll(g.vectorXz());
            return List.of(call("geomTransf", args));
        }
        if (command instanceof Command.ElementCommand e) {
            List<Object> args = new ArrayList<>();
            args.add(e.type());
            args.add(e.id());
            args.addAll(e.nodeIds());
            args.addAll(e.arguments());
            return List.of(call("element", args));
        }
        if (command instanceof Command.FixCommand f) {
            List<Object> args = new ArrayList<>();
            args.add(f.nodeId());
            args.addAll(f.flags());
            return List.of(call("fix", args));
        }
        if (command instanceof Command.TimeSeriesCommand t) {
            return List.of(call("timeSeries", List.of(t.type(), t.tag())));
        }
        if (command instanceof Command.LoadPatternCommand p) {
            return List.of(call("pattern", List.of(p.type(), p.tag(), p.timeSeriesTag())));
        }
        if (command instanceof Command.LoadCommand l) {
            List<Object> args = new ArrayList<>();
            args.add(l.nodeId());
            args.addAll(l.components());
            return List.of(call("load", args));
        }
        Command.AnalysisSetupCommand a = (Command.AnalysisSetupCommand) command;
        return List.of(call(a.command(), a.arguments()));
    }

    private static String call(String function, List<?> arguments) {
        StringBuilder line = new StringBuilder(function).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                line.append(ARGUMENT_SEPARATOR);
            }
            line.append(ScriptNumbers.literal(arguments.get(i)));
        }
        return line.append(')').toString();
    }
}
