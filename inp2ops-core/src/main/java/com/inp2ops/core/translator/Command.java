package com.inp2ops.core.translator;

import java.util.List;
import java.util.Objects;

/**
 * One target-runtime command in structured form.
 *
 * <p>The set of command kinds is closed; each kind has exactly one formatting rule in the renderer.
 */
public sealed interface Command permits
    Command.CommentCommand,
    Command.ModelInitCommand,
    Command.NodeCommand,
    Command.MaterialCommand,
    Command.SectionCommand,
    Command.GeomTransfCommand,
    Command.ElementCommand,
    Command.FixCommand,
    Command.TimeSeriesCommand,
    Command.LoadPatternCommand,
    Command.LoadCommand,
    Command.AnalysisSetupCommand {

    /**
     * Free-text note kept in the script, e.g. for skipped entities.
     *
     * @param text single-line comment text
     */
    record CommentCommand(String text) implements Command {
        public CommentCommand {
            Objects.requireNonNull(text, "text must not be null");
            text = text.replace('\n', ' ').replace('\r', ' ');
        }
    }

    /**
     * Model builder initialization.
     *
     * @param ndm spatial dimension
     * @param ndf degrees of freedom per node
     */
    record ModelInitCommand(int ndm, int ndf) implements Command {}

    /**
     * Node creation.
     *
     * @param id node tag
     * @param x x coordinate
     * @param y y coordinate
     * @param z z coordinate
     */
    record NodeCommand(int id, double x, double y, double z) implements Command {}

    /**
     * Material creation.
     *
     * @param category nD or uniaxial
     * @param type material type
     * @param tag material tag
     * @param parameters numeric parameters after the tag
     */
    record MaterialCommand(MaterialCategory category, String type, int tag, List<Double> parameters)
        implements Command {
        public MaterialCommand {
            Objects.requireNonNull(category, "category must not be null");
            Objects.requireNonNull(type, "type must not be null");
            parameters = List.copyOf(parameters);
        }
    }

    /**
     * Section creation.
     *
     * @param type section type
     * @param tag section tag
     * @param parameters numeric parameters after the tag
     */
    record SectionCommand(String type, int tag, List<Double> parameters) implements Command {
        public SectionCommand {
            Objects.requireNonNull(type, "type must not be null");
            parameters = List.copyOf(parameters);
        }
    }

    /**
     * Geometric transformation for beam elements.
     *
     * @param type transformation type
     * @param tag transformation tag
     * @param vectorXz vector in the local x-z plane
     */
    record GeomTransfCommand(String type, int tag, List<Double> vectorXz) implements Command {
        public GeomTransfCommand {
            Objects.requireNonNull(type, "type must not be null");
            vectorXz = List.copyOf(vectorXz);
        }
    }

    /**
     * Element creation.
     *
     * @param type target element type
     * @param id element tag
     * @param nodeIds connected nodes in source order
     * @param arguments trailing arguments: tags as integers, areas as doubles
     */
    record ElementCommand(String type, int id, List<Integer> nodeIds, List<Number> arguments) implements Command {
        public ElementCommand {
            Objects.requireNonNull(type, "type must not be null");
            nodeIds = List.copyOf(nodeIds);
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Single-point constraint.
     *
     * @param nodeId constrained node
     * @param flags one flag per DOF, 1 fixed and 0 free
     */
    record FixCommand(int nodeId, List<Integer> flags) implements Command {
        public FixCommand {
            flags = List.copyOf(flags);
        }
    }

    /**
     * Time series for the load pattern.
     *
     * @param type series type
     * @param tag series tag
     */
    record TimeSeriesCommand(String type, int tag) implements Command {}

    /**
     * Load pattern that the following loads belong to.
     *
     * @param type pattern type
     * @param tag pattern tag
     * @param timeSeriesTag series driving the pattern
     */
    record LoadPatternCommand(String type, int tag, int timeSeriesTag) implements Command {}

    /**
     * Nodal load.
     *
     * @param nodeId loaded node
     * @param components one value per DOF
     */
    record LoadCommand(int nodeId, List<Double> components) implements Command {
        public LoadCommand {
            components = List.copyOf(components);
        }
    }

    /**
     * One command of the static analysis setup.
     *
     * @param command command name
     * @param arguments literal arguments
     */
    record AnalysisSetupCommand(String command, List<Object> arguments) implements Command {
        public AnalysisSetupCommand {
            Objects.requireNonNull(command, "command must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Which material command a {@link MaterialCommand} renders as.
     */
    enum MaterialCategory {
        ND,
        UNIAXIAL
    }
}
