package com.inp2ops.core.translator;

import com.inp2ops.core.mapping.ElementFamily;
import com.inp2ops.core.mapping.ElementLookup;
import com.inp2ops.core.mapping.ElementMapping;
import com.inp2ops.core.mapping.MappingTables;
import com.inp2ops.core.mapping.MaterialLookup;
import com.inp2ops.core.model.BoundaryCondition;
import com.inp2ops.core.model.BoundaryTarget;
import com.inp2ops.core.model.DofMask;
import com.inp2ops.core.model.ElasticProperties;
import com.inp2ops.core.model.Element;
import com.inp2ops.core.model.ElementSet;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.model.Load;
import com.inp2ops.core.model.Material;
import com.inp2ops.core.model.Node;
import com.inp2ops.core.model.NodeSet;
import com.inp2ops.core.model.Section;
import com.inp2ops.core.model.SectionKind;
import com.inp2ops.core.translator.Command.MaterialCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Translates a parsed {@link FeModel} into an OpenSees {@link CommandSequence}.
 *
 * <p>Output is a deterministic function of the model: nodes and elements in ascending id order, materials,
 * sections, boundary conditions and loads in definition order. Degradations (unmapped types, defaulted
 * properties) are collected as {@link ConversionWarning}s; structural problems abort with
 * {@link ConversionException} and no partial output.
 *
 * <p>The translator keeps no state between calls and never modifies the model.
 */
public class EntityTranslator {

    private static final Logger log = LoggerFactory.getLogger(EntityTranslator.class);

    private static final int TIME_SERIES_TAG = 1;
    private static final int LOAD_PATTERN_TAG = 1;
    private static final int DEFAULT_TAG = 1;
    private static final double DEFAULT_AREA = 1.0;
    private static final double DEFAULT_THICKNESS = 1.0;
    private static final int TRANSFORM_DEFAULT = 1;
    private static final int TRANSFORM_VERTICAL = 2;
    private static final double PARALLEL_TOLERANCE = 1.0e-9;

    private final MappingTables tables;
    private final ConversionOptions options;

    public EntityTranslator(MappingTables tables, ConversionOptions options) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Converts a model.
     *
     * @param model the parsed model
     * @return command sequence and warnings
     * @throws ConversionException on arity mismatches, unresolved targets, mixed DOF requirements, or unmapped
     *                             element types under {@link UnmappedPolicy#FAIL}
     */
    public ConversionResult convert(FeModel model) throws ConversionException {
        Objects.requireNonNull(model, "model must not be null");
        Run run = new Run(model);
        CommandSequence sequence = run.translate();
        log.debug("Translated {} nodes and {} elements with {} warnings",
            sequence.commandsOfType(Command.NodeCommand.class).size(),
            sequence.commandsOfType(Command.ElementCommand.class).size(),
            run.warnings.size());
        return new ConversionResult(sequence, run.warnings);
    }

    /**
     * Section data an element picks up from the section covering its element set.
     */
    private record Assignment(SectionKind kind, Integer sectionTag, Integer materialTag, Double area) {
    }

    /**
     * State of one conversion call.
     */
    private final class Run {

        private final FeModel model;
        private final List<ConversionWarning> warnings = new ArrayList<>();
        private final Map<BlockKind, List<Command>> blocks = new EnumMap<>(BlockKind.class);
        private final Map<Integer, ElementLookup> lookups = new TreeMap<>();
        private final Map<String, Integer> materialTags = new LinkedHashMap<>();
        private final Map<Integer, Assignment> assignments = new LinkedHashMap<>();
        private int ndf;

        Run(FeModel model) {
            this.model = model;
        }

        CommandSequence translate() throws ConversionException {
            for (Element element : sorted(model.elements()).values()) {
                lookups.put(element.id(), tables.lookupElement(element.type().tag()));
            }
            ndf = resolveNdf();

            blocks.put(BlockKind.MODEL, List.of(new Command.ModelInitCommand(tables.ndm(), ndf)));
            blocks.put(BlockKind.NODES, nodes());
            blocks.put(BlockKind.MATERIALS, materials());
            blocks.put(BlockKind.SECTIONS, sections());
            blocks.put(BlockKind.ELEMENTS, elements());
            blocks.put(BlockKind.BOUNDARY_CONDITIONS, boundaryConditions());
            blocks.put(BlockKind.LOADS, loads());
            blocks.put(BlockKind.ANALYSIS, analysis());
            return CommandSequence.of(blocks);
        }

        private int resolveNdf() throws ConversionException {
            Element needsThree = null;
            Element needsSix = null;
            for (Map.Entry<Integer, ElementLookup> entry : lookups.entrySet()) {
                if (!(entry.getValue() instanceof ElementLookup.Mapped mapped) || !mapped.mapping().constrainsNdf()) {
                    continue;
                }
                Element element = model.elements().get(entry.getKey());
                if (mapped.mapping().ndf() == 3 && needsThree == null) {
                    needsThree = element;
                } else if (mapped.mapping().ndf() == 6 && needsSix == null) {
                    needsSix = element;
                }
            }
            if (needsThree != null && needsSix != null) {
                throw new ConversionException(ConversionException.Kind.MIXED_DOF,
                    "element " + needsThree.id() + " (" + needsThree.type() + ") needs 3 DOFs per node but element "
                        + needsSix.id() + " (" + needsSix.type() + ") needs 6");
            }
            if (needsThree != null) {
                return 3;
            }
            if (needsSix != null) {
                return 6;
            }
            return options.defaultNdf();
        }

        private List<Command> nodes() {
            List<Command> commands = new ArrayList<>();
            for (Node node : sorted(model.nodes()).values()) {
                commands.add(new Command.NodeCommand(node.id(), node.x(), node.y(), node.z()));
            }
            return commands;
        }

        private List<Command> materials() {
            List<Command> commands = new ArrayList<>();
            for (Material material : model.materials().values()) {
                MaterialLookup lookup = tables.lookupMaterial(material.kind());
                if (lookup instanceof MaterialLookup.Unmapped) {
                    commands.add(new Command.CommentCommand("Material " + material.name() + " ("
                        + material.kind() + ") has no OpenSees equivalent"));
                    warn(ConversionWarning.Kind.UNMAPPED_MATERIAL, "material " + material.name()
                        + " of kind " + material.kind() + " is not supported");
                    continue;
                }
                MaterialLookup.Mapped mapped = (MaterialLookup.Mapped) lookup;
                int tag = materialTags.size() + 1;
                materialTags.put(FeModel.nameKey(material.name()), tag);

                ElasticProperties elastic = material.elastic();
                if (elastic.poissonsRatio() == null) {
                    warn(ConversionWarning.Kind.DEFAULTED_PROPERTY,
                        "material " + material.name() + " has no Poisson's ratio, using 0.0");
                }
                double density = densityOf(material);
                commands.add(new Command.MaterialCommand(MaterialCategory.ND, mapped.mapping().ndMaterial(), tag,
                    List.of(elastic.youngsModulus(), elastic.effectivePoissonsRatio(), density)));
                commands.add(new Command.MaterialCommand(MaterialCategory.UNIAXIAL,
                    mapped.mapping().uniaxialMaterial(), tag, List.of(elastic.youngsModulus())));
            }
            return commands;
        }

        private double densityOf(Material material) {
            if (material.density() == null) {
                warn(ConversionWarning.Kind.DEFAULTED_PROPERTY,
                    "material " + material.name() + " has no density, using 0.0");
                return 0.0;
            }
            return material.density();
        }

        private List<Command> sections() {
            List<Command> commands = new ArrayList<>();
            int nextTag = 1;
            for (Section section : model.sections()) {
                String label = section.kind().name().toLowerCase(Locale.ROOT) + " section on " + section.elsetName();
                if (section.kind() == SectionKind.UNSUPPORTED) {
                    commands.add(new Command.CommentCommand("Unsupported " + label + " skipped"));
                    warn(ConversionWarning.Kind.UNMAPPED_SECTION, label + " has no OpenSees equivalent");
                    continue;
                }
                Integer materialTag = section.materialName() == null ? null
                    : materialTags.get(FeModel.nameKey(section.materialName()));
                if (materialTag == null) {
                    commands.add(new Command.CommentCommand("Section on " + section.elsetName()
                        + " skipped: material " + section.materialName() + " is not available"));
                    warn(ConversionWarning.Kind.UNMAPPED_SECTION,
                        label + " references unmapped material " + section.materialName());
                    continue;
                }
                Material material = model.material(section.materialName()).orElseThrow();

                switch (section.kind()) {
                    case SHELL -> {
                        int tag = nextTag++;
                        commands.add(shellSection(section, material, tag));
                        assign(section, new Assignment(SectionKind.SHELL, tag, materialTag, null));
                    }
                    case BEAM -> {
                        int tag = nextTag++;
                        commands.add(beamSection(section, material, tag));
                        assign(section, new Assignment(SectionKind.BEAM, tag, materialTag, null));
                    }
                    case TRUSS -> {
                        double area = section.propertyOrDefault(0, DEFAULT_AREA);
                        if (!section.hasProperty(0)) {
                            warn(ConversionWarning.Kind.DEFAULTED_PROPERTY,
                                label + " has no cross-section area, using " + DEFAULT_AREA);
                        }
                        commands.add(new Command.CommentCommand("Truss section on " + section.elsetName()
                            + ": material " + materialTag + ", area " + area));
                        assign(section, new Assignment(SectionKind.TRUSS, null, materialTag, area));
                    }
                    default -> {
                        commands.add(new Command.CommentCommand("Solid section on " + section.elsetName()
                            + ": material " + materialTag));
                        Double area = section.hasProperty(0) ? section.properties().get(0) : null;
                        assign(section, new Assignment(SectionKind.SOLID, null, materialTag, area));
                    }
                }
            }
            return commands;
        }

        private Command shellSection(Section section, Material material, int tag) {
            double thickness = section.propertyOrDefault(0, DEFAULT_THICKNESS);
            if (!section.hasProperty(0)) {
                warn(ConversionWarning.Kind.DEFAULTED_PROPERTY,
                    "shell section on " + section.elsetName() + " has no thickness, using " + DEFAULT_THICKNESS);
            }
            ElasticProperties elastic = material.elastic();
            String label = "shell section on " + section.elsetName();
            String type = tables.sectionType(SectionKind.SHELL).orElse("ElasticMembranePlateSection");
            return new Command.SectionCommand(type, tag, List.of(
                finite(elastic.youngsModulus(), label, "Young's modulus"),
                finite(elastic.effectivePoissonsRatio(), label, "Poisson's ratio"),
                finite(thickness, label, "thickness"),
                finite(material.density() == null ? 0.0 : material.density(), label, "density")));
        }

        private Command beamSection(Section section, Material material, int tag) {
            ElasticProperties elastic = material.elastic();
            Optional<BeamProfiles.Properties> computed = BeamProfiles.compute(section.profile(), section.properties());
            if (computed.isEmpty()) {
                warn(ConversionWarning.Kind.DEFAULTED_PROPERTY, "beam section on " + section.elsetName()
                    + " has unsupported profile " + section.profile() + " or too few dimensions, using 0.0");
            }
            BeamProfiles.Properties properties = computed.orElse(new BeamProfiles.Properties(0.0, 0.0, 0.0, 0.0));
            String label = "beam section on " + section.elsetName();
            String type = tables.sectionType(SectionKind.BEAM).orElse("Elastic");
            return new Command.SectionCommand(type, tag, List.of(
                finite(elastic.youngsModulus(), label, "Young's modulus"),
                finite(properties.area(), label, "area"),
                finite(properties.iz(), label, "Iz"),
                finite(properties.iy(), label, "Iy"),
                finite(elastic.shearModulus(), label, "shear modulus"),
                finite(properties.j(), label, "torsional constant")));
        }

        // Derived values such as G = E / (2 (1 + nu)) at nu = -1 can leave the finite range
        private double finite(double value, String label, String property) {
            if (Double.isFinite(value)) {
                return value;
            }
            warn(ConversionWarning.Kind.DEFAULTED_PROPERTY,
                label + " has non-finite " + property + " (" + value + "), using 0.0");
            return 0.0;
        }

        private void assign(Section section, Assignment assignment) {
            ElementSet elementSet = model.elementSet(section.elsetName()).orElseThrow();
            for (Integer elementId : elementSet.elementIds()) {
                Assignment previous = assignments.putIfAbsent(elementId, assignment);
                if (previous != null) {
                    log.debug("Element {} already has a {} section, ignoring {} section on {}",
                        elementId, previous.kind(), assignment.kind(), section.elsetName());
                }
            }
        }

        private List<Command> elements() throws ConversionException {
            List<Command> commands = new ArrayList<>();
            boolean[] transforms = new boolean[TRANSFORM_VERTICAL + 1];

            for (Map.Entry<Integer, ElementLookup> entry : lookups.entrySet()) {
                Element element = model.elements().get(entry.getKey());
                if (entry.getValue() instanceof ElementLookup.Unmapped unmapped) {
                    if (options.unmappedPolicy() == UnmappedPolicy.FAIL) {
                        throw new ConversionException(ConversionException.Kind.UNMAPPED_TYPE,
                            "element " + element.id() + " has unsupported type " + unmapped.sourceTag());
                    }
                    commands.add(new Command.CommentCommand("Element " + element.id() + " skipped: type "
                        + unmapped.sourceTag() + " has no OpenSees equivalent"));
                    warn(ConversionWarning.Kind.UNMAPPED_ELEMENT_TYPE,
                        "element " + element.id() + " of type " + unmapped.sourceTag() + " was skipped");
                    continue;
                }

                ElementMapping mapping = ((ElementLookup.Mapped) entry.getValue()).mapping();
                if (element.nodeIds().size() != mapping.arity()) {
                    throw new ConversionException(ConversionException.Kind.ARITY_MISMATCH,
                        "element " + element.id() + " (" + element.type() + ") expects " + mapping.arity()
                            + " nodes but has " + element.nodeIds().size());
                }

                List<Number> arguments = trailingArguments(element, mapping.family(), transforms);
                arguments.addAll(mapping.extraArguments());
                commands.add(new Command.ElementCommand(mapping.target(), element.id(), element.nodeIds(),
                    arguments));
            }

            List<Command> prefix = new ArrayList<>();
            if (transforms[TRANSFORM_DEFAULT]) {
                prefix.add(new Command.GeomTransfCommand(tables.geometricTransformation(), TRANSFORM_DEFAULT,
                    List.of(0.0, 0.0, 1.0)));
            }
            if (transforms[TRANSFORM_VERTICAL]) {
                prefix.add(new Command.GeomTransfCommand(tables.geometricTransformation(), TRANSFORM_VERTICAL,
                    List.of(1.0, 0.0, 0.0)));
            }
            prefix.addAll(commands);
            return prefix;
        }

        private List<Number> trailingArguments(Element element, ElementFamily family, boolean[] transforms) {
            Assignment assignment = assignments.get(element.id());
            List<String> defaulted = new ArrayList<>();
            List<Number> arguments = new ArrayList<>();

            switch (family) {
                case SHELL -> arguments.add(sectionTag(assignment, SectionKind.SHELL, defaulted));
                case SOLID -> arguments.add(materialTag(assignment, defaulted));
                case TRUSS -> {
                    if (assignment != null && assignment.area() != null) {
                        arguments.add(assignment.area());
                    } else {
                        defaulted.add("area " + DEFAULT_AREA);
                        arguments.add(DEFAULT_AREA);
                    }
                    arguments.add(materialTag(assignment, defaulted));
                }
                case BEAM -> {
                    arguments.add(sectionTag(assignment, SectionKind.BEAM, defaulted));
                    int transform = isVertical(element) ? TRANSFORM_VERTICAL : TRANSFORM_DEFAULT;
                    transforms[transform] = true;
                    arguments.add(transform);
                }
            }

            if (!defaulted.isEmpty()) {
                warn(ConversionWarning.Kind.UNASSIGNED_SECTION, "element " + element.id() + " ("
                    + element.type() + ") has no usable section, using " + String.join(", ", defaulted));
            }
            return arguments;
        }

        private int sectionTag(Assignment assignment, SectionKind kind, List<String> defaulted) {
            if (assignment != null && assignment.kind() == kind && assignment.sectionTag() != null) {
                return assignment.sectionTag();
            }
            defaulted.add("section tag " + DEFAULT_TAG);
            return DEFAULT_TAG;
        }

        private int materialTag(Assignment assignment, List<String> defaulted) {
            if (assignment != null && assignment.materialTag() != null) {
                return assignment.materialTag();
            }
            defaulted.add("material tag " + DEFAULT_TAG);
            return DEFAULT_TAG;
        }

        private boolean isVertical(Element element) {
            Node start = model.nodes().get(element.nodeIds().get(0));
            Node end = model.nodes().get(element.nodeIds().get(element.nodeIds().size() - 1));
            double dx = end.x() - start.x();
            double dy = end.y() - start.y();
            double dz = end.z() - start.z();
            double length = Math.sqrt(dx * dx + dy * dy + dz * dz);
            return length > 0.0 && Math.hypot(dx, dy) <= PARALLEL_TOLERANCE * length;
        }

        private List<Command> boundaryConditions() throws ConversionException {
            Map<Integer, DofMask> masks = new LinkedHashMap<>();
            for (BoundaryCondition condition : model.boundaryConditions()) {
                if (condition.magnitude() != 0.0) {
                    warn(ConversionWarning.Kind.PRESCRIBED_DISPLACEMENT, "boundary on "
                        + condition.target().describe() + " prescribes " + condition.magnitude()
                        + ", emitted as fixed");
                }
                for (Integer nodeId : resolve(condition.target())) {
                    masks.merge(nodeId, condition.fixedDofs(), DofMask::or);
                }
            }

            List<Command> commands = new ArrayList<>();
            for (Map.Entry<Integer, DofMask> entry : masks.entrySet()) {
                if (entry.getValue().hasFixedBeyond(ndf)) {
                    warn(ConversionWarning.Kind.DROPPED_DOF, "node " + entry.getKey()
                        + " has constraints beyond DOF " + ndf + " that the model does not have");
                }
                commands.add(new Command.FixCommand(entry.getKey(), entry.getValue().toFlags(ndf)));
            }
            return commands;
        }

        private List<Command> loads() throws ConversionException {
            Map<Integer, double[]> totals = new LinkedHashMap<>();
            for (Load load : model.loads()) {
                for (Integer nodeId : resolve(load.target())) {
                    double[] total = totals.computeIfAbsent(nodeId, id -> new double[DofMask.DOF_COUNT]);
                    for (int i = 0; i < DofMask.DOF_COUNT; i++) {
                        total[i] += load.components().get(i);
                    }
                }
            }
            if (totals.isEmpty()) {
                return List.of();
            }

            List<Command> commands = new ArrayList<>();
            commands.add(new Command.TimeSeriesCommand(tables.timeSeries(), TIME_SERIES_TAG));
            commands.add(new Command.LoadPatternCommand(tables.loadPattern(), LOAD_PATTERN_TAG, TIME_SERIES_TAG));
            for (Map.Entry<Integer, double[]> entry : totals.entrySet()) {
                double[] total = entry.getValue();
                List<Double> components = new ArrayList<>(ndf);
                for (int i = 0; i < DofMask.DOF_COUNT; i++) {
                    if (i < ndf) {
                        components.add(total[i]);
                    } else if (total[i] != 0.0) {
                        warn(ConversionWarning.Kind.DROPPED_DOF, "load on node " + entry.getKey() + " DOF "
                            + (i + 1) + " dropped, the model has " + ndf + " DOFs per node");
                    }
                }
                commands.add(new Command.LoadCommand(entry.getKey(), components));
            }
            return commands;
        }

        private List<Command> analysis() {
            List<Command> commands = new ArrayList<>();
            tables.analysis().forEach(step ->
                commands.add(new Command.AnalysisSetupCommand(step.command(), step.arguments())));
            return commands;
        }

        private List<Integer> resolve(BoundaryTarget target) throws ConversionException {
            if (target instanceof BoundaryTarget.NodeTarget node) {
                if (!model.nodes().containsKey(node.nodeId())) {
                    throw new ConversionException(ConversionException.Kind.UNDEFINED_REFERENCE,
                        "undefined node " + node.nodeId());
                }
                return List.of(node.nodeId());
            }
            BoundaryTarget.NodeSetTarget set = (BoundaryTarget.NodeSetTarget) target;
            Optional<NodeSet> nodeSet = model.nodeSet(set.setName());
            if (nodeSet.isEmpty() || nodeSet.get().nodeIds().isEmpty()) {
                throw new ConversionException(ConversionException.Kind.UNDEFINED_REFERENCE,
                    "node set " + set.setName() + " does not resolve to any node");
            }
            return nodeSet.get().nodeIds();
        }

        private void warn(ConversionWarning.Kind kind, String message) {
            warnings.add(new ConversionWarning(kind, message));
        }
    }

    private static <V> Map<Integer, V> sorted(Map<Integer, V> byId) {
        return new TreeMap<>(byId);
    }
}
