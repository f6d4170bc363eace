package com.inp2ops.core.parser;

import com.inp2ops.core.model.BoundaryCondition;
import com.inp2ops.core.model.BoundaryTarget;
import com.inp2ops.core.model.DofMask;
import com.inp2ops.core.model.Element;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.model.Load;
import com.inp2ops.core.model.Node;
import com.inp2ops.core.model.SectionKind;
import com.inp2ops.core.parser.ParseException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Phase-one builder: collects raw entities as the parser reads them.
 *
 * <p>Nothing is cross-checked here beyond duplicate ids and names. Every collected reference keeps the line it
 * came from so {@link ReferenceResolver} can report unresolved names precisely.
 */
final class ModelCollector {

    private static final Logger log = LoggerFactory.getLogger(ModelCollector.class);

    /** Upper bound on the members a single generate line may expand to. */
    static final long MAX_GENERATED_MEMBERS = 10_000_000L;

    /**
     * One entry of a set definition: either a plain id or the name of another set of the same kind.
     */
    record SetMember(Integer id, String setName, int line) {
    }

    /**
     * A value with the line it was read from.
     */
    record Located<T>(T value, int line) {
    }

    static final class SetDraft {
        final String name;
        final String keyword;
        final List<SetMember> members = new ArrayList<>();

        SetDraft(String name, String keyword) {
            this.name = name;
            this.keyword = keyword;
        }
    }

    static final class MaterialDraft {
        final String name;
        final int line;
        Double youngsModulus;
        Double poissonsRatio;
        Double density;
        boolean elasticSeen;
        boolean densitySeen;

        MaterialDraft(String name, int line) {
            this.name = name;
            this.line = line;
        }
    }

    static final class SectionDraft {
        final SectionContext.SectionBlock block;
        final List<Double> properties = new ArrayList<>();
        boolean dataSeen;

        SectionDraft(SectionContext.SectionBlock block) {
            this.block = block;
        }
    }

    static final class SkippedDraft {
        final String keyword;
        final int line;
        int discardedLines;

        SkippedDraft(String keyword, int line) {
            this.keyword = keyword;
            this.line = line;
        }
    }

    final Map<Integer, Located<Node>> nodes = new LinkedHashMap<>();
    final Map<Integer, Located<Element>> elements = new LinkedHashMap<>();
    final Map<String, SetDraft> nodeSets = new LinkedHashMap<>();
    final Map<String, SetDraft> elementSets = new LinkedHashMap<>();
    final Map<String, MaterialDraft> materials = new LinkedHashMap<>();
    final Map<String, SectionDraft> sections = new LinkedHashMap<>();
    final List<Located<BoundaryCondition>> boundaryConditions = new ArrayList<>();
    final List<Located<Load>> loads = new ArrayList<>();
    final List<SkippedDraft> skipped = new ArrayList<>();

    /**
     * Registers what a directive declares by itself, before any of its data lines.
     */
    void open(SectionContext context) throws ParseException {
        if (context instanceof SectionContext.NodeBlock block && block.nodeSetName() != null) {
            set(nodeSets, block.nodeSetName(), "NSET");
        } else if (context instanceof SectionContext.ElementBlock block && block.elementSetName() != null) {
            set(elementSets, block.elementSetName(), "ELSET");
        } else if (context instanceof SectionContext.NodeSetBlock block) {
            set(nodeSets, block.name(), "NSET");
        } else if (context instanceof SectionContext.ElementSetBlock block) {
            set(elementSets, block.name(), "ELSET");
        } else if (context instanceof SectionContext.MaterialBlock block) {
            openMaterial(block);
        } else if (context instanceof SectionContext.ElasticBlock block) {
            MaterialDraft material = materials.get(FeModel.nameKey(block.materialName()));
            if (material.elasticSeen) {
                throw new ParseException(Kind.DUPLICATE_ID, block.line(), block.keyword(),
                    "material " + material.name + " already has elastic properties");
            }
            material.elasticSeen = true;
        } else if (context instanceof SectionContext.DensityBlock block) {
            MaterialDraft material = materials.get(FeModel.nameKey(block.materialName()));
            if (material.densitySeen) {
                throw new ParseException(Kind.DUPLICATE_ID, block.line(), block.keyword(),
                    "material " + material.name + " already has a density");
            }
            material.densitySeen = true;
        } else if (context instanceof SectionContext.SectionBlock block) {
            openSection(block);
        } else if (context instanceof SectionContext.Skipped block) {
            log.debug("Skipping unsupported keyword *{} at line {}", block.keyword(), block.line());
            skipped.add(new SkippedDraft(block.keyword(), block.line()));
        }
    }

    /**
     * Interprets one data record under the context it was read in.
     */
    void accept(SectionContext context, DataRecord record) throws ParseException {
        if (context instanceof SectionContext.Preamble) {
            throw record.malformed(0, "data line before any keyword");
        } else if (context instanceof SectionContext.NodeBlock block) {
            acceptNode(block, record);
        } else if (context instanceof SectionContext.ElementBlock block) {
            acceptElement(block, record);
        } else if (context instanceof SectionContext.NodeSetBlock block) {
            acceptSetMembers(nodeSets.get(FeModel.nameKey(block.name())), block.generate(), record);
        } else if (context instanceof SectionContext.ElementSetBlock block) {
            acceptSetMembers(elementSets.get(FeModel.nameKey(block.name())), block.generate(), record);
        } else if (context instanceof SectionContext.MaterialBlock) {
            throw record.malformed(0, "*MATERIAL takes no data lines");
        } else if (context instanceof SectionContext.ElasticBlock block) {
            acceptElastic(materials.get(FeModel.nameKey(block.materialName())), record);
        } else if (context instanceof SectionContext.DensityBlock block) {
            acceptDensity(materials.get(FeModel.nameKey(block.materialName())), record);
        } else if (context instanceof SectionContext.SectionBlock block) {
            acceptSectionData(sections.get(FeModel.nameKey(block.elementSetName())), record);
        } else if (context instanceof SectionContext.BoundaryBlock) {
            acceptBoundary(record);
        } else if (context instanceof SectionContext.ConcentratedLoadBlock) {
            acceptLoad(record);
        } else if (context instanceof SectionContext.Skipped) {
            skipped.get(skipped.size() - 1).discardedLines++;
        }
    }

    private void openMaterial(SectionContext.MaterialBlock block) throws ParseException {
        String key = FeModel.nameKey(block.name());
        MaterialDraft existing = materials.get(key);
        if (existing != null) {
            throw new ParseException(Kind.DUPLICATE_ID, block.line(), block.keyword(),
                "material " + block.name() + " already defined at line " + existing.line);
        }
        materials.put(key, new MaterialDraft(block.name(), block.line()));
    }

    private void openSection(SectionContext.SectionBlock block) throws ParseException {
        String key = FeModel.nameKey(block.elementSetName());
        SectionDraft existing = sections.get(key);
        if (existing != null) {
            throw new ParseException(Kind.DUPLICATE_ID, block.line(), block.keyword(),
                "element set " + block.elementSetName() + " already has a section (line "
                    + existing.block.line() + ")");
        }
        sections.put(key, new SectionDraft(block));
    }

    private void acceptNode(SectionContext.NodeBlock block, DataRecord record) throws ParseException {
        if (record.size() > 4) {
            throw record.malformed(4, "a node takes at most three coordinates");
        }
        int id = record.idField(0);
        Node node = new Node(id, record.doubleFieldOr(1, 0.0), record.doubleFieldOr(2, 0.0),
            record.doubleFieldOr(3, 0.0));
        Located<Node> existing = nodes.get(id);
        if (existing != null) {
            throw new ParseException(Kind.DUPLICATE_ID, record.line(), record.sectionName(), 0,
                "node " + id + " already defined at line " + existing.line());
        }
        nodes.put(id, new Located<>(node, record.line()));
        if (block.nodeSetName() != null) {
            nodeSets.get(FeModel.nameKey(block.nodeSetName())).members.add(new SetMember(id, null, record.line()));
        }
    }

    private void acceptElement(SectionContext.ElementBlock block, DataRecord record) throws ParseException {
        int id = record.idField(0);
        if (record.size() < 2) {
            throw record.malformed(1, "element " + id + " lists no nodes");
        }
        List<Integer> nodeIds = new ArrayList<>(record.size() - 1);
        for (int i = 1; i < record.size(); i++) {
            nodeIds.add(record.idField(i));
        }
        Located<Element> existing = elements.get(id);
        if (existing != null) {
            throw new ParseException(Kind.DUPLICATE_ID, record.line(), record.sectionName(), 0,
                "element " + id + " already defined at line " + existing.line());
        }
        elements.put(id, new Located<>(new Element(id, block.type(), nodeIds), record.line()));
        if (block.elementSetName() != null) {
            elementSets.get(FeModel.nameKey(block.elementSetName())).members
                .add(new SetMember(id, null, record.line()));
        }
    }

    private void acceptSetMembers(SetDraft set, boolean generate, DataRecord record) throws ParseException {
        if (generate) {
            int first = record.idField(0);
            int last = record.idField(1);
            int step = record.has(2) ? record.idField(2) : 1;
            if (last < first) {
                throw record.malformed(1, "generate range ends before it starts (" + first + " > " + last + ")");
            }
            long count = ((long) last - first) / step + 1;
            if (count > MAX_GENERATED_MEMBERS) {
                throw record.malformed(1, "generate range " + first + " to " + last + " by " + step
                    + " expands to " + count + " ids, more than the limit of " + MAX_GENERATED_MEMBERS);
            }
            for (long id = first; id <= last; id += step) {
                set.members.add(new SetMember((int) id, null, record.line()));
            }
            return;
        }
        for (int i = 0; i < record.size(); i++) {
            if (!record.has(i)) {
                continue;
            }
            if (record.isInteger(i)) {
                set.members.add(new SetMember(record.idField(i), null, record.line()));
            } else {
                set.members.add(new SetMember(null, record.field(i), record.line()));
            }
        }
    }

    private void acceptElastic(MaterialDraft material, DataRecord record) throws ParseException {
        if (material.youngsModulus != null) {
            // Further lines tabulate temperature dependence; only the first is used
            log.debug("Ignoring extra *ELASTIC line {} of material {}", record.line(), material.name);
            return;
        }
        double modulus = record.doubleField(0);
        if (!(modulus > 0.0)) {
            throw record.malformed(0, "Young's modulus must be positive but found " + modulus);
        }
        material.youngsModulus = modulus;
        material.poissonsRatio = record.has(1) ? record.doubleField(1) : null;
    }

    private void acceptDensity(MaterialDraft material, DataRecord record) throws ParseException {
        if (material.density != null) {
            log.debug("Ignoring extra *DENSITY line {} of material {}", record.line(), material.name);
            return;
        }
        material.density = record.doubleField(0);
    }

    private void acceptSectionData(SectionDraft section, DataRecord record) throws ParseException {
        if (section.dataSeen) {
            // Beam orientation and shell integration lines carry nothing the translator uses
            return;
        }
        section.dataSeen = true;
        if (section.block.kind() == SectionKind.UNSUPPORTED) {
            return;
        }
        for (int i = 0; i < record.size(); i++) {
            section.properties.add(record.doubleFieldOr(i, 0.0));
        }
    }

    private void acceptBoundary(DataRecord record) throws ParseException {
        BoundaryTarget target = target(record);
        if (!record.has(1)) {
            throw record.malformed(1, "missing degree of freedom or boundary type");
        }
        if (!record.isInteger(1)) {
            DofMask mask = namedBoundary(record);
            boundaryConditions.add(new Located<>(new BoundaryCondition(target, mask, 0.0), record.line()));
            return;
        }
        int first = dof(record, 1);
        int last = record.has(2) ? dof(record, 2) : first;
        if (last < first) {
            throw record.malformed(2, "last DOF " + last + " is before first DOF " + first);
        }
        double magnitude = record.doubleFieldOr(3, 0.0);
        boundaryConditions.add(new Located<>(
            new BoundaryCondition(target, DofMask.range(first, last), magnitude), record.line()));
    }

    private void acceptLoad(DataRecord record) throws ParseException {
        BoundaryTarget target = target(record);
        int dof = dof(record, 1);
        double magnitude = record.doubleField(2);
        List<Double> components = new ArrayList<>(Collections.nCopies(DofMask.DOF_COUNT, 0.0));
        components.set(dof - 1, magnitude);
        loads.add(new Located<>(new Load(target, components), record.line()));
    }

    private static DofMask namedBoundary(DataRecord record) throws ParseException {
        String type = record.field(1).toUpperCase(Locale.ROOT);
        return switch (type) {
            case "ENCASTRE" -> DofMask.all();
            case "PINNED" -> DofMask.range(1, 3);
            case "XSYMM" -> DofMask.of(1, 5, 6);
            case "YSYMM" -> DofMask.of(2, 4, 6);
            case "ZSYMM" -> DofMask.of(3, 4, 5);
            case "XASYMM" -> DofMask.of(2, 3, 4);
            case "YASYMM" -> DofMask.of(1, 3, 5);
            case "ZASYMM" -> DofMask.of(1, 2, 6);
            default -> throw record.malformed(1, "unknown boundary type '" + record.field(1) + "'");
        };
    }

    private static BoundaryTarget target(DataRecord record) throws ParseException {
        if (!record.has(0)) {
            throw record.malformed(0, "missing node or node set");
        }
        if (record.isInteger(0)) {
            return new BoundaryTarget.NodeTarget(record.idField(0));
        }
        return new BoundaryTarget.NodeSetTarget(record.field(0));
    }

    private static int dof(DataRecord record, int index) throws ParseException {
        int dof = record.intField(index);
        if (dof < 1 || dof > DofMask.DOF_COUNT) {
            throw record.malformed(index, "degree of freedom must be between 1 and 6 but found " + dof);
        }
        return dof;
    }

    private static void set(Map<String, SetDraft> sets, String name, String keyword) {
        sets.computeIfAbsent(FeModel.nameKey(name), key -> new SetDraft(name, keyword));
    }
}
