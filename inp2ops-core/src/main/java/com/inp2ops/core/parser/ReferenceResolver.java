package com.inp2ops.core.parser;

import com.inp2ops.core.model.BoundaryCondition;
import com.inp2ops.core.model.BoundaryTarget;
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
import com.inp2ops.core.model.SkippedSection;
import com.inp2ops.core.parser.ModelCollector.Located;
import com.inp2ops.core.parser.ModelCollector.SetDraft;
import com.inp2ops.core.parser.ModelCollector.SetMember;
import com.inp2ops.core.parser.ParseException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase-two validation: resolves every collected reference and freezes the model.
 *
 * <p>Runs only after the whole input has been read, so entities may be referenced before they are defined.
 * The first reference that does not resolve aborts with {@link Kind#UNDEFINED_REFERENCE} at the line that
 * made it.
 */
final class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ModelCollector collected;
    private final Map<String, List<Integer>> resolvedNodeSets = new LinkedHashMap<>();
    private final Map<String, List<Integer>> resolvedElementSets = new LinkedHashMap<>();

    ReferenceResolver(ModelCollector collected) {
        this.collected = collected;
    }

    FeModel resolve() throws ParseException {
        Map<Integer, Node> nodes = new LinkedHashMap<>();
        collected.nodes.forEach((id, located) -> nodes.put(id, located.value()));

        Map<Integer, Element> elements = new LinkedHashMap<>();
        for (Located<Element> located : collected.elements.values()) {
            Element element = located.value();
            for (int i = 0; i < element.nodeIds().size(); i++) {
                int nodeId = element.nodeIds().get(i);
                if (!nodes.containsKey(nodeId)) {
                    throw new ParseException(Kind.UNDEFINED_REFERENCE, located.line(), "ELEMENT", i + 1,
                        "element " + element.id() + " references undefined node " + nodeId);
                }
            }
            elements.put(element.id(), element);
        }

        Map<String, NodeSet> nodeSets = new LinkedHashMap<>();
        for (Map.Entry<String, SetDraft> entry : collected.nodeSets.entrySet()) {
            List<Integer> ids = expand(entry.getKey(), collected.nodeSets, resolvedNodeSets,
                collected.nodes.keySet(), "node", new LinkedHashSet<>());
            nodeSets.put(entry.getKey(), new NodeSet(entry.getValue().name, ids));
        }

        Map<String, ElementSet> elementSets = new LinkedHashMap<>();
        for (Map.Entry<String, SetDraft> entry : collected.elementSets.entrySet()) {
            List<Integer> ids = expand(entry.getKey(), collected.elementSets, resolvedElementSets,
                collected.elements.keySet(), "element", new LinkedHashSet<>());
            elementSets.put(entry.getKey(), new ElementSet(entry.getValue().name, ids));
        }

        Map<String, Material> materials = new LinkedHashMap<>();
        for (Map.Entry<String, ModelCollector.MaterialDraft> entry : collected.materials.entrySet()) {
            materials.put(entry.getKey(), material(entry.getValue()));
        }

        List<Section> sections = new ArrayList<>();
        for (ModelCollector.SectionDraft draft : collected.sections.values()) {
            sections.add(section(draft, materials, elementSets, elements));
        }

        List<BoundaryCondition> boundaryConditions = new ArrayList<>();
        for (Located<BoundaryCondition> located : collected.boundaryConditions) {
            requireTarget(located.value().target(), located.line(), "BOUNDARY", nodes, nodeSets);
            boundaryConditions.add(located.value());
        }

        List<Load> loads = new ArrayList<>();
        for (Located<Load> located : collected.loads) {
            requireTarget(located.value().target(), located.line(), "CLOAD", nodes, nodeSets);
            loads.add(located.value());
        }

        List<SkippedSection> skipped = new ArrayList<>();
        for (ModelCollector.SkippedDraft draft : collected.skipped) {
            skipped.add(new SkippedSection(draft.keyword, draft.line, draft.discardedLines));
        }

        return new FeModel(nodes, elements, nodeSets, elementSets, materials, sections,
            boundaryConditions, loads, skipped);
    }

    private List<Integer> expand(
        String key,
        Map<String, SetDraft> drafts,
        Map<String, List<Integer>> resolved,
        Set<Integer> knownIds,
        String entityName,
        Set<String> visiting
    ) throws ParseException {
        List<Integer> cached = resolved.get(key);
        if (cached != null) {
            return cached;
        }
        SetDraft draft = drafts.get(key);
        visiting.add(key);
        Set<Integer> ids = new LinkedHashSet<>();
        for (SetMember member : draft.members) {
            if (member.id() != null) {
                if (!knownIds.contains(member.id())) {
                    throw new ParseException(Kind.UNDEFINED_REFERENCE, member.line(), draft.keyword,
                        "set " + draft.name + " references undefined " + entityName + " " + member.id());
                }
                ids.add(member.id());
                continue;
            }
            String nestedKey = FeModel.nameKey(member.setName());
            if (!drafts.containsKey(nestedKey)) {
                throw new ParseException(Kind.UNDEFINED_REFERENCE, member.line(), draft.keyword,
                    "set " + draft.name + " references undefined set " + member.setName());
            }
            if (visiting.contains(nestedKey)) {
                throw new ParseException(Kind.UNDEFINED_REFERENCE, member.line(), draft.keyword,
                    "set " + draft.name + " includes itself through set " + member.setName());
            }
            ids.addAll(expand(nestedKey, drafts, resolved, knownIds, entityName, visiting));
        }
        visiting.remove(key);
        List<Integer> result = List.copyOf(ids);
        resolved.put(key, result);
        return result;
    }

    private static Material material(ModelCollector.MaterialDraft draft) {
        ElasticProperties elastic = null;
        if (draft.youngsModulus != null) {
            elastic = new ElasticProperties(draft.youngsModulus, draft.poissonsRatio);
            if (draft.poissonsRatio != null && !elastic.hasAdmissiblePoissonsRatio()) {
                log.warn("Material {} has Poisson's ratio {} outside (-1, 0.5)", draft.name, draft.poissonsRatio);
            }
        }
        return new Material(draft.name, elastic, draft.density);
    }

    private static Section section(
        ModelCollector.SectionDraft draft,
        Map<String, Material> materials,
        Map<String, ElementSet> elementSets,
        Map<Integer, Element> elements
    ) throws ParseException {
        SectionContext.SectionBlock block = draft.block;
        String materialName = null;
        if (block.materialName() != null) {
            Material material = materials.get(FeModel.nameKey(block.materialName()));
            if (material == null) {
                throw new ParseException(Kind.UNDEFINED_REFERENCE, block.line(), block.keyword(),
                    "section references undefined material " + block.materialName());
            }
            materialName = material.name();
        }
        ElementSet elementSet = elementSets.get(FeModel.nameKey(block.elementSetName()));
        if (elementSet == null) {
            throw new ParseException(Kind.UNDEFINED_REFERENCE, block.line(), block.keyword(),
                "section references undefined element set " + block.elementSetName());
        }

        SectionKind kind = block.kind();
        if (kind == SectionKind.SOLID && allTruss(elementSet, elements)) {
            kind = SectionKind.TRUSS;
        }
        return new Section(elementSet.name(), kind, materialName, block.profile(), draft.properties);
    }

    private static boolean allTruss(ElementSet elementSet, Map<Integer, Element> elements) {
        if (elementSet.elementIds().isEmpty()) {
            return false;
        }
        return elementSet.elementIds().stream().allMatch(id -> elements.get(id).type().isTruss());
    }

    private static void requireTarget(
        BoundaryTarget target,
        int line,
        String keyword,
        Map<Integer, Node> nodes,
        Map<String, NodeSet> nodeSets
    ) throws ParseException {
        if (target instanceof BoundaryTarget.NodeTarget node) {
            if (!nodes.containsKey(node.nodeId())) {
                throw new ParseException(Kind.UNDEFINED_REFERENCE, line, keyword, 0,
                    "undefined node " + node.nodeId());
            }
            return;
        }
        BoundaryTarget.NodeSetTarget set = (BoundaryTarget.NodeSetTarget) target;
        NodeSet nodeSet = nodeSets.get(FeModel.nameKey(set.setName()));
        if (nodeSet == null) {
            throw new ParseException(Kind.UNDEFINED_REFERENCE, line, keyword, 0,
                "undefined node set " + set.setName());
        }
        if (nodeSet.nodeIds().isEmpty()) {
            throw new ParseException(Kind.UNDEFINED_REFERENCE, line, keyword, 0,
                "node set " + set.setName() + " contains no nodes");
        }
    }
}
