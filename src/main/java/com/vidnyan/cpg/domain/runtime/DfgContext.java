package com.vidnyan.cpg.domain.runtime;

import com.vidnyan.cpg.domain.dfg.DataFlowEdge;
import com.vidnyan.cpg.domain.dfg.DataFlowGraph;
import com.vidnyan.cpg.domain.dfg.Definition;
import com.vidnyan.cpg.domain.dfg.Use;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Slice of a function's data-flow graph at one source line.
 */
public record DfgContext(
        List<Definition> definitions,
        List<Use> uses,
        List<DataFlowEdge> edges,
        List<String> dependencies,
        Set<String> liveVariables
) {

    public DfgContext {
        definitions = List.copyOf(definitions);
        uses = List.copyOf(uses);
        edges = List.copyOf(edges);
        dependencies = List.copyOf(dependencies);
        liveVariables = Set.copyOf(liveVariables);
    }

    static DfgContext at(DataFlowGraph dfg, int line) {
        List<Definition> definitions = dfg.definitions().stream()
                .filter(d -> d.line() == line)
                .toList();
        List<Use> uses = dfg.uses().stream()
                .filter(u -> u.line() == line)
                .toList();
        Set<String> localIds = new LinkedHashSet<>();
        definitions.forEach(d -> localIds.add(d.id()));
        uses.forEach(u -> localIds.add(u.id()));
        List<DataFlowEdge> edges = dfg.edges().stream()
                .filter(e -> localIds.contains(e.definitionId()) || localIds.contains(e.useId()))
                .toList();

        Set<String> dependencies = new LinkedHashSet<>();
        Stream.concat(
                        uses.stream().map(Use::reachingDefinition),
                        definitions.stream().flatMap(d -> d.reachingDefinitions().stream()))
                .filter(id -> id != null)
                .forEach(id -> dfg.definition(id).ifPresent(d -> dependencies.add(d.variable().key())));

        Set<String> live = new LinkedHashSet<>();
        dfg.definitions().stream()
                .map(Definition::name)
                .distinct()
                .forEach(name -> dfg.lifetime(name)
                        .filter(l -> l.firstDefinitionLine() <= line && line <= Math.max(l.lastUseLine(), l.firstDefinitionLine()))
                        .ifPresent(l -> live.add(name)));

        return new DfgContext(definitions, uses, edges, List.copyOf(dependencies), live);
    }

    /**
     * Flow tags touching {@code variable} here: {@code definition}/{@code use}, the definition and use kinds,
     * and the flow kinds of adjacent data-flow edges, all lower case.
     */
    public Set<String> flowTagsFor(String variable) {
        Set<String> tags = new LinkedHashSet<>();
        Set<String> ids = new LinkedHashSet<>();
        definitions.stream().filter(d -> d.name().equals(variable)).forEach(d -> {
            tags.add("definition");
            tags.add(d.kind().name().toLowerCase());
            ids.add(d.id());
        });
        uses.stream().filter(u -> u.name().equals(variable)).forEach(u -> {
            tags.add("use");
            tags.add(u.kind().name().toLowerCase());
            ids.add(u.id());
        });
        edges.stream()
                .filter(e -> ids.contains(e.definitionId()) || ids.contains(e.useId()))
                .forEach(e -> tags.add(e.kind().name().toLowerCase()));
        return tags;
    }
}
