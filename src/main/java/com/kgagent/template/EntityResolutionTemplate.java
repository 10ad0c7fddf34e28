package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolves drug names to Wikidata items by exact (case-insensitive) English label. Only items
 * that treat at least one medical condition ({@code wdt:P2175}) are kept, which filters out
 * homonyms such as companies or people.
 */
public class EntityResolutionTemplate implements SparqlTemplate {

    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        List<String> names = intent.hasSlot("entity_names")
                ? intent.slotAsList("entity_names")
                : List.of(intent.slotAsString("entity_name"));
        String labelFilter = names.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .distinct()
                .map(name -> "LCASE(STR(?drugLabel)) = " + SparqlFragments.literal(name.toLowerCase()))
                .collect(Collectors.joining(" ||\n    "));

        return SparqlFragments.PREFIX_WDT
                + SparqlFragments.PREFIX_RDFS
                + "\n"
                + "SELECT DISTINCT ?drug ?drugLabel\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?drug rdfs:label ?drugLabel .\n"
                + "  FILTER(LANG(?drugLabel) = \"en\")\n"
                + "  FILTER(\n"
                + "    " + labelFilter + "\n"
                + "  )\n"
                + "  FILTER EXISTS { ?drug wdt:P2175 ?condition . }\n"
                + "}\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, null, CAP);
    }
}
