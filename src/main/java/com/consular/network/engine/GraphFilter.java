package com.consular.network.engine;

import com.consular.network.model.InfluenceFilter;
import com.consular.network.model.NetworkNode;

import java.util.List;
import java.util.Locale;

/**
 * Name and influence-level predicates over a node list. Both are optional and combine with AND.
 */
public final class GraphFilter {

    private GraphFilter() {}

    /**
     * @param namePattern case-insensitive substring of the node name; null or blank keeps every name
     * @param influence   influence level; null behaves like {@link InfluenceFilter#ALL}
     * @return a new list, the input is left untouched
     */
    public static List<NetworkNode> filter(List<NetworkNode> nodes, String namePattern, InfluenceFilter influence) {
        String needle = namePattern != null && !namePattern.isBlank()
                ? namePattern.toLowerCase(Locale.ROOT)
                : null;
        InfluenceFilter level = influence != null ? influence : InfluenceFilter.ALL;

        return nodes.stream()
                .filter(node -> needle == null
                        || (node.getName() != null && node.getName().toLowerCase(Locale.ROOT).contains(needle)))
                .filter(node -> level.matches(node.getInfluence()))
                .toList();
    }
}
