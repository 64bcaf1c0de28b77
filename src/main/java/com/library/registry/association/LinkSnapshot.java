package com.library.registry.association;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Linked ids (and, for detailed reads, linked entity summaries) of one owner, keyed by
 * relation. Id lists are sorted ascending.
 */
public final class LinkSnapshot {

    private final boolean detailed;
    private final Map<Relation<?, ?>, List<Long>> ids = new HashMap<>();
    private final Map<Relation<?, ?>, List<?>> related = new HashMap<>();

    public LinkSnapshot(boolean detailed) {
        this.detailed = detailed;
    }

    public void putIds(Relation<?, ?> relation, Collection<Long> linkedIds) {
        ids.put(relation, linkedIds.stream().sorted().toList());
    }

    public <M> void putRelated(Relation<?, M> relation, List<M> summaries) {
        related.put(relation, List.copyOf(summaries));
    }

    public List<Long> ids(Relation<?, ?> relation) {
        return ids.getOrDefault(relation, List.of());
    }

    /** Summaries of the linked entities, or {@code null} when the snapshot is not detailed. */
    @SuppressWarnings("unchecked")
    public <M> List<M> related(Relation<?, M> relation) {
        if (!detailed) {
            return null;
        }
        return (List<M>) related.getOrDefault(relation, List.of());
    }
}
