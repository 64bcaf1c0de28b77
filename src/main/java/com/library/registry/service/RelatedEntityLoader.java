package com.library.registry.service;

import com.library.registry.association.Relation;
import com.library.registry.entity.BaseEntity;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the entities on the far side of a relation in one query and renders them with the
 * relation's summarizer. Used for detailed listings and the {@code GET /{entity}/{id}/{relation}}
 * endpoint.
 */
@Component
@RequiredArgsConstructor
public class RelatedEntityLoader {

    private final EntityManager entityManager;

    /** Summaries keyed by entity id, in ascending id order. Unknown ids are skipped. */
    @Transactional(readOnly = true)
    public <T extends BaseEntity, M> Map<Long, M> loadSummaries(Relation<T, M> relation, Collection<Long> ids) {
        Map<Long, M> summaries = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return summaries;
        }
        String jpql = "SELECT e FROM " + relation.targetType().getSimpleName() + " e"
            + " WHERE e.id IN :ids ORDER BY e.id";
        List<T> entities = entityManager.createQuery(jpql, relation.targetType())
            .setParameter("ids", ids)
            .getResultList();
        for (T entity : entities) {
            summaries.put(entity.getId(), relation.summarizer().apply(entity));
        }
        return summaries;
    }
}
