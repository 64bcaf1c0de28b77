package com.library.registry.association;

import com.library.registry.entity.BaseEntity;

import java.util.Set;
import java.util.function.Function;

/**
 * A named many-to-many relation as exposed by the API, e.g. {@code /book/{id}/authors}.
 *
 * @param name         path segment and JSON name of the relation
 * @param targetEntity display name of the linked entity type, used in error messages
 * @param targetType   JPA type of the linked entity
 * @param joinTable    join table oriented from the owner's side
 * @param summarizer   renders a linked entity inline in detailed responses
 * @param aliases      further path segments accepted for this relation
 * @param <T>          linked entity type
 * @param <M>          summary type
 */
public record Relation<T extends BaseEntity, M>(
    String name,
    String targetEntity,
    Class<T> targetType,
    JoinTableMapping joinTable,
    Function<T, M> summarizer,
    Set<String> aliases
) {

    public Relation(String name, String targetEntity, Class<T> targetType,
                    JoinTableMapping joinTable, Function<T, M> summarizer) {
        this(name, targetEntity, targetType, joinTable, summarizer, Set.of());
    }

    public boolean isNamed(String segment) {
        return name.equals(segment) || aliases.contains(segment);
    }
}
