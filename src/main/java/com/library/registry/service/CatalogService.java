package com.library.registry.service;

import com.library.registry.association.AssociationSynchronizer;
import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.ReconcileResult;
import com.library.registry.association.Relation;
import com.library.registry.dto.response.BulkCreateResponse;
import com.library.registry.dto.response.BulkDeleteResponse;
import com.library.registry.dto.response.BulkItemError;
import com.library.registry.dto.response.LinkedEntitiesResponse;
import com.library.registry.dto.response.MessageResponse;
import com.library.registry.dto.response.PagedResponse;
import com.library.registry.entity.BaseEntity;
import com.library.registry.exception.BulkOperationException;
import com.library.registry.exception.DomainValidationException;
import com.library.registry.exception.ResourceNotFoundException;
import com.library.registry.repository.OffsetPageRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CRUD and relationship operations shared by every entity type.
 *
 * <p>A subclass supplies the entity name, its relations (in the order their ids are
 * validated), and the mapping between request, entity and response. Everything else,
 * including the order of validation and writes, lives here once.
 *
 * <p><strong>Write ordering</strong>: create, update and bulk create validate every
 * referenced id before the owning row is written, so a missing id never leaves a
 * half-applied request behind. All public operations run in one transaction each.
 *
 * <p><strong>Deletion</strong> removes the entity's join rows first (the foreign keys also
 * cascade), so no orphaned links survive.
 *
 * @param <E> entity type
 * @param <Q> request body used for create and full update
 * @param <S> response type
 */
public abstract class CatalogService<E extends BaseEntity, Q, S> {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);
    private static final Sort BY_ID = Sort.by("id");

    protected final JpaRepository<E, Long> repository;
    protected final AssociationSynchronizer synchronizer;
    private final RelatedEntityLoader relatedEntityLoader;
    private final Validator validator;
    private final String entityName;
    private final List<Relation<?, ?>> relations;

    protected CatalogService(String entityName,
                             List<Relation<?, ?>> relations,
                             JpaRepository<E, Long> repository,
                             AssociationSynchronizer synchronizer,
                             RelatedEntityLoader relatedEntityLoader,
                             Validator validator) {
        this.entityName = entityName;
        this.relations = List.copyOf(relations);
        this.repository = repository;
        this.synchronizer = synchronizer;
        this.relatedEntityLoader = relatedEntityLoader;
        this.validator = validator;
    }

    protected abstract E newEntity();

    /** Overwrites every scalar field of {@code entity} from {@code request}. */
    protected abstract void applyFields(E entity, Q request);

    /** Target id list per relation. Relations missing from the map are treated as empty. */
    protected abstract Map<Relation<?, ?>, List<Long>> relationTargets(Q request);

    protected abstract S toFlatResponse(E entity);

    protected abstract S toResponse(E entity, LinkSnapshot links);

    /** Business rules checked before anything else on create. Defaults to none. */
    protected void checkCreateRules(Q request) {
    }

    public String entityName() {
        return entityName;
    }

    @Transactional(readOnly = true)
    public List<S> findAll(boolean detailed) {
        return render(repository.findAll(BY_ID), detailed);
    }

    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }

    @Transactional(readOnly = true)
    public PagedResponse<S> findPage(int skip, int limit, boolean detailed) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be a non-negative integer");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be a non-negative integer");
        }
        if (limit == 0) {
            return new PagedResponse<>(repository.count(), skip, limit, List.of());
        }
        Page<E> page = repository.findAll(new OffsetPageRequest(skip, limit, BY_ID));
        return new PagedResponse<>(page.getTotalElements(), skip, limit, render(page.getContent(), detailed));
    }

    @Transactional(readOnly = true)
    public S findById(Long id) {
        E entity = findEntity(id);
        return toResponse(entity, snapshot(entity));
    }

    @Transactional
    public S create(Q request) {
        E saved = persist(request);
        log.info("Created {} with id {}", entityName, saved.getId());
        return toResponse(saved, snapshot(saved));
    }

    @Transactional
    public S update(Long id, Q request) {
        E entity = findEntity(id);

        Map<Relation<?, ?>, List<Long>> targets = relationTargets(request);
        for (Relation<?, ?> relation : relations) {
            synchronizer.requireExisting(relation, targets.get(relation));
        }

        applyFields(entity, request);
        for (Relation<?, ?> relation : relations) {
            ReconcileResult result = synchronizer.reconcile(relation, id, targets.get(relation));
            log.debug("{} {} {}: {}", entityName, id, relation.name(), result);
        }

        E saved = repository.saveAndFlush(entity);
        return toResponse(saved, snapshot(saved));
    }

    /** Deletes the entity and its links, returning the entity as it was. */
    @Transactional
    public S delete(Long id) {
        E entity = findEntity(id);
        S deleted = toResponse(entity, snapshot(entity));
        unlinkAll(id);
        repository.delete(entity);
        log.info("Deleted {} with id {}", entityName, id);
        return deleted;
    }

    /**
     * Creates every item or none. All items are validated first (bean constraints, business
     * rules, referenced ids); any failure is reported per index and nothing is written.
     */
    @Transactional
    public BulkCreateResponse bulkCreate(List<Q> requests) {
        List<BulkItemError> errors = new ArrayList<>();
        for (int index = 0; index < requests.size(); index++) {
            int itemIndex = index;
            validateItem(requests.get(index))
                .ifPresent(error -> errors.add(new BulkItemError(itemIndex, error)));
        }
        if (!errors.isEmpty()) {
            log.info("Rejected bulk creation of {} {} entities: {} invalid item(s)",
                requests.size(), entityName, errors.size());
            throw new BulkOperationException(entityName, errors);
        }

        List<Long> createdIds = new ArrayList<>();
        for (Q request : requests) {
            createdIds.add(persist(request).getId());
        }
        log.info("Bulk created {} {} entities", createdIds.size(), entityName);
        return new BulkCreateResponse(createdIds.size(), createdIds,
            "Successfully created " + createdIds.size() + " " + entityName + " entities");
    }

    /** Deletes every existing id and reports the rest; never rolls back found ids. */
    @Transactional
    public BulkDeleteResponse bulkDelete(List<Long> ids) {
        if (ids.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("ids must not contain null");
        }
        int deletedCount = 0;
        List<Long> notFound = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(ids)) {
            Optional<E> entity = repository.findById(id);
            if (entity.isPresent()) {
                unlinkAll(id);
                repository.delete(entity.get());
                deletedCount++;
            } else {
                notFound.add(id);
            }
        }
        log.info("Bulk deleted {} {} entities, {} not found", deletedCount, entityName, notFound.size());
        return new BulkDeleteResponse(deletedCount, notFound,
            "Successfully deleted " + deletedCount + " " + entityName + " entities");
    }

    @Transactional
    public MessageResponse addLink(Long id, String relationName, Long otherId) {
        Relation<?, ?> relation = relation(relationName);
        requireOwner(id);
        synchronizer.addLink(relation, id, otherId);
        return new MessageResponse(relation.targetEntity() + " added to " + relation.name() + " successfully");
    }

    @Transactional
    public MessageResponse removeLink(Long id, String relationName, Long otherId) {
        Relation<?, ?> relation = relation(relationName);
        requireOwner(id);
        synchronizer.removeLink(relation, id, otherId);
        return new MessageResponse(relation.targetEntity() + " removed from " + relation.name() + " successfully");
    }

    @Transactional(readOnly = true)
    public LinkedEntitiesResponse<?> listLinked(Long id, String relationName) {
        Relation<?, ?> relation = relation(relationName);
        requireOwner(id);
        return linkedEntities(relation, id);
    }

    protected E findEntity(Long id) {
        return repository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(entityName, id));
    }

    protected static List<Long> orEmpty(List<Long> ids) {
        return ids == null ? List.of() : ids;
    }

    private E persist(Q request) {
        checkCreateRules(request);
        Map<Relation<?, ?>, List<Long>> targets = relationTargets(request);
        for (Relation<?, ?> relation : relations) {
            synchronizer.requireExisting(relation, targets.get(relation));
        }

        E entity = newEntity();
        applyFields(entity, request);
        E saved = repository.save(entity);

        for (Relation<?, ?> relation : relations) {
            synchronizer.reconcile(relation, saved.getId(), targets.get(relation));
        }
        return saved;
    }

    private Optional<String> validateItem(Q request) {
        if (request == null) {
            return Optional.of("Item must not be null");
        }
        Set<ConstraintViolation<Q>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return Optional.of(violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; ")));
        }
        try {
            checkCreateRules(request);
            Map<Relation<?, ?>, List<Long>> targets = relationTargets(request);
            for (Relation<?, ?> relation : relations) {
                synchronizer.requireExisting(relation, targets.get(relation));
            }
        } catch (DomainValidationException | ResourceNotFoundException ex) {
            return Optional.of(ex.getMessage());
        }
        return Optional.empty();
    }

    private void requireOwner(Long id) {
        if (!repository.existsById(id)) {
            throw new ResourceNotFoundException(entityName, id);
        }
    }

    private Relation<?, ?> relation(String name) {
        return relations.stream()
            .filter(relation -> relation.isNamed(name))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException(
                "Relationship '" + name + "' is not defined for " + entityName));
    }

    private void unlinkAll(Long id) {
        for (Relation<?, ?> relation : relations) {
            int removed = synchronizer.unlinkAll(relation.joinTable(), id);
            if (removed > 0) {
                log.debug("Removed {} {} link(s) of {} {}", removed, relation.name(), entityName, id);
            }
        }
    }

    private List<S> render(List<E> entities, boolean detailed) {
        if (!detailed) {
            return entities.stream().map(this::toFlatResponse).toList();
        }
        Map<Long, LinkSnapshot> snapshots = snapshots(entities, true);
        return entities.stream()
            .map(entity -> toResponse(entity, snapshots.get(entity.getId())))
            .toList();
    }

    private LinkSnapshot snapshot(E entity) {
        return snapshots(List.of(entity), false).get(entity.getId());
    }

    private Map<Long, LinkSnapshot> snapshots(List<E> entities, boolean detailed) {
        List<Long> ownerIds = entities.stream().map(BaseEntity::getId).toList();
        Map<Long, LinkSnapshot> snapshots = new HashMap<>();
        ownerIds.forEach(id -> snapshots.put(id, new LinkSnapshot(detailed)));
        for (Relation<?, ?> relation : relations) {
            fill(relation, ownerIds, snapshots, detailed);
        }
        return snapshots;
    }

    private <T extends BaseEntity, M> void fill(Relation<T, M> relation, List<Long> ownerIds,
                                                Map<Long, LinkSnapshot> snapshots, boolean detailed) {
        Map<Long, Set<Long>> linked = synchronizer.listLinked(relation.joinTable(), ownerIds);
        Map<Long, M> summaries = detailed
            ? relatedEntityLoader.loadSummaries(relation, union(linked))
            : Map.of();

        for (Long ownerId : ownerIds) {
            Set<Long> ids = linked.getOrDefault(ownerId, Set.of());
            LinkSnapshot snapshot = snapshots.get(ownerId);
            snapshot.putIds(relation, ids);
            if (detailed) {
                snapshot.putRelated(relation, ids.stream()
                    .map(summaries::get)
                    .filter(Objects::nonNull)
                    .toList());
            }
        }
    }

    private <T extends BaseEntity, M> LinkedEntitiesResponse<M> linkedEntities(Relation<T, M> relation, Long id) {
        Set<Long> ids = synchronizer.listLinked(relation.joinTable(), id);
        List<M> items = List.copyOf(relatedEntityLoader.loadSummaries(relation, ids).values());
        return new LinkedEntitiesResponse<>(id, relation.name(), items.size(), items);
    }

    private static Set<Long> union(Map<Long, Set<Long>> linked) {
        return linked.values().stream()
            .flatMap(Set::stream)
            .collect(Collectors.toSet());
    }
}
