package com.library.registry.association;

import com.library.registry.exception.DuplicateRelationshipException;
import com.library.registry.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the rows of a many-to-many join table for one owner at a time.
 *
 * <p>All operations are parameterized by a {@link JoinTableMapping} (or a {@link Relation}
 * carrying one), so Book-Author and Book-Library, seen from either side, share this single
 * implementation. Statements run through {@link NamedParameterJdbcTemplate} and join the
 * caller's JPA transaction when there is one.
 *
 * <p><strong>Reconcile</strong> computes {@code toRemove = existing - target} and
 * {@code toAdd = target - existing}, validates every id in {@code toAdd} against the
 * linked entity's table, and only then deletes and inserts. A missing id therefore aborts
 * the call before any join row is touched. Rows present in both sets are never rewritten.
 *
 * <p><strong>Concurrency</strong>: there is no application-level lock. {@link #addLink}
 * and {@link #reconcile} read, then write. Two requests linking the same pair at the same
 * time can both pass the read; the composite primary key of the join table rejects the
 * second INSERT with {@code DuplicateKeyException}, which {@code GlobalExceptionHandler}
 * reports as 409 like the explicit duplicate check does.
 */
@Component
@RequiredArgsConstructor
public class AssociationSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(AssociationSynchronizer.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public Set<Long> listLinked(JoinTableMapping mapping, Long ownerId) {
        String sql = "SELECT " + mapping.otherColumn() + " FROM " + mapping.table()
            + " WHERE " + mapping.ownerColumn() + " = :ownerId";
        return new TreeSet<>(jdbcTemplate.queryForList(sql, Map.of("ownerId", ownerId), Long.class));
    }

    /**
     * Batched form of {@link #listLinked(JoinTableMapping, Long)}: one query for all owners.
     * Every requested owner is present in the result, with an empty set if it has no links.
     */
    @Transactional(readOnly = true)
    public Map<Long, Set<Long>> listLinked(JoinTableMapping mapping, Collection<Long> ownerIds) {
        Map<Long, Set<Long>> linked = new LinkedHashMap<>();
        if (ownerIds.isEmpty()) {
            return linked;
        }
        ownerIds.forEach(id -> linked.put(id, new TreeSet<>()));

        String sql = "SELECT " + mapping.ownerColumn() + ", " + mapping.otherColumn()
            + " FROM " + mapping.table()
            + " WHERE " + mapping.ownerColumn() + " IN (:ownerIds)";
        jdbcTemplate.query(sql, Map.of("ownerIds", ownerIds),
            (RowCallbackHandler) rs -> linked.get(rs.getLong(1)).add(rs.getLong(2)));
        return linked;
    }

    /**
     * Verifies that every id exists in the linked entity's table.
     *
     * @throws ResourceNotFoundException naming the first id (in request order) that does not exist
     */
    @Transactional(readOnly = true)
    public void requireExisting(Relation<?, ?> relation, Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        Set<Long> requested = new LinkedHashSet<>(ids);
        String sql = "SELECT id FROM " + relation.joinTable().otherTable() + " WHERE id IN (:ids)";
        Set<Long> found = new HashSet<>(jdbcTemplate.queryForList(sql, Map.of("ids", requested), Long.class));

        for (Long id : requested) {
            if (!found.contains(id)) {
                throw new ResourceNotFoundException(relation.targetEntity(), id);
            }
        }
    }

    /**
     * Brings the owner's links on {@code relation} to exactly {@code targetIds}.
     * A {@code null} target is treated as empty. Duplicate ids are collapsed.
     */
    @Transactional
    public ReconcileResult reconcile(Relation<?, ?> relation, Long ownerId, Collection<Long> targetIds) {
        JoinTableMapping mapping = relation.joinTable();
        Set<Long> target = targetIds == null ? Set.of() : new HashSet<>(targetIds);
        Set<Long> existing = listLinked(mapping, ownerId);

        Set<Long> toRemove = new TreeSet<>(existing);
        toRemove.removeAll(target);
        Set<Long> toAdd = new TreeSet<>(target);
        toAdd.removeAll(existing);

        requireExisting(relation, toAdd);

        if (!toRemove.isEmpty()) {
            String sql = "DELETE FROM " + mapping.table()
                + " WHERE " + mapping.ownerColumn() + " = :ownerId"
                + " AND " + mapping.otherColumn() + " IN (:otherIds)";
            jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("otherIds", toRemove));
        }
        if (!toAdd.isEmpty()) {
            SqlParameterSource[] batch = toAdd.stream()
                .map(otherId -> new MapSqlParameterSource()
                    .addValue("ownerId", ownerId)
                    .addValue("otherId", otherId))
                .toArray(SqlParameterSource[]::new);
            jdbcTemplate.batchUpdate(insertSql(mapping), batch);
        }

        if (!toAdd.isEmpty() || !toRemove.isEmpty()) {
            log.debug("Reconciled {}.{} for owner {}: added {}, removed {}",
                mapping.table(), mapping.otherColumn(), ownerId, toAdd, toRemove);
        }
        return new ReconcileResult(Set.copyOf(toAdd), Set.copyOf(toRemove));
    }

    /**
     * Links one entity to the owner.
     *
     * @throws ResourceNotFoundException      if the linked entity does not exist
     * @throws DuplicateRelationshipException if the pair is already linked
     */
    @Transactional
    public void addLink(Relation<?, ?> relation, Long ownerId, Long otherId) {
        requireExisting(relation, List.of(otherId));

        JoinTableMapping mapping = relation.joinTable();
        if (isLinked(mapping, ownerId, otherId)) {
            throw new DuplicateRelationshipException(relation.name(), ownerId, otherId);
        }
        jdbcTemplate.update(insertSql(mapping), new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("otherId", otherId));
    }

    /**
     * Unlinks one entity from the owner.
     *
     * @throws ResourceNotFoundException if the pair is not linked
     */
    @Transactional
    public void removeLink(Relation<?, ?> relation, Long ownerId, Long otherId) {
        JoinTableMapping mapping = relation.joinTable();
        String sql = "DELETE FROM " + mapping.table()
            + " WHERE " + mapping.ownerColumn() + " = :ownerId"
            + " AND " + mapping.otherColumn() + " = :otherId";
        int deleted = jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("otherId", otherId));
        if (deleted == 0) {
            throw new ResourceNotFoundException("Relationship not found: "
                + relation.name() + " " + ownerId + " -> " + otherId);
        }
    }

    /** Removes every link of the owner on this join table and returns the number of rows removed. */
    @Transactional
    public int unlinkAll(JoinTableMapping mapping, Long ownerId) {
        String sql = "DELETE FROM " + mapping.table() + " WHERE " + mapping.ownerColumn() + " = :ownerId";
        return jdbcTemplate.update(sql, Map.of("ownerId", ownerId));
    }

    private boolean isLinked(JoinTableMapping mapping, Long ownerId, Long otherId) {
        String sql = "SELECT COUNT(*) FROM " + mapping.table()
            + " WHERE " + mapping.ownerColumn() + " = :ownerId"
            + " AND " + mapping.otherColumn() + " = :otherId";
        Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("otherId", otherId), Long.class);
        return count != null && count > 0;
    }

    private static String insertSql(JoinTableMapping mapping) {
        return "INSERT INTO " + mapping.table()
            + " (" + mapping.ownerColumn() + ", " + mapping.otherColumn() + ")"
            + " VALUES (:ownerId, :otherId)";
    }
}
