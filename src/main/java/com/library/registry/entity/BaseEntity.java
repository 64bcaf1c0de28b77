package com.library.registry.entity;

import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

import java.util.Objects;

/**
 * Shared superclass for all JPA entities.
 *
 * <p>Owns the surrogate primary key so that the generic service and association layers can
 * address any entity by {@link #getId()} without knowing its concrete type. Keys are
 * assigned by the database ({@code GENERATED BY DEFAULT AS IDENTITY}), which means the
 * INSERT is issued as soon as the entity is persisted. The association layer relies on
 * this: join rows are written over JDBC right after {@code save()} and reference the new
 * row through a foreign key.
 *
 * <p>Equality is based on the database-assigned id and the concrete class. Two transient
 * instances (id still {@code null}) are only equal if they are the same object.
 */
@MappedSuperclass
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    protected BaseEntity() {}

    public Long getId() {
        return id;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return id != null && id.equals(((BaseEntity) other).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id);
    }
}
