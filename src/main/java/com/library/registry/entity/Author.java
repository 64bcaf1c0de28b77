package com.library.registry.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity representing a book author.
 *
 * <p>Every author must reference at least one book when it is created. This is a business
 * rule enforced by {@code AuthorService}, not a storage constraint: deleting the last book
 * of an author leaves the author in place with no links.
 */
@Entity
@Table(name = "authors")
@Getter
@Setter
@NoArgsConstructor
public class Author extends BaseEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;
}
