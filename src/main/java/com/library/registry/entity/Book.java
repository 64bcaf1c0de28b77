package com.library.registry.entity;

import com.library.registry.exception.DomainValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * JPA entity representing a book.
 *
 * <p><strong>Associations are not mapped here</strong>: the {@code book_authors} and
 * {@code book_libraries} join tables are maintained exclusively by
 * {@code AssociationSynchronizer} over JDBC. Mapping them as {@code @ManyToMany}
 * collections as well would give Hibernate a second, stale view of the same rows inside
 * one transaction.
 *
 * <p><strong>release / time</strong>: stored in {@code release_date} and
 * {@code release_time}; the API keeps the shorter names.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} is incremented on every UPDATE.
 * Two concurrent stock decrements on the same book cannot both succeed from the same
 * snapshot; the loser gets {@code ObjectOptimisticLockingFailureException}, mapped to 409
 * by {@code GlobalExceptionHandler}.
 *
 * <p>Column constraints ({@code pages > 10}, {@code stock >= 0}) are repeated as CHECK
 * constraints in migration V1.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
public class Book extends BaseEntity {

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "pages", nullable = false)
    private Integer pages;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "price", nullable = false)
    private Double price;

    @Column(name = "release_date", nullable = false)
    private LocalDate release;

    @Column(name = "release_time", nullable = false)
    private LocalTime time;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    /**
     * Removes {@code qty} items from stock.
     *
     * @throws DomainValidationException if {@code qty} is missing or not positive, or if it
     *                                   exceeds the current stock; stock is left unchanged
     */
    public void decreaseStock(Integer qty) {
        if (qty == null || qty <= 0) {
            throw new DomainValidationException("Quantity must be a positive integer");
        }
        if (qty > stock) {
            throw new DomainValidationException(
                "Cannot decrease stock by " + qty + ". Only " + stock + " items available.");
        }
        stock -= qty;
    }
}
