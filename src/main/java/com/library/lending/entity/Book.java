package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity representing one physical copy in the lending catalog.
 *
 * <p><strong>Identifier</strong>: {@link #id} is the code printed on the book's QR label and
 * is assigned when the catalog is seeded. It is never generated and never changes.
 *
 * <p><strong>Circulation invariant</strong>: the holder columns are populated iff
 * {@link #status} is {@link CirculationStatus#BORROWED}; the reservation columns are
 * populated iff it is {@link CirculationStatus#RESERVED}. A book is never held and
 * reserved at the same time. The three transition methods ({@link #lendTo},
 * {@link #reserveFor}, {@link #release}) are the only way the lending engine changes
 * these fields, and the {@code chk_books_circulation} constraint (V1 migration) rejects
 * any row that violates the rule.
 *
 * <p><strong>Locking</strong>: rows are read with {@code PESSIMISTIC_WRITE} by
 * {@code BookRepository.findByIdForUpdate} before any transition, which serializes
 * borrow, return and enqueue on the same book. {@link #version} additionally guards the
 * seeding path against lost updates.
 */
@Entity
@Table(name = "books")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @Column(name = "book_id", nullable = false, updatable = false, length = 50)
    private String id;

    @Setter
    @Column(name = "isbn", length = 13)
    private String isbn;

    @Setter
    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CirculationStatus status;

    @Column(name = "holder_id", length = 50)
    private String holderId;

    @Column(name = "holder_name", length = 100)
    private String holderName;

    @Column(name = "reserved_for_id", length = 50)
    private String reservedForId;

    @Column(name = "reserved_for_name", length = 100)
    private String reservedForName;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public Book(String id, String title) {
        this.id = id;
        this.title = title;
        this.status = CirculationStatus.AVAILABLE;
    }

    /** Marks the book borrowed by the given student and drops any reservation. */
    public void lendTo(String studentId, String displayName) {
        this.status = CirculationStatus.BORROWED;
        this.holderId = studentId;
        this.holderName = displayName;
        this.reservedForId = null;
        this.reservedForName = null;
    }

    /** Holds the book on the shelf for the given requester. */
    public void reserveFor(String studentId, String displayName) {
        this.status = CirculationStatus.RESERVED;
        this.holderId = null;
        this.holderName = null;
        this.reservedForId = studentId;
        this.reservedForName = displayName;
    }

    /** Puts the book back on the shelf with no holder and no reservation. */
    public void release() {
        this.status = CirculationStatus.AVAILABLE;
        this.holderId = null;
        this.holderName = null;
        this.reservedForId = null;
        this.reservedForName = null;
    }

    public boolean isReservedFor(String studentId) {
        return status == CirculationStatus.RESERVED && reservedForId != null
            && reservedForId.equals(studentId);
    }
}
