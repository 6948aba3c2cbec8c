package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit record of a borrow or return.
 *
 * <p>All columns are {@code updatable = false} and the class exposes no setters: a row is
 * written once by {@code LendingService} and never read back by the application.
 * {@link #bookId} is a plain column so that the audit trail does not constrain the catalog.
 */
@Entity
@Table(name = "lending_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id")
public class LendingTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 10)
    private TransactionAction action;

    @Column(name = "book_id", nullable = false, updatable = false, length = 50)
    private String bookId;

    @Column(name = "student_id", nullable = false, updatable = false, length = 50)
    private String studentId;

    public LendingTransaction(TransactionAction action, String bookId, String studentId, Instant occurredAt) {
        this.action = action;
        this.bookId = bookId;
        this.studentId = studentId;
        this.occurredAt = occurredAt;
    }
}
