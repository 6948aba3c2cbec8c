package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for one pending request in a book's waiting list.
 *
 * <p><strong>Queue order</strong>: entries of the same book are served in ascending
 * {@link #id} order. The identity column grows with every insert, so the smallest id is
 * always the earliest requester; {@link #enqueuedAt} is informational only and is never
 * used to order the queue (two requests may share a timestamp).
 *
 * <p>{@link #studentId} is deliberately a plain column rather than a foreign key: the
 * directory is not consulted when someone joins the queue.
 *
 * <p>Entries are never updated. They are deleted when promoted to the book's reservation
 * slot by a return.
 */
@Entity
@Table(name = "waiting_list_entries")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class WaitingListEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false, updatable = false)
    private Book book;

    @Column(name = "student_id", nullable = false, updatable = false, length = 50)
    private String studentId;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private Instant enqueuedAt;
}
