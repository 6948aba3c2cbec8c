package com.library.lending.entity;

/**
 * Circulation state of a {@link Book}.
 *
 * <p>Stored as {@code VARCHAR} via {@code @Enumerated(EnumType.STRING)}.
 *
 * <ul>
 *   <li>{@link #AVAILABLE} : on the shelf, anyone may borrow it</li>
 *   <li>{@link #BORROWED}  : lent out; {@code holder_*} columns name the borrower</li>
 *   <li>{@link #RESERVED}  : returned and held for the head of the waiting list;
 *                            {@code reserved_for_*} columns name that requester</li>
 * </ul>
 */
public enum CirculationStatus {
    AVAILABLE,
    BORROWED,
    RESERVED
}
