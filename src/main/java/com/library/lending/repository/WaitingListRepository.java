package com.library.lending.repository;

import com.library.lending.entity.WaitingListEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WaitingListRepository extends JpaRepository<WaitingListEntry, Long> {

    List<WaitingListEntry> findAllByBookIdOrderByIdAsc(String bookId);

    long countByBookId(String bookId);
}
