package com.library.lending.repository;

import com.library.lending.entity.LendingTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LendingTransactionRepository extends JpaRepository<LendingTransaction, Long> {
}
