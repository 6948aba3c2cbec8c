package com.library.lending.integration;

import com.library.lending.dto.request.BorrowRequest;
import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.request.QueueRequest;
import com.library.lending.dto.request.RegisterStudentRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BookStatusResponse;
import com.library.lending.dto.response.BorrowResponse;
import com.library.lending.dto.response.QueueResponse;
import com.library.lending.dto.response.StudentResponse;
import com.library.lending.entity.CirculationStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class LendingConcurrencyTest extends AbstractIntegrationTest {

    private static final String LENDING_URL = "/api/v1/lending";
    private static final String BOOKS_URL = "/api/v1/books";
    private static final String STUDENTS_URL = "/api/v1/students";

    private static final int THREAD_COUNT = 10;

    @Test
    void concurrentBorrows_onlyOneSucceeds() throws Exception {
        restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B1", null, "Concurrent Test Book"), BookResponse.class);
        for (int i = 0; i < THREAD_COUNT; i++) {
            restTemplate.postForEntity(STUDENTS_URL,
                new RegisterStudentRequest("S" + i, "Student " + i, "pw" + i), StudentResponse.class);
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<BorrowResponse>>> futures = new ArrayList<>();

        for (int i = 0; i < THREAD_COUNT; i++) {
            final BorrowRequest request = new BorrowRequest("B1", "S" + i, "pw" + i);
            futures.add(executor.submit(() -> {
                startLatch.await();
                return restTemplate.postForEntity(LENDING_URL + "/borrow", request, BorrowResponse.class);
            }));
        }

        startLatch.countDown();

        List<BorrowResponse> results = new ArrayList<>();
        for (Future<ResponseEntity<BorrowResponse>> future : futures) {
            ResponseEntity<BorrowResponse> response = future.get();
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            results.add(response.getBody());
        }
        executor.shutdown();

        long successCount = results.stream().filter(BorrowResponse::success).count();
        long queueOffers = results.stream().filter(BorrowResponse::canQueue).count();

        assertThat(successCount).isEqualTo(1);
        assertThat(queueOffers).isEqualTo(THREAD_COUNT - 1);

        BookStatusResponse status = restTemplate.getForObject(BOOKS_URL + "/B1", BookStatusResponse.class);
        assertThat(status.status()).isEqualTo(CirculationStatus.BORROWED);
        assertThat(status.holderId()).isNotNull();
    }

    @Test
    void concurrentEnqueues_reportDistinctPositions() throws Exception {
        restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B2", null, "Popular Book"), BookResponse.class);

        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<QueueResponse>>> futures = new ArrayList<>();

        for (int i = 0; i < THREAD_COUNT; i++) {
            final QueueRequest request = new QueueRequest("B2", "S" + i);
            futures.add(executor.submit(() -> {
                startLatch.await();
                return restTemplate.postForEntity(LENDING_URL + "/queue", request, QueueResponse.class);
            }));
        }

        startLatch.countDown();

        List<Long> positions = new ArrayList<>();
        for (Future<ResponseEntity<QueueResponse>> future : futures) {
            positions.add(future.get().getBody().position());
        }
        executor.shutdown();

        assertThat(positions).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L);
    }
}
