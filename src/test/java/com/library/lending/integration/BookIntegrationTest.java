package com.library.lending.integration;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.ErrorResponse;
import com.library.lending.dto.response.PagedResponse;
import com.library.lending.entity.CirculationStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class BookIntegrationTest extends AbstractIntegrationTest {

    private static final String BOOKS_URL = "/api/v1/books";

    @Test
    void create_thenList() {
        ResponseEntity<BookResponse> created = restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B1", "9780134685991", "Effective Java"), BookResponse.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(created.getBody().status()).isEqualTo(CirculationStatus.AVAILABLE);
        assertThat(created.getBody().createdAt()).isNotNull();

        restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B2", null, "Java Concurrency in Practice"), BookResponse.class);

        ResponseEntity<PagedResponse> list = restTemplate.getForEntity(BOOKS_URL, PagedResponse.class);
        assertThat(list.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(list.getBody().totalElements()).isEqualTo(2);
    }

    @Test
    void create_duplicateId_returns409() {
        restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B1", null, "Effective Java"), BookResponse.class);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B1", null, "Another Title"), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("B1");
    }

    @Test
    void create_invalidIsbn_returns400() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("B1", "12AB", "Effective Java"), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors())
            .extracting(ErrorResponse.FieldError::field)
            .contains("isbn");
    }

    @Test
    void getQueue_unknownBook_returns404() {
        ResponseEntity<ErrorResponse> response =
            restTemplate.getForEntity(BOOKS_URL + "/B404/queue", ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
