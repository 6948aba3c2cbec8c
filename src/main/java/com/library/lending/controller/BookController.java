package com.library.lending.controller;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BookStatusResponse;
import com.library.lending.dto.response.PagedResponse;
import com.library.lending.dto.response.WaitingListEntryResponse;
import com.library.lending.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Catalog seeding and circulation status")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Operation(summary = "List all books", description = "Returns a paginated list of books with their circulation fields.")
    public ResponseEntity<PagedResponse<BookResponse>> findAll(Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(bookService.findAll(pageable)));
    }

    @GetMapping("/{bookId}")
    @Operation(summary = "Look up a book's status", description = "The lookup performed when a book's QR code is scanned.")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookStatusResponse> getStatus(@PathVariable String bookId) {
        return ResponseEntity.ok(bookService.getStatus(bookId));
    }

    @GetMapping("/{bookId}/queue")
    @Operation(summary = "List a book's waiting list", description = "Entries in the order they will be served.")
    @ApiResponse(responseCode = "200", description = "Waiting list returned")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<List<WaitingListEntryResponse>> getQueue(@PathVariable String bookId) {
        return ResponseEntity.ok(bookService.getQueue(bookId));
    }

    @PostMapping
    @Operation(summary = "Add a book to the catalog", description = "The book starts out AVAILABLE.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Book ID already exists")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }
}
