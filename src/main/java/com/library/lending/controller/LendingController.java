package com.library.lending.controller;

import com.library.lending.dto.request.BorrowRequest;
import com.library.lending.dto.request.QueueRequest;
import com.library.lending.dto.request.ReturnRequest;
import com.library.lending.dto.response.BorrowResponse;
import com.library.lending.dto.response.QueueResponse;
import com.library.lending.dto.response.ReturnResponse;
import com.library.lending.service.LendingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/lending")
@RequiredArgsConstructor
@Tag(name = "Lending", description = "Borrow, return and queue operations with per-book locking")
public class LendingController {

    private final LendingService lendingService;

    @PostMapping("/borrow")
    @Operation(summary = "Borrow a book", description = "Lends the book to the student after checking their secret. "
        + "A book on loan, or reserved for someone else, yields success=false rather than an error.")
    @ApiResponse(responseCode = "200", description = "Borrow attempted; see success flag")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "401", description = "Secret does not match")
    @ApiResponse(responseCode = "404", description = "Book or student not found")
    public ResponseEntity<BorrowResponse> borrow(@Valid @RequestBody BorrowRequest request) {
        return ResponseEntity.ok(lendingService.borrow(request));
    }

    @PostMapping("/return")
    @Operation(summary = "Return a book", description = "Reserves the book for the earliest waiting requester, "
        + "or makes it available when nobody is waiting.")
    @ApiResponse(responseCode = "200", description = "Book returned")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<ReturnResponse> returnBook(@Valid @RequestBody ReturnRequest request) {
        return ResponseEntity.ok(lendingService.returnBook(request));
    }

    @PostMapping("/queue")
    @Operation(summary = "Join a book's waiting list", description = "Returns the 1-based position in the queue.")
    @ApiResponse(responseCode = "200", description = "Queued")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<QueueResponse> enqueue(@Valid @RequestBody QueueRequest request) {
        return ResponseEntity.ok(lendingService.enqueue(request));
    }
}
