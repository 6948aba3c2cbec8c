package com.library.lending.service;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BookStatusResponse;
import com.library.lending.dto.response.WaitingListEntryResponse;
import com.library.lending.entity.Book;
import com.library.lending.exception.DuplicateBookException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.BookMapper;
import com.library.lending.mapper.WaitingListMapper;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.WaitingListRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    static final String HINT_AVAILABLE = "This book is on the shelf and can be borrowed!";
    static final String HINT_ON_LOAN = "This book is on loan. Would you like to join the queue?";

    private final BookRepository bookRepository;
    private final WaitingListRepository waitingListRepository;

    @Transactional(readOnly = true)
    public Page<BookResponse> findAll(Pageable pageable) {
        return bookRepository.findAll(pageable)
            .map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public BookStatusResponse getStatus(String bookId) {
        Book book = bookRepository.findById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));

        String hint = switch (book.getStatus()) {
            case AVAILABLE -> HINT_AVAILABLE;
            case BORROWED -> HINT_ON_LOAN;
            case RESERVED -> null;
        };
        return BookMapper.toStatusResponse(book, hint);
    }

    @Transactional(readOnly = true)
    public List<WaitingListEntryResponse> getQueue(String bookId) {
        if (!bookRepository.existsById(bookId)) {
            throw new ResourceNotFoundException("Book", bookId);
        }
        return WaitingListMapper.toResponses(waitingListRepository.findAllByBookIdOrderByIdAsc(bookId));
    }

    /**
     * Adds a book to the catalog. New books always start {@code AVAILABLE}.
     */
    @Transactional
    public BookResponse create(CreateBookRequest request) {
        if (bookRepository.existsById(request.bookId())) {
            throw new DuplicateBookException(request.bookId());
        }

        Book saved = bookRepository.save(BookMapper.toEntity(request));
        log.info("Catalogued book {} ({})", saved.getId(), saved.getTitle());
        return BookMapper.toResponse(saved);
    }
}
