package com.library.lending.mapper;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BookStatusResponse;
import com.library.lending.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book(request.bookId(), request.title());
        book.setIsbn(request.isbn());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getIsbn(),
            book.getTitle(),
            book.getStatus(),
            book.getHolderId(),
            book.getHolderName(),
            book.getReservedForId(),
            book.getReservedForName(),
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }

    public static BookStatusResponse toStatusResponse(Book book, String message) {
        return new BookStatusResponse(
            book.getId(),
            book.getTitle(),
            book.getStatus(),
            book.getHolderId(),
            book.getHolderName(),
            book.getReservedForId(),
            book.getReservedForName(),
            message
        );
    }
}
