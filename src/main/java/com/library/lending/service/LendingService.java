package com.library.lending.service;

import com.library.lending.dto.request.BorrowRequest;
import com.library.lending.dto.request.QueueRequest;
import com.library.lending.dto.request.ReturnRequest;
import com.library.lending.dto.response.BorrowResponse;
import com.library.lending.dto.response.QueueResponse;
import com.library.lending.dto.response.ReturnResponse;
import com.library.lending.entity.Book;
import com.library.lending.entity.CirculationStatus;
import com.library.lending.entity.LendingTransaction;
import com.library.lending.entity.Student;
import com.library.lending.entity.TransactionAction;
import com.library.lending.entity.WaitingListEntry;
import com.library.lending.exception.InvalidCredentialsException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.LendingTransactionRepository;
import com.library.lending.repository.StudentRepository;
import com.library.lending.repository.WaitingListRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * The lending state machine: borrow, return and enqueue.
 *
 * <p>Every operation loads the book through {@link BookRepository#findByIdForUpdate}, so
 * the read-branch-mutate sequence holds the book's row lock until the transaction commits.
 * Two borrows of the same book therefore cannot both observe {@code AVAILABLE}. Operations
 * on different books never wait on each other.
 *
 * <p>A borrow refused because of the book's status is reported as a {@link BorrowResponse}
 * with {@code success = false}, not as an exception. Missing books or students and wrong
 * secrets are exceptions and leave the store untouched.
 */
@Service
@RequiredArgsConstructor
public class LendingService {

    private static final Logger log = LoggerFactory.getLogger(LendingService.class);

    static final String MSG_ON_LOAN = "This book is already on loan. You can join the queue.";
    static final String MSG_RESERVED_FOR_OTHER = "Sorry, this book is currently reserved for %s.";
    static final String MSG_BORROWED = "Borrowed successfully: %s";
    static final String MSG_RETURNED = "Returned successfully, thank you!";
    static final String MSG_RETURNED_AND_RESERVED = "Returned successfully. The book is now reserved for %s.";
    static final String MSG_QUEUED = "You joined the queue at position %d.";

    private final BookRepository bookRepository;
    private final StudentRepository studentRepository;
    private final WaitingListRepository waitingListRepository;
    private final LendingTransactionRepository transactionRepository;

    @Transactional
    public BorrowResponse borrow(BorrowRequest request) {
        Student student = studentRepository.findById(request.studentId())
            .orElseThrow(() -> new ResourceNotFoundException("Student", request.studentId()));

        if (!CredentialMatcher.matches(student.getCredentialSecret(), request.secret())) {
            log.warn("Rejected borrow of book {}: bad credentials for student {}",
                request.bookId(), request.studentId());
            throw new InvalidCredentialsException(request.studentId());
        }

        Book book = lockBook(request.bookId());

        if (book.getStatus() == CirculationStatus.BORROWED) {
            log.info("Book {} is on loan, offering queue to student {}", book.getId(), student.getId());
            return new BorrowResponse(false, MSG_ON_LOAN, book.getId(), book.getTitle(), true, null, null);
        }

        if (book.getStatus() == CirculationStatus.RESERVED && !book.isReservedFor(student.getId())) {
            log.info("Book {} is reserved for {}, refusing student {}",
                book.getId(), book.getReservedForId(), student.getId());
            return new BorrowResponse(false,
                String.format(MSG_RESERVED_FOR_OTHER, describe(book.getReservedForId(), book.getReservedForName())),
                book.getId(), book.getTitle(), false, book.getReservedForId(), book.getReservedForName());
        }

        CirculationStatus previous = book.getStatus();
        book.lendTo(student.getId(), student.getDisplayName());
        bookRepository.save(book);
        appendTransaction(TransactionAction.BORROW, book.getId(), student.getId());

        log.info("Book {} lent to student {} (was {})", book.getId(), student.getId(), previous);
        return new BorrowResponse(true, String.format(MSG_BORROWED, book.getTitle()),
            book.getId(), book.getTitle(), false, null, null);
    }

    /**
     * Returns a book and hands it to the head of its waiting list, if any.
     *
     * <p>The returning student is recorded in the transaction log as supplied; it is not
     * compared with the book's current holder.
     */
    @Transactional
    public ReturnResponse returnBook(ReturnRequest request) {
        Book book = lockBook(request.bookId());

        List<WaitingListEntry> waiting = waitingListRepository.findAllByBookIdOrderByIdAsc(book.getId());

        String message;
        if (!waiting.isEmpty()) {
            WaitingListEntry next = waiting.get(0);
            String nextName = studentRepository.findById(next.getStudentId())
                .map(Student::getDisplayName)
                .orElse(next.getStudentId());

            book.reserveFor(next.getStudentId(), nextName);
            bookRepository.save(book);
            waitingListRepository.delete(next);

            message = String.format(MSG_RETURNED_AND_RESERVED, describe(next.getStudentId(), nextName));
            log.info("Book {} returned by {}, reserved for {} ({} still waiting)",
                book.getId(), request.studentId(), next.getStudentId(), waiting.size() - 1);
        } else {
            book.release();
            bookRepository.save(book);

            message = MSG_RETURNED;
            log.info("Book {} returned by {}, now available", book.getId(), request.studentId());
        }

        appendTransaction(TransactionAction.RETURN, book.getId(), request.studentId());

        return new ReturnResponse(true, message, book.getId(), book.getStatus(),
            book.getReservedForId(), book.getReservedForName());
    }

    /**
     * Appends the student to the book's waiting list.
     *
     * <p>The reported position is the number of entries waiting for the book once this one
     * is stored. Nothing stops a student from queueing twice, or for a book they hold.
     */
    @Transactional
    public QueueResponse enqueue(QueueRequest request) {
        Book book = lockBook(request.bookId());

        WaitingListEntry entry = new WaitingListEntry();
        entry.setBook(book);
        entry.setStudentId(request.studentId());
        entry.setEnqueuedAt(Instant.now());
        waitingListRepository.save(entry);

        long position = waitingListRepository.countByBookId(book.getId());

        log.info("Student {} queued for book {} at position {}", request.studentId(), book.getId(), position);
        return new QueueResponse(true, String.format(MSG_QUEUED, position), book.getId(), position);
    }

    private Book lockBook(String bookId) {
        return bookRepository.findByIdForUpdate(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));
    }

    private void appendTransaction(TransactionAction action, String bookId, String studentId) {
        transactionRepository.save(new LendingTransaction(action, bookId, studentId, Instant.now()));
    }

    private static String describe(String studentId, String displayName) {
        if (displayName == null || displayName.equals(studentId)) {
            return studentId;
        }
        return displayName + " (" + studentId + ")";
    }
}
