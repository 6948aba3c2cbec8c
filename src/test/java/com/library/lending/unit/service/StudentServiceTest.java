package com.library.lending.unit.service;

import com.library.lending.dto.request.ChangeSecretRequest;
import com.library.lending.dto.request.RegisterStudentRequest;
import com.library.lending.dto.response.StudentResponse;
import com.library.lending.entity.Student;
import com.library.lending.exception.DuplicateStudentException;
import com.library.lending.exception.InvalidCredentialsException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.repository.StudentRepository;
import com.library.lending.service.StudentService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StudentServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @InjectMocks
    private StudentService studentService;

    @Test
    void register_newStudent_returnsResponseWithoutSecret() {
        when(studentRepository.existsById("S1")).thenReturn(false);
        when(studentRepository.save(any(Student.class))).thenAnswer(invocation -> invocation.getArgument(0));

        StudentResponse response = studentService.register(new RegisterStudentRequest("S1", "Alice", "pw1"));

        assertThat(response.studentId()).isEqualTo("S1");
        assertThat(response.displayName()).isEqualTo("Alice");
    }

    @Test
    void register_existingId_throwsDuplicateStudentException() {
        when(studentRepository.existsById("S1")).thenReturn(true);

        assertThatThrownBy(() -> studentService.register(new RegisterStudentRequest("S1", "Alice", "pw1")))
            .isInstanceOf(DuplicateStudentException.class)
            .hasMessageContaining("S1");

        verify(studentRepository, never()).save(any());
    }

    @Test
    void findById_unknownStudent_throwsResourceNotFound() {
        when(studentRepository.findById("S9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> studentService.findById("S9"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Student");
    }

    @Test
    void changeSecret_matchingCurrentSecret_replacesIt() {
        Student student = new Student("S1", "Alice", "old");
        when(studentRepository.findById("S1")).thenReturn(Optional.of(student));

        studentService.changeSecret("S1", new ChangeSecretRequest(" old ", "new"));

        assertThat(student.getCredentialSecret()).isEqualTo("new");
        verify(studentRepository).save(student);
    }

    @Test
    void changeSecret_wrongCurrentSecret_throwsAndKeepsOldSecret() {
        Student student = new Student("S1", "Alice", "old");
        when(studentRepository.findById("S1")).thenReturn(Optional.of(student));

        assertThatThrownBy(() -> studentService.changeSecret("S1", new ChangeSecretRequest("guess", "new")))
            .isInstanceOf(InvalidCredentialsException.class);

        assertThat(student.getCredentialSecret()).isEqualTo("old");
        verify(studentRepository, never()).save(any());
    }

    @Test
    void changeSecret_unknownStudent_throwsResourceNotFound() {
        when(studentRepository.findById("S9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> studentService.changeSecret("S9", new ChangeSecretRequest("a", "b")))
            .isInstanceOf(ResourceNotFoundException.class);
    }
}
