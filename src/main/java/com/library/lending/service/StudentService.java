package com.library.lending.service;

import com.library.lending.dto.request.ChangeSecretRequest;
import com.library.lending.dto.request.RegisterStudentRequest;
import com.library.lending.dto.response.StudentResponse;
import com.library.lending.entity.Student;
import com.library.lending.exception.DuplicateStudentException;
import com.library.lending.exception.InvalidCredentialsException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.StudentMapper;
import com.library.lending.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StudentService {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository studentRepository;

    @Transactional
    public StudentResponse register(RegisterStudentRequest request) {
        if (studentRepository.existsById(request.studentId())) {
            throw new DuplicateStudentException(request.studentId());
        }

        Student saved = studentRepository.save(StudentMapper.toEntity(request));
        log.info("Registered student {}", saved.getId());
        return StudentMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public StudentResponse findById(String studentId) {
        return studentRepository.findById(studentId)
            .map(StudentMapper::toResponse)
            .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
    }

    @Transactional
    public void changeSecret(String studentId, ChangeSecretRequest request) {
        Student student = studentRepository.findById(studentId)
            .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));

        if (!CredentialMatcher.matches(student.getCredentialSecret(), request.currentSecret())) {
            log.warn("Rejected secret change for student {}: current secret does not match", studentId);
            throw new InvalidCredentialsException(studentId);
        }

        student.setCredentialSecret(request.newSecret());
        studentRepository.save(student);
        log.info("Changed secret for student {}", studentId);
    }
}
