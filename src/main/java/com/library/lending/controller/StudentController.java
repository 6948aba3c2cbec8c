package com.library.lending.controller;

import com.library.lending.dto.request.ChangeSecretRequest;
import com.library.lending.dto.request.RegisterStudentRequest;
import com.library.lending.dto.response.StudentResponse;
import com.library.lending.service.StudentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/students")
@RequiredArgsConstructor
@Tag(name = "Students", description = "Student directory")
public class StudentController {

    private final StudentService studentService;

    @PostMapping
    @Operation(summary = "Register a student")
    @ApiResponse(responseCode = "201", description = "Student registered")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Student ID already exists")
    public ResponseEntity<StudentResponse> register(@Valid @RequestBody RegisterStudentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(studentService.register(request));
    }

    @GetMapping("/{studentId}")
    @Operation(summary = "Get student by ID")
    @ApiResponse(responseCode = "200", description = "Student found")
    @ApiResponse(responseCode = "404", description = "Student not found")
    public ResponseEntity<StudentResponse> findById(@PathVariable String studentId) {
        return ResponseEntity.ok(studentService.findById(studentId));
    }

    @PutMapping("/{studentId}/secret")
    @Operation(summary = "Change a student's secret", description = "The current secret must match.")
    @ApiResponse(responseCode = "204", description = "Secret changed")
    @ApiResponse(responseCode = "401", description = "Current secret does not match")
    @ApiResponse(responseCode = "404", description = "Student not found")
    public ResponseEntity<Void> changeSecret(@PathVariable String studentId,
                                             @Valid @RequestBody ChangeSecretRequest request) {
        studentService.changeSecret(studentId, request);
        return ResponseEntity.noContent().build();
    }
}
