package com.library.lending.mapper;

import com.library.lending.dto.request.RegisterStudentRequest;
import com.library.lending.dto.response.StudentResponse;
import com.library.lending.entity.Student;

public final class StudentMapper {

    private StudentMapper() {}

    public static Student toEntity(RegisterStudentRequest request) {
        return new Student(request.studentId(), request.displayName(), request.secret());
    }

    public static StudentResponse toResponse(Student student) {
        return new StudentResponse(student.getId(), student.getDisplayName(), student.getCreatedAt());
    }
}
