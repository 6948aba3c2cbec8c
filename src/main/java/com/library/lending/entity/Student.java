package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for a student in the user directory.
 *
 * <p>The lending engine only reads students: it resolves display names and checks the
 * credential secret on borrow. Records are written by registration and by the
 * credential-change operation in {@code StudentService}.
 *
 * <p>{@code @ToString} is omitted so the secret cannot leak into log output.
 */
@Entity
@Table(name = "students")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class Student extends BaseEntity {

    @Id
    @Column(name = "student_id", nullable = false, updatable = false, length = 50)
    private String id;

    @Setter
    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Setter
    @Column(name = "credential_secret", nullable = false, length = 255)
    private String credentialSecret;

    public Student(String id, String displayName, String credentialSecret) {
        this.id = id;
        this.displayName = displayName;
        this.credentialSecret = credentialSecret;
    }
}
