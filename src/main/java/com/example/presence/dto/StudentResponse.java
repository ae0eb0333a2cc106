package com.example.presence.dto;

import com.example.presence.entities.Student;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentResponse {
    private Long id;
    private String matricule;
    private String lastName;
    private String firstName;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static StudentResponse from(Student s) {
        return StudentResponse.builder()
                .id(s.getId())
                .matricule(s.getMatricule())
                .lastName(s.getLastName())
                .firstName(s.getFirstName())
                .active(s.getActive())
                .createdAt(s.getCreatedAt())
                .updatedAt(s.getUpdatedAt())
                .build();
    }
}
