package com.example.presence.repository;

import com.example.presence.entities.Student;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {

    Optional<Student> findByMatricule(String matricule);

    Optional<Student> findByMatriculeAndActiveTrue(String matricule);

    boolean existsByMatricule(String matricule);

    Page<Student> findByMatriculeContainingIgnoreCaseOrLastNameContainingIgnoreCaseOrFirstNameContainingIgnoreCase(
            String matricule, String lastName, String firstName, Pageable pageable);
}
