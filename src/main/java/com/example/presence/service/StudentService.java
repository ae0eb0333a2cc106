package com.example.presence.service;

import com.example.presence.dto.PageResponse;
import com.example.presence.dto.StudentRequest;
import com.example.presence.dto.StudentResponse;
import com.example.presence.entities.Student;
import com.example.presence.exception.ConflictException;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class StudentService {

    private final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository studentRepository;

    @Transactional
    public StudentResponse createStudent(StudentRequest request) {
        String matricule = request.getMatricule().trim();
        if (studentRepository.existsByMatricule(matricule)) {
            throw new ConflictException("Matricule already exists: " + matricule);
        }
        Student s = Student.builder()
                .matricule(matricule)
                .lastName(request.getLastName().trim())
                .firstName(request.getFirstName().trim())
                .active(request.getActive() == null || request.getActive())
                .build();
        try {
            Student saved = studentRepository.saveAndFlush(s);
            log.info("Created student id={} matricule={}", saved.getId(), saved.getMatricule());
            return StudentResponse.from(saved);
        } catch (DataIntegrityViolationException ex) {
            // unique constraint lost a race with a concurrent create
            throw new ConflictException("Matricule already exists: " + matricule);
        }
    }

    @Transactional(readOnly = true)
    public StudentResponse getStudent(Long id) {
        return StudentResponse.from(require(id));
    }

    /**
     * Search by matricule, last name or first name (case-insensitive, substring), ordered by matricule.
     */
    @Transactional(readOnly = true)
    public PageResponse<StudentResponse> search(String q, int limit, long offset) {
        String term = q == null ? "" : q.trim();
        Page<Student> page = studentRepository
                .findByMatriculeContainingIgnoreCaseOrLastNameContainingIgnoreCaseOrFirstNameContainingIgnoreCase(
                        term, term, term, Paging.of(limit, offset, Sort.by("matricule")));
        return new PageResponse<>(
                page.getContent().stream().map(StudentResponse::from).collect(Collectors.toList()),
                page.getTotalElements(), limit, offset);
    }

    @Transactional
    public StudentResponse updateStudent(Long id, StudentRequest request) {
        Student s = require(id);
        String matricule = request.getMatricule().trim();
        if (!matricule.equals(s.getMatricule()) && studentRepository.existsByMatricule(matricule)) {
            throw new ConflictException("Matricule already exists: " + matricule);
        }
        s.setMatricule(matricule);
        s.setLastName(request.getLastName().trim());
        s.setFirstName(request.getFirstName().trim());
        if (request.getActive() != null) {
            s.setActive(request.getActive());
        }
        return StudentResponse.from(studentRepository.saveAndFlush(s));
    }

    /**
     * Students are never deleted: events keep referencing them.
     */
    @Transactional
    public void deactivate(Long id) {
        Student s = require(id);
        if (Boolean.TRUE.equals(s.getActive())) {
            s.setActive(false);
            studentRepository.save(s);
            log.info("Deactivated student id={} matricule={}", s.getId(), s.getMatricule());
        }
    }

    @Transactional(readOnly = true)
    public Optional<Student> findActiveByMatricule(String matricule) {
        if (matricule == null) return Optional.empty();
        return studentRepository.findByMatriculeAndActiveTrue(matricule.trim());
    }

    private Student require(Long id) {
        return studentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Student not found: " + id));
    }
}
