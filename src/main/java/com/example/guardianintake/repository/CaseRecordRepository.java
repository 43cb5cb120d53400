package com.example.guardianintake.repository;

import com.example.guardianintake.model.CaseRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CaseRecordRepository extends JpaRepository<CaseRecord, Long> {
    Optional<CaseRecord> findByCauseNumber(String causeNumber);
    boolean existsByCauseNumber(String causeNumber);
    List<CaseRecord> findByNeedsReviewTrue();
    List<CaseRecord> findAllByOrderByLastUpdatedDesc();
}
