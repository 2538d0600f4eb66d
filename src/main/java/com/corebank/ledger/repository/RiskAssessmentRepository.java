package com.corebank.ledger.repository;

import com.corebank.ledger.domain.RiskAssessment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Append-only questionnaire results. The newest row of a user is the
 * candidate current assessment; expiry is checked by the caller.
 */
@Repository
public interface RiskAssessmentRepository extends JpaRepository<RiskAssessment, UUID> {

    Optional<RiskAssessment> findFirstByUserIdOrderByCreatedAtDesc(UUID userId);
}
