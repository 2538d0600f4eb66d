package com.corebank.ledger.domain;

import com.corebank.ledger.exception.ValidationException;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's answers to the investor questionnaire and the score derived from
 * them. Assessments are never edited: a new one is recorded and the latest
 * unexpired one is current.
 *
 *   score = tolerance * 8 + experience * 6 + goal * 4 + horizon * 2, at most 100
 *
 * where experience, goal and horizon are worth 1, 3 or 5 points.
 */
@Entity
@Table(
    name = "risk_assessments",
    indexes = @Index(name = "idx_risk_assessments_user_created", columnList = "user_id,created_at")
)
public class RiskAssessment {

    public static final int MAX_SCORE = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    /** Same 1..5 scale as InvestmentProduct.riskLevel. */
    @Column(name = "risk_tolerance", nullable = false, updatable = false)
    private int riskTolerance;

    @Enumerated(EnumType.STRING)
    @Column(name = "investment_experience", nullable = false, length = 20, updatable = false)
    private Experience experience;

    @Enumerated(EnumType.STRING)
    @Column(name = "investment_goal", nullable = false, length = 30, updatable = false)
    private Goal goal;

    @Enumerated(EnumType.STRING)
    @Column(name = "investment_horizon", nullable = false, length = 20, updatable = false)
    private Horizon horizon;

    @Column(name = "monthly_income_range", length = 50, updatable = false)
    private String monthlyIncomeRange;

    @Column(name = "assessment_score", nullable = false, updatable = false)
    private int score;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum Experience {
        BEGINNER(1),
        INTERMEDIATE(3),
        ADVANCED(5);

        private final int points;

        Experience(int points) {
            this.points = points;
        }

        public int getPoints() {
            return points;
        }
    }

    public enum Goal {
        WEALTH_PRESERVATION(1),
        STEADY_GROWTH(3),
        AGGRESSIVE_GROWTH(5);

        private final int points;

        Goal(int points) {
            this.points = points;
        }

        public int getPoints() {
            return points;
        }
    }

    public enum Horizon {
        SHORT_TERM(1),
        MEDIUM_TERM(3),
        LONG_TERM(5);

        private final int points;

        Horizon(int points) {
            this.points = points;
        }

        public int getPoints() {
            return points;
        }
    }

    protected RiskAssessment() {
    }

    public RiskAssessment(UUID userId, int riskTolerance, Experience experience, Goal goal, Horizon horizon,
                          String monthlyIncomeRange, Instant expiresAt) {
        if (userId == null) {
            throw new ValidationException("User is required");
        }
        if (riskTolerance < 1 || riskTolerance > 5) {
            throw new ValidationException("Risk tolerance must be between 1 and 5, got " + riskTolerance);
        }
        if (experience == null || goal == null || horizon == null) {
            throw new ValidationException("Experience, goal and horizon are required");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry is required");
        }
        this.userId = userId;
        this.riskTolerance = riskTolerance;
        this.experience = experience;
        this.goal = goal;
        this.horizon = horizon;
        this.monthlyIncomeRange = monthlyIncomeRange;
        this.score = scoreOf(riskTolerance, experience, goal, horizon);
        this.createdAt = Instant.now();
        this.expiresAt = expiresAt;
    }

    public static int scoreOf(int riskTolerance, Experience experience, Goal goal, Horizon horizon) {
        int score = riskTolerance * 8
                + experience.getPoints() * 6
                + goal.getPoints() * 4
                + horizon.getPoints() * 2;
        return Math.min(score, MAX_SCORE);
    }

    public boolean isExpiredAt(Instant instant) {
        return !expiresAt.isAfter(instant);
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getRiskTolerance() {
        return riskTolerance;
    }

    public Experience getExperience() {
        return experience;
    }

    public Goal getGoal() {
        return goal;
    }

    public Horizon getHorizon() {
        return horizon;
    }

    public String getMonthlyIncomeRange() {
        return monthlyIncomeRange;
    }

    public int getScore() {
        return score;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
