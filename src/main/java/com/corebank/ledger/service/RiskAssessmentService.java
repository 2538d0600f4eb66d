package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.RiskAssessment;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.repository.InvestmentProductRepository;
import com.corebank.ledger.repository.RiskAssessmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Investor risk profiling and product recommendations.
 *
 * A recommendation score combines three factors, each in [0, 1]:
 *
 *   score = 0.4 * riskFit + 0.3 * experienceFit + 0.3 * goalFit
 *
 * riskFit falls with the distance between the user's tolerance and the
 * product's risk level (1.0, 0.8, 0.5, then 0.2). Products scoring 0.3 or
 * less are not offered. Users without a current assessment get the first
 * low-risk products at fixed, decreasing scores.
 */
@Service
@Transactional
public class RiskAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentService.class);

    static final BigDecimal MIN_SCORE = new BigDecimal("0.3");

    private static final BigDecimal RISK_WEIGHT = new BigDecimal("0.4");
    private static final BigDecimal EXPERIENCE_WEIGHT = new BigDecimal("0.3");
    private static final BigDecimal GOAL_WEIGHT = new BigDecimal("0.3");

    private static final BigDecimal DEFAULT_FIRST_SCORE = new BigDecimal("0.8");
    private static final BigDecimal DEFAULT_SCORE_STEP = new BigDecimal("0.1");
    private static final BigDecimal DEFAULT_ALLOCATION = new BigDecimal("20.0");

    private final RiskAssessmentRepository assessmentRepository;
    private final InvestmentProductRepository productRepository;
    private final CoreBankProperties.Advisory advisory;

    public RiskAssessmentService(
            RiskAssessmentRepository assessmentRepository,
            InvestmentProductRepository productRepository,
            CoreBankProperties properties) {
        this.assessmentRepository = assessmentRepository;
        this.productRepository = productRepository;
        this.advisory = properties.getAdvisory();
    }

    /**
     * Record a new questionnaire result. It replaces any earlier assessment
     * and stays current for corebank.advisory.assessment-validity-days.
     *
     * @throws com.corebank.ledger.exception.ValidationException if tolerance is outside 1..5 or an answer is missing
     */
    public RiskAssessment createAssessment(UUID userId, int riskTolerance,
                                           RiskAssessment.Experience experience,
                                           RiskAssessment.Goal goal,
                                           RiskAssessment.Horizon horizon,
                                           String monthlyIncomeRange) {
        Instant expiresAt = Instant.now().plus(Duration.ofDays(advisory.getAssessmentValidityDays()));
        RiskAssessment saved = assessmentRepository.save(new RiskAssessment(
                userId, riskTolerance, experience, goal, horizon, monthlyIncomeRange, expiresAt));
        log.info("Risk assessment recorded: user={}, tolerance={}, score={}, expiresAt={}",
                userId, riskTolerance, saved.getScore(), expiresAt);
        return saved;
    }

    /**
     * The user's latest assessment, unless it has expired.
     */
    @Transactional(readOnly = true)
    public Optional<RiskAssessment> findCurrentAssessment(UUID userId) {
        return assessmentRepository.findFirstByUserIdOrderByCreatedAtDesc(userId)
                .filter(assessment -> !assessment.isExpiredAt(Instant.now()));
    }

    /**
     * @throws NotFoundException if the user has no unexpired assessment
     */
    @Transactional(readOnly = true)
    public RiskAssessment getCurrentAssessment(UUID userId) {
        return findCurrentAssessment(userId)
                .orElseThrow(() -> new NotFoundException("No current risk assessment for user " + userId));
    }

    /**
     * Best-scoring active products for the user, highest score first and at
     * most corebank.advisory.max-recommendations of them. Ties go to the
     * lower product code.
     */
    @Transactional(readOnly = true)
    public List<ProductRecommendation> getRecommendations(UUID userId) {
        Optional<RiskAssessment> assessment = findCurrentAssessment(userId);
        if (assessment.isEmpty()) {
            log.debug("No current risk assessment for user {}; offering default products", userId);
            return defaultRecommendations();
        }
        RiskAssessment profile = assessment.get();

        return productRepository.findByActiveTrueOrderByProductCodeAsc().stream()
                .map(product -> recommend(profile, product))
                .filter(recommendation -> recommendation.getScore().compareTo(MIN_SCORE) > 0)
                .sorted(Comparator.comparing(ProductRecommendation::getScore).reversed()
                        .thenComparing(recommendation -> recommendation.getProduct().getProductCode()))
                .limit(advisory.getMaxRecommendations())
                .collect(Collectors.toList());
    }

    ProductRecommendation recommend(RiskAssessment profile, InvestmentProduct product) {
        int distance = Math.abs(profile.getRiskTolerance() - product.getRiskLevel());
        BigDecimal score = RISK_WEIGHT.multiply(riskFit(distance))
                .add(EXPERIENCE_WEIGHT.multiply(experienceFit(profile.getExperience(), product.getRiskLevel())))
                .add(GOAL_WEIGHT.multiply(goalFit(profile.getGoal(), product.getRiskLevel())))
                .min(BigDecimal.ONE)
                .setScale(Amounts.RATE_SCALE, Amounts.ROUNDING);
        return new ProductRecommendation(product, score,
                reasonFor(profile.getRiskTolerance(), product.getRiskLevel()),
                distance <= 1,
                suggestedAllocation(distance));
    }

    private List<ProductRecommendation> defaultRecommendations() {
        List<InvestmentProduct> products =
                productRepository.findTop3ByActiveTrueAndRiskLevelOrderByProductCodeAsc(advisory.getDefaultRiskLevel());
        List<ProductRecommendation> recommendations = new ArrayList<>(products.size());
        BigDecimal score = DEFAULT_FIRST_SCORE;
        for (InvestmentProduct product : products) {
            recommendations.add(new ProductRecommendation(product,
                    score.setScale(Amounts.RATE_SCALE, Amounts.ROUNDING),
                    "Conservative product offered until a risk assessment is completed.",
                    true,
                    DEFAULT_ALLOCATION));
            score = score.subtract(DEFAULT_SCORE_STEP);
        }
        return recommendations;
    }

    static BigDecimal riskFit(int distance) {
        switch (distance) {
            case 0:
                return new BigDecimal("1.0");
            case 1:
                return new BigDecimal("0.8");
            case 2:
                return new BigDecimal("0.5");
            default:
                return new BigDecimal("0.2");
        }
    }

    static BigDecimal experienceFit(RiskAssessment.Experience experience, int productRisk) {
        switch (experience) {
            case BEGINNER:
                return new BigDecimal(productRisk <= 2 ? "0.7" : "0.3");
            case INTERMEDIATE:
                return new BigDecimal(productRisk <= 3 ? "0.9" : "0.6");
            default:
                return BigDecimal.ONE;
        }
    }

    static BigDecimal goalFit(RiskAssessment.Goal goal, int productRisk) {
        switch (goal) {
            case WEALTH_PRESERVATION:
                return new BigDecimal(productRisk <= 2 ? "1.0" : "0.4");
            case STEADY_GROWTH:
                return new BigDecimal(productRisk <= 3 ? "1.0" : "0.6");
            default:
                return new BigDecimal(productRisk >= 3 ? "1.0" : "0.5");
        }
    }

    static BigDecimal suggestedAllocation(int distance) {
        switch (distance) {
            case 0:
                return new BigDecimal("30.0");
            case 1:
                return new BigDecimal("20.0");
            case 2:
                return new BigDecimal("10.0");
            default:
                return new BigDecimal("5.0");
        }
    }

    private static String reasonFor(int tolerance, int productRisk) {
        if (tolerance == productRisk) {
            return "Risk level matches your risk tolerance.";
        }
        if (Math.abs(tolerance - productRisk) == 1) {
            return productRisk < tolerance
                    ? "Slightly lower risk; suited to the stable part of your portfolio."
                    : "Slightly higher return potential; suited to a modest allocation.";
        }
        return "Outside your usual risk range; consider a small allocation for diversification.";
    }
}
