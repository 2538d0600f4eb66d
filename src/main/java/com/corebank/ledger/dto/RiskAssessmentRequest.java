package com.corebank.ledger.dto;

import com.corebank.ledger.domain.RiskAssessment;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * DTO for submitting the investor questionnaire.
 */
public class RiskAssessmentRequest {

    @NotNull(message = "Risk tolerance is required")
    @Min(value = 1, message = "Risk tolerance must be between 1 and 5")
    @Max(value = 5, message = "Risk tolerance must be between 1 and 5")
    private Integer riskTolerance;

    @NotNull(message = "Investment experience is required")
    private RiskAssessment.Experience investmentExperience;

    @NotNull(message = "Investment goal is required")
    private RiskAssessment.Goal investmentGoal;

    @NotNull(message = "Investment horizon is required")
    private RiskAssessment.Horizon investmentHorizon;

    @Size(max = 50, message = "Income range must be at most 50 characters")
    private String monthlyIncomeRange;

    public RiskAssessmentRequest() {
    }

    public RiskAssessmentRequest(Integer riskTolerance, RiskAssessment.Experience investmentExperience,
                                 RiskAssessment.Goal investmentGoal, RiskAssessment.Horizon investmentHorizon) {
        this.riskTolerance = riskTolerance;
        this.investmentExperience = investmentExperience;
        this.investmentGoal = investmentGoal;
        this.investmentHorizon = investmentHorizon;
    }

    public Integer getRiskTolerance() { return riskTolerance; }
    public void setRiskTolerance(Integer riskTolerance) { this.riskTolerance = riskTolerance; }
    public RiskAssessment.Experience getInvestmentExperience() { return investmentExperience; }
    public void setInvestmentExperience(RiskAssessment.Experience investmentExperience) { this.investmentExperience = investmentExperience; }
    public RiskAssessment.Goal getInvestmentGoal() { return investmentGoal; }
    public void setInvestmentGoal(RiskAssessment.Goal investmentGoal) { this.investmentGoal = investmentGoal; }
    public RiskAssessment.Horizon getInvestmentHorizon() { return investmentHorizon; }
    public void setInvestmentHorizon(RiskAssessment.Horizon investmentHorizon) { this.investmentHorizon = investmentHorizon; }
    public String getMonthlyIncomeRange() { return monthlyIncomeRange; }
    public void setMonthlyIncomeRange(String monthlyIncomeRange) { this.monthlyIncomeRange = monthlyIncomeRange; }
}
