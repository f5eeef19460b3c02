package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.Cap;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.RewardProgram;
import com.rewardpick.recommendation.model.RewardType;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Converts earning rules into cents earned per dollar spent, which is numerically the same as a
 * cashback percentage, and blends bonus and base rates around spending caps.
 */
@Component
public class RewardValuator {

    private static final double CASHBACK_BASE_RATE = 1.0;

    private final PointValuationTable pointValues;

    public RewardValuator(PointValuationTable pointValues) {
        this.pointValues = pointValues;
    }

    /**
     * Valuation table entry for the program, else the program's own valuation, else the default.
     */
    public double pointValueCents(RewardProgram program) {
        if (program == null) {
            return pointValues.defaultCents();
        }
        OptionalDouble configured = pointValues.lookup(program.id());
        if (configured.isPresent()) {
            return configured.getAsDouble();
        }
        return program.basePointValueCents() > 0 ? program.basePointValueCents() : pointValues.defaultCents();
    }

    public double effectiveRate(EarningRule rule, RewardProgram program) {
        if (rule.rewardType() == RewardType.CASHBACK_PERCENT) {
            return rule.multiplier();
        }
        return rule.multiplier() * pointValueCents(program);
    }

    /**
     * What the card earns once a bonus is exhausted: 1% for cashback cards, one point otherwise.
     */
    public double baseRate(CardProduct card) {
        if (card.rewardType() == RewardType.CASHBACK_PERCENT) {
            return CASHBACK_BASE_RATE;
        }
        return pointValueCents(card.rewardProgram());
    }

    /**
     * Blends the bonus rate with {@code baseRate} over the first cap. A {@code spendingAmount} of 0
     * means the caller gave no spend, in which case spend is assumed to be twice the cap.
     * Later caps on the same rule are not considered.
     */
    public CapAdjustment applyCap(double effectiveRate, List<Cap> caps, double spendingAmount, double baseRate) {
        if (spendingAmount < 0 || !Double.isFinite(spendingAmount)) {
            throw new IllegalArgumentException("spending amount must be a non-negative number: " + spendingAmount);
        }
        if (caps == null || caps.isEmpty()) {
            return CapAdjustment.unchanged(effectiveRate);
        }

        Cap cap = caps.get(0);
        double capAmount = cap.amountDollars();
        String period = cap.period().code();

        if (capAmount <= 0) {
            return new CapAdjustment(baseRate, List.of(
                String.format(Locale.US, "Spending cap of $0/%s leaves only the base rate of %.2f%%", period, baseRate)
            ));
        }

        if (spendingAmount == 0.0) {
            double assumedSpend = capAmount * 2;
            double blended = (capAmount * effectiveRate + (assumedSpend - capAmount) * baseRate) / assumedSpend;
            return new CapAdjustment(blended, List.of(
                String.format(
                    Locale.US,
                    "Spending cap: $%,.0f/%s. Blended rate: %.2f%% (assumes spending exceeds cap)",
                    capAmount,
                    period,
                    blended
                )
            ));
        }

        if (spendingAmount > capAmount) {
            double blended = (capAmount * effectiveRate + (spendingAmount - capAmount) * baseRate) / spendingAmount;
            return new CapAdjustment(blended, List.of(
                String.format(
                    Locale.US,
                    "Spending cap of $%,.0f/%s exceeded. Blended rate: %.2f%%",
                    capAmount,
                    period,
                    blended
                )
            ));
        }

        return new CapAdjustment(effectiveRate, List.of(
            String.format(Locale.US, "Spending cap: $%,.0f/%s (within limit)", capAmount, period)
        ));
    }
}
