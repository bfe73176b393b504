package tech.bizsuite.entitlements.plan;

/**
 * Credit grant attached to a plan.
 *
 * @param freeCredits Credits granted for free when the plan starts
 * @param paidCredits Paid credits included with the plan (additional credits can be purchased)
 * @param expiryDays Validity of the free grant, in days
 */
public record CreditAllocation(
    long freeCredits,
    long paidCredits,
    int expiryDays
) {

    /**
     * Allocation reported for a plan that does not exist.
     */
    public static final CreditAllocation NONE = new CreditAllocation(0, 0, 30);

    public CreditAllocation {
        if (freeCredits < 0 || paidCredits < 0) {
            throw new IllegalArgumentException("Credit quantities cannot be negative");
        }
        if (expiryDays <= 0) {
            throw new IllegalArgumentException("expiryDays must be positive: " + expiryDays);
        }
    }
}
