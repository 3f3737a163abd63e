package com.marketsim.core;

import com.marketsim.api.OrderKind;
import com.marketsim.api.RejectReason;
import com.marketsim.api.Side;

/**
 * Pre-trade parameter checks. Runs before an order is sequenced, so a rejected
 * order consumes no id and never touches the book.
 */
public class OrderValidator {

    public enum ValidationResult {
        VALID(RejectReason.NONE),
        INVALID_SIDE(RejectReason.INVALID_SIDE),
        INVALID_KIND(RejectReason.INVALID_KIND),
        INVALID_QTY(RejectReason.INVALID_QUANTITY),
        MISSING_PRICE(RejectReason.MISSING_LIMIT_PRICE),
        INVALID_PRICE(RejectReason.INVALID_LIMIT_PRICE);

        private final RejectReason rejectReason;

        ValidationResult(RejectReason rejectReason) {
            this.rejectReason = rejectReason;
        }

        public RejectReason rejectReason() {
            return rejectReason;
        }

        public boolean isValid() {
            return this == VALID;
        }
    }

    private final PriceScale scale;

    public OrderValidator(PriceScale scale) {
        this.scale = scale;
    }

    /**
     * A limit price is invalid when it is not positive, not finite, above
     * {@link PriceScale#MAX_TICKS} or below one tick once rounded toward the
     * passive side.
     *
     * @param limitPrice ignored for market orders; NaN means absent
     */
    public ValidationResult validate(byte side, byte kind, long quantity, double limitPrice) {
        if (!Side.isValid(side)) {
            return ValidationResult.INVALID_SIDE;
        }
        if (!OrderKind.isValid(kind)) {
            return ValidationResult.INVALID_KIND;
        }
        if (quantity <= 0) {
            return ValidationResult.INVALID_QTY;
        }
        if (kind == OrderKind.LIMIT) {
            if (Double.isNaN(limitPrice)) {
                return ValidationResult.MISSING_PRICE;
            }
            if (!scale.isValidLimit(limitPrice, side == Side.BUY)) {
                return ValidationResult.INVALID_PRICE;
            }
        }
        return ValidationResult.VALID;
    }
}
