package org.dxdomain.analyzer.resultflow;

/**
 * Lifecycle of a tracked result value.
 * <p>
 * {@link #CREATED} &lt; {@link #CHECKED} &lt; {@link #PROPAGATED} &lt; {@link #TERMINATED} is the promotion order;
 * a node only ever moves up. {@link #IGNORED} is never reached by promotion: it is the final label of a node
 * that was never promoted at all.
 */
public enum ResultState {
    CREATED(0),
    CHECKED(1),
    PROPAGATED(2),
    TERMINATED(3),
    IGNORED(4);

    public final int rank;

    ResultState(int rank) {
        this.rank = rank;
    }

    public boolean isPromotion() {
        return this != IGNORED;
    }

    /**
     * @return true when moving from this state to {@code target} is a strict promotion
     */
    public boolean canBePromotedTo(ResultState target) {
        return target.isPromotion() && target.rank > rank;
    }

    /**
     * @return the label a node carries in the output once the analysis is done
     */
    public ResultState finalState() {
        return this == CREATED ? IGNORED : this;
    }
}
