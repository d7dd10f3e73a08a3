package domain.reflow;

/**
 * Indent metrics of one point: net change and lowest running value (never above 0).
 */
public final class IndentImpulse {

    private final int impulse;
    private final int trough;

    public IndentImpulse(int impulse, int trough) {
        this.impulse = impulse;
        this.trough = trough;
    }

    public int getImpulse() {
        return impulse;
    }

    public int getTrough() {
        return trough;
    }

    @Override
    public String toString() {
        return "(" + impulse + ", " + trough + ")";
    }
}
