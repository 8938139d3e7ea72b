package dora.chatsync.connection;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay: {@code floor * 2^attempt}, capped at {@code ceiling}, then spread by
 * up to {@code randomization} in either direction and clamped to {@code [floor, ceiling]}.
 */
public class ReconnectBackoff {

    private final long floorMs;
    private final long ceilingMs;
    private final double randomization;
    private final DoubleSupplier random;

    public ReconnectBackoff(Duration floor, Duration ceiling, double randomization, DoubleSupplier random) {
        if (floor.isNegative() || ceiling.compareTo(floor) < 0) {
            throw new IllegalArgumentException("Reconnect delay bounds must satisfy 0 <= floor <= ceiling");
        }
        if (randomization < 0 || randomization > 1) {
            throw new IllegalArgumentException("Randomization must be within [0, 1]");
        }
        this.floorMs = floor.toMillis();
        this.ceilingMs = ceiling.toMillis();
        this.randomization = randomization;
        this.random = random;
    }

    /**
     * @param attempt zero for the first reconnect after a drop
     */
    public Duration delay(int attempt) {
        long base = floorMs;
        for (int i = 0; i < attempt && base < ceilingMs; i++) {
            base = Math.max(1, base * 2);
        }
        base = Math.min(base, ceilingMs);
        double spread = (random.getAsDouble() * 2 - 1) * randomization;
        long jittered = Math.round(base * (1 + spread));
        return Duration.ofMillis(Math.max(floorMs, Math.min(ceilingMs, jittered)));
    }
}
