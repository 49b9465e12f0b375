package net.cloudtolocalllm.relay.health;

/**
 * Coarse endpoint quality, ordered from worst to best.
 */
public enum QualityScore {
    UNAVAILABLE("unavailable"),
    DEGRADED("degraded"),
    GOOD("good"),
    EXCELLENT("excellent");

    private final String wireName;

    QualityScore(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public int tier() {
        return ordinal();
    }

    public boolean isAtLeast(QualityScore other) {
        return ordinal() >= other.ordinal();
    }

    public boolean isReachable() {
        return this != UNAVAILABLE;
    }
}
