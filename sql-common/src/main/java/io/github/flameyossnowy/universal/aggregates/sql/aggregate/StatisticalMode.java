package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * Population vs. sample variant of STDDEV / VARIANCE, emitted as the {@code _POP} / {@code _SAMP} suffix.
 */
public enum StatisticalMode {
    DEFAULT(""),
    POPULATION("POP"),
    SAMPLE("SAMP");

    private final String suffix;

    StatisticalMode(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
