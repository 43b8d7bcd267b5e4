package com.solast.ast;

/**
 * Unit suffix of a number literal, e.g. {@code 1 ether}.
 */
public enum Subdenomination {
    WEI("wei"),
    SZABO("szabo"),
    FINNEY("finney"),
    ETHER("ether"),
    SECONDS("seconds"),
    MINUTES("minutes"),
    HOURS("hours"),
    DAYS("days"),
    WEEKS("weeks"),
    YEARS("years");

    private final String label;

    Subdenomination(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
