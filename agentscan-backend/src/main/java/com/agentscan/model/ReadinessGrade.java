package com.agentscan.model;

/**
 * Letter grade for a composite readiness score. Each band includes its lower bound.
 */
public enum ReadinessGrade {
    A(80),
    B(60),
    C(40),
    D(20),
    F(0);

    private final int minScore;

    ReadinessGrade(int minScore) {
        this.minScore = minScore;
    }

    public static ReadinessGrade of(int score) {
        for (ReadinessGrade g : values()) {
            if (score >= g.minScore) {
                return g;
            }
        }
        return F;
    }
}
