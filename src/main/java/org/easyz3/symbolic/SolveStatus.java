package org.easyz3.symbolic;

public enum SolveStatus {
    SAT,
    UNSAT,
    UNKNOWN
}
