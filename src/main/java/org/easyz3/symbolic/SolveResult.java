package org.easyz3.symbolic;

import lombok.Getter;
import org.easyz3.core.Valuation;
import org.easyz3.exceptions.NoModelAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 一次求解的结果：SAT（带模型）、UNSAT，或 UNKNOWN（带原因）。
 * UNSAT 和 UNKNOWN 都是正常结果，不是异常。
 */
@Getter
public final class SolveResult {

    private static final Logger logger = LoggerFactory.getLogger(SolveResult.class);

    public static final String TIMEOUT_REASON = "timeout";

    private static final SolveResult UNSAT = new SolveResult(SolveStatus.UNSAT, null, null);

    private final SolveStatus status;
    // 仅 SAT 时非空
    private final Valuation model;
    // 仅 UNKNOWN 时非空
    private final String reason;

    private SolveResult(SolveStatus status, Valuation model, String reason) {
        this.status = status;
        this.model = model;
        this.reason = reason;
    }

    public static SolveResult sat(Valuation model) {
        return new SolveResult(SolveStatus.SAT, Objects.requireNonNull(model, "SAT 结果必须带模型"), null);
    }

    public static SolveResult unsat() {
        return UNSAT;
    }

    public static SolveResult unknown(String reason) {
        return new SolveResult(SolveStatus.UNKNOWN, null, Objects.requireNonNull(reason, "UNKNOWN 结果必须带原因"));
    }

    public boolean isSat() {
        return status == SolveStatus.SAT;
    }

    public boolean isUnsat() {
        return status == SolveStatus.UNSAT;
    }

    public boolean isUnknown() {
        return status == SolveStatus.UNKNOWN;
    }

    /**
     * @throws NoModelAvailableException 结果不是 SAT。
     */
    public Valuation getModel() {
        if (model == null) {
            logger.error("结果为 {}，没有可用的模型", this);
            throw new NoModelAvailableException("求解结果为 " + this + "，没有可用的模型");
        }
        return model;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SolveResult that = (SolveResult) o;
        return status == that.status && Objects.equals(model, that.model) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, model, reason);
    }

    @Override
    public String toString() {
        return switch (status) {
            case SAT -> "SAT" + model;
            case UNSAT -> "UNSAT";
            case UNKNOWN -> "UNKNOWN(" + reason + ")";
        };
    }
}
