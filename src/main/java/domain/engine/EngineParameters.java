package domain.engine;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;

/**
 * Scalar knobs passed through to the engine unchanged. Ranges are checked in {@link Builder#build()}.
 */
public final class EngineParameters {

    private final PAdjustMethod pAdjustMethod;
    private final double prevalenceCutoff;
    private final int libCut;
    private final double tol;
    private final int maxIter;
    private final double alpha;
    private final boolean structuralZeros;
    private final boolean asymptoticCutoff;
    private final int numProcesses;

    private EngineParameters(Builder b) {
        this.pAdjustMethod = b.pAdjustMethod;
        this.prevalenceCutoff = b.prevalenceCutoff;
        this.libCut = b.libCut;
        this.tol = b.tol;
        this.maxIter = b.maxIter;
        this.alpha = b.alpha;
        this.structuralZeros = b.structuralZeros;
        this.asymptoticCutoff = b.asymptoticCutoff;
        this.numProcesses = b.numProcesses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineParameters defaults() {
        return builder().build();
    }

    public PAdjustMethod getPAdjustMethod() {
        return pAdjustMethod;
    }

    public double getPrevalenceCutoff() {
        return prevalenceCutoff;
    }

    public int getLibCut() {
        return libCut;
    }

    public double getTol() {
        return tol;
    }

    public int getMaxIter() {
        return maxIter;
    }

    public double getAlpha() {
        return alpha;
    }

    public boolean isStructuralZeros() {
        return structuralZeros;
    }

    public boolean isAsymptoticCutoff() {
        return asymptoticCutoff;
    }

    public int getNumProcesses() {
        return numProcesses;
    }

    @Override
    public String toString() {
        return "EngineParameters{pAdjust=" + pAdjustMethod.getEngineName()
                + ", prvCut=" + prevalenceCutoff
                + ", libCut=" + libCut
                + ", tol=" + tol
                + ", maxIter=" + maxIter
                + ", alpha=" + alpha
                + ", structZero=" + structuralZeros
                + ", negLb=" + asymptoticCutoff
                + ", nCl=" + numProcesses + '}';
    }

    public static final class Builder {
        private PAdjustMethod pAdjustMethod = PAdjustMethod.HOLM;
        private double prevalenceCutoff = 0.1;
        private int libCut = 0;
        private double tol = 1e-2;
        private int maxIter = 20;
        private double alpha = 0.05;
        private boolean structuralZeros = false;
        private boolean asymptoticCutoff = false;
        private int numProcesses = 1;

        private Builder() {
        }

        public Builder pAdjustMethod(PAdjustMethod v) {
            this.pAdjustMethod = (v == null) ? PAdjustMethod.HOLM : v;
            return this;
        }

        public Builder prevalenceCutoff(double v) {
            this.prevalenceCutoff = v;
            return this;
        }

        public Builder libCut(int v) {
            this.libCut = v;
            return this;
        }

        public Builder tol(double v) {
            this.tol = v;
            return this;
        }

        public Builder maxIter(int v) {
            this.maxIter = v;
            return this;
        }

        public Builder alpha(double v) {
            this.alpha = v;
            return this;
        }

        public Builder structuralZeros(boolean v) {
            this.structuralZeros = v;
            return this;
        }

        public Builder asymptoticCutoff(boolean v) {
            this.asymptoticCutoff = v;
            return this;
        }

        public Builder numProcesses(int v) {
            this.numProcesses = v;
            return this;
        }

        public EngineParameters build() {
            if (!(alpha > 0.0 && alpha <= 1.0)) {
                throw invalid("alpha", alpha, "(0, 1]");
            }
            if (!(prevalenceCutoff >= 0.0 && prevalenceCutoff <= 1.0)) {
                throw invalid("prevalenceCutoff", prevalenceCutoff, "[0, 1]");
            }
            if (libCut < 0) throw invalid("libCut", libCut, ">= 0");
            if (!(tol > 0.0)) throw invalid("tol", tol, "> 0");
            if (maxIter < 1) throw invalid("maxIter", maxIter, ">= 1");
            if (numProcesses < 1) throw invalid("numProcesses", numProcesses, ">= 1");
            return new EngineParameters(this);
        }

        private static Ancombc2Exception invalid(String name, Object value, String range) {
            return new Ancombc2Exception(ErrorCode.INVALID_PARAMETER,
                    "The parameter \"" + name + "\" must be in " + range + "; got " + value + ".");
        }
    }
}
