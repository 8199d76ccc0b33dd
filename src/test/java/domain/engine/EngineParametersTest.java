package domain.engine;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCategory;
import domain.model.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineParametersTest {

    @Test
    void defaults_shouldMatchEngineDefaults() {
        EngineParameters p = EngineParameters.defaults();

        assertEquals(PAdjustMethod.HOLM, p.getPAdjustMethod());
        assertEquals(0.1, p.getPrevalenceCutoff());
        assertEquals(0, p.getLibCut());
        assertEquals(1e-2, p.getTol());
        assertEquals(20, p.getMaxIter());
        assertEquals(0.05, p.getAlpha());
        assertFalse(p.isStructuralZeros());
        assertFalse(p.isAsymptoticCutoff());
        assertEquals(1, p.getNumProcesses());
    }

    @Test
    void build_shouldAcceptBoundaryValues() {
        EngineParameters p = EngineParameters.builder()
                .alpha(1.0)
                .prevalenceCutoff(0.0)
                .maxIter(1)
                .pAdjustMethod(null)
                .build();

        assertEquals(1.0, p.getAlpha());
        assertEquals(0.0, p.getPrevalenceCutoff());
        assertEquals(PAdjustMethod.HOLM, p.getPAdjustMethod());
    }

    @Test
    void build_shouldRejectAlphaOutsideUnitInterval() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class,
                () -> EngineParameters.builder().alpha(0.0).build());

        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals(ErrorCategory.PRECONDITION, e.getCategory());
        assertTrue(e.getMessage().contains("alpha"));
    }

    @Test
    void build_shouldRejectOtherOutOfRangeValues() {
        assertThrows(Ancombc2Exception.class, () -> EngineParameters.builder().prevalenceCutoff(1.5).build());
        assertThrows(Ancombc2Exception.class, () -> EngineParameters.builder().libCut(-1).build());
        assertThrows(Ancombc2Exception.class, () -> EngineParameters.builder().tol(0).build());
        assertThrows(Ancombc2Exception.class, () -> EngineParameters.builder().maxIter(0).build());
        assertThrows(Ancombc2Exception.class, () -> EngineParameters.builder().numProcesses(0).build());
    }
}
