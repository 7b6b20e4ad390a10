package photoyield.domain.fit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConvergenceTierTest {

    @Test
    @DisplayName("max() conserva el nivel más exigente alcanzado")
    void max_shouldBeSticky() {
        assertEquals(ConvergenceTier.TIGHT, ConvergenceTier.TIGHT.max(ConvergenceTier.LOOSE));
        assertEquals(ConvergenceTier.EXACT, ConvergenceTier.LOOSE.max(ConvergenceTier.EXACT));
        assertEquals(ConvergenceTier.NONE, ConvergenceTier.NONE.max(null));
    }

    @Test
    @DisplayName("isAtLeast() respeta el orden NONE < LOOSE < TIGHT < EXACT")
    void isAtLeast_shouldFollowOrdering() {
        assertTrue(ConvergenceTier.EXACT.isAtLeast(ConvergenceTier.TIGHT));
        assertTrue(ConvergenceTier.LOOSE.isAtLeast(ConvergenceTier.LOOSE));
        assertFalse(ConvergenceTier.LOOSE.isAtLeast(ConvergenceTier.TIGHT));
    }

    @Test
    @DisplayName("Una iteración fallida se marca con R² NaN y se imprime igualmente")
    void iterationRecord_shouldFlagFailedEvaluation() {
        IterationRecord failed = new IterationRecord(3, 450.0, "qy", 0.3, "k", 1e-3, Double.NaN, Double.NaN);
        IterationRecord ok = new IterationRecord(4, 450.0, "qy", 0.3, "k", 1e-3, 0.99, 0.98);

        assertTrue(failed.isEvaluationFailed());
        assertFalse(ok.isEvaluationFailed());
        assertTrue(ok.toLogLine().startsWith("[4] λ=450.0 nm qy=0.300000 k=0.00100000"));
    }
}
