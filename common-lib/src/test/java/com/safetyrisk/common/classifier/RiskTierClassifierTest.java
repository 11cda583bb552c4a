package com.safetyrisk.common.classifier;

import com.safetyrisk.common.config.TierBreakpoints;
import com.safetyrisk.common.model.RiskTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskTierClassifierTest {

    private final RiskTierClassifier classifier = new RiskTierClassifier();

    @Nested
    @DisplayName("classify(): default breakpoints")
    class DefaultBreakpoints {

        @Test
        @DisplayName("lower bounds are inclusive")
        void lowerBoundsInclusive() {
            assertEquals(RiskTier.VERY_LOW, classifier.classify(0.0));
            assertEquals(RiskTier.VERY_LOW, classifier.classify(2.999));
            assertEquals(RiskTier.LOW, classifier.classify(3.0));
            assertEquals(RiskTier.LOW_MEDIUM, classifier.classify(8.0));
            assertEquals(RiskTier.MEDIUM, classifier.classify(15.0));
            assertEquals(RiskTier.MEDIUM_HIGH, classifier.classify(30.0));
            assertEquals(RiskTier.HIGH, classifier.classify(50.0));
            assertEquals(RiskTier.VERY_HIGH, classifier.classify(80.0));
            assertEquals(RiskTier.VERY_HIGH, classifier.classify(119.999));
            assertEquals(RiskTier.CRITICAL, classifier.classify(120.0));
        }

        @Test
        @DisplayName("no upper bound on CRITICAL")
        void criticalUnbounded() {
            assertEquals(RiskTier.CRITICAL, classifier.classify(1_000_000.0));
        }

        @Test
        @DisplayName("tier never decreases as the score grows")
        void monotone() {
            RiskTier previous = RiskTier.VERY_LOW;
            for (double score = 0.0; score <= 200.0; score += 0.5) {
                RiskTier tier = classifier.classify(score);
                assertTrue(tier.compareTo(previous) >= 0, "score=" + score);
                previous = tier;
            }
        }

        @Test
        @DisplayName("negative or NaN score is rejected")
        void invalidScore() {
            assertThrows(IllegalArgumentException.class, () -> classifier.classify(-0.1));
            assertThrows(IllegalArgumentException.class, () -> classifier.classify(Double.NaN));
        }
    }

    @Nested
    @DisplayName("custom breakpoints")
    class CustomBreakpoints {

        @Test
        @DisplayName("shifted table is honoured")
        void shifted() {
            RiskTierClassifier custom = new RiskTierClassifier(
                new TierBreakpoints(List.of(1.0, 2.0, 4.0, 8.0, 16.0, 32.0, 64.0)));
            assertEquals(RiskTier.LOW, custom.classify(1.0));
            assertEquals(RiskTier.MEDIUM_HIGH, custom.classify(9.0));
            assertEquals(RiskTier.CRITICAL, custom.classify(64.0));
        }

        @Test
        @DisplayName("non-ascending or wrong-sized tables are rejected")
        void invalidTables() {
            assertThrows(IllegalArgumentException.class,
                () -> new TierBreakpoints(List.of(3.0, 8.0, 8.0, 30.0, 50.0, 80.0, 120.0)));
            assertThrows(IllegalArgumentException.class,
                () -> new TierBreakpoints(List.of(3.0, 8.0, 15.0)));
            assertThrows(IllegalArgumentException.class,
                () -> new TierBreakpoints(List.of(0.0, 8.0, 15.0, 30.0, 50.0, 80.0, 120.0)));
        }
    }

    @Test
    @DisplayName("tier labels serialise in snake case")
    void labels() {
        assertEquals("very_low", RiskTier.VERY_LOW.label());
        assertEquals("medium_high", RiskTier.MEDIUM_HIGH.label());
        assertEquals(RiskTier.VERY_HIGH, RiskTier.fromLabel("very_high"));
    }
}
