package com.safetyrisk.common.validation;

import com.safetyrisk.common.exception.InvalidIndicatorException;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.ReportingPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorValidatorTest {

    private final IndicatorValidator validator = new IndicatorValidator(12);

    private static IndicatorRecord valid() {
        return new IndicatorRecord("jardim", ReportingPeriod.of(2024, 5), 10, 0, 2, 1, 0.4, 6, "patrol");
    }

    @Test
    @DisplayName("well-formed record passes")
    void validRecord() {
        assertDoesNotThrow(() -> validator.validate(valid()));
    }

    @Test
    @DisplayName("negative count names the field, neighborhood and period")
    void negativeCount() {
        IndicatorRecord r = new IndicatorRecord("jardim", ReportingPeriod.of(2024, 5), -1, 0, 0, 0, 0.0, 0, "none");
        InvalidIndicatorException e = assertThrows(InvalidIndicatorException.class, () -> validator.validate(r));
        assertEquals("jardim", e.getNeighborhoodId());
        assertEquals(ReportingPeriod.of(2024, 5), e.getPeriod());
        assertTrue(e.getReason().contains("crimeCount"));
        assertTrue(e.getMessage().startsWith("[jardim] "));
    }

    @Test
    @DisplayName("negative deaths, arrests, weapons or officers are rejected")
    void otherNegativeCounts() {
        ReportingPeriod p = ReportingPeriod.of(2024, 5);
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, -1, 0, 0, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, 0, -1, 0, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, 0, 0, -1, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, 0, 0, 0, 0.0, -1, "none")));
    }

    @Test
    @DisplayName("negative or non-finite drug quantity is rejected")
    void badDrugs() {
        ReportingPeriod p = ReportingPeriod.of(2024, 5);
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, 0, 0, 0, -0.5, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", p, 1, 0, 0, 0, Double.NaN, 0, "none")));
    }

    @Test
    @DisplayName("period index outside 1..12 is rejected")
    void periodOutOfRange() {
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", new ReportingPeriod(2024, 13), 1, 0, 0, 0, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", new ReportingPeriod(2024, 0), 1, 0, 0, 0, 0.0, 0, "none")));
    }

    @Test
    @DisplayName("missing id, period or record is rejected")
    void missingParts() {
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord(" ", ReportingPeriod.of(2024, 1), 1, 0, 0, 0, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class,
            () -> validator.validate(new IndicatorRecord("j", null, 1, 0, 0, 0, 0.0, 0, "none")));
        assertThrows(InvalidIndicatorException.class, () -> validator.validate(null));
    }
}
