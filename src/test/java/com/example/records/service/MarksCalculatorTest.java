package com.example.records.service;

import com.example.records.entities.StudentRecord;
import com.example.records.enums.Grade;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static com.example.records.StoreFixture.record;
import static org.junit.jupiter.api.Assertions.*;

class MarksCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "100.0, A+",
            "90.0, A+",
            "89.99, A",
            "80.0, A",
            "79.99, B",
            "70.0, B",
            "60.0, C",
            "59.99, D",
            "50.0, D",
            "49.99, F",
            "0.0, F"
    })
    void gradeThresholds(double percentage, String label) {
        assertEquals(label, MarksCalculator.gradeFor(percentage).getLabel());
    }

    @Test
    void recomputeOverwritesDerivedFields() {
        StudentRecord r = StudentRecord.builder()
                .id(1)
                .name("X")
                .marks(new double[]{95, 85, 90})
                .total(1)
                .percentage(2)
                .grade(Grade.F)
                .build();

        MarksCalculator.recompute(r);

        assertEquals(270.0, r.getTotal(), 1e-9);
        assertEquals(90.0, r.getPercentage(), 1e-9);
        assertEquals(Grade.A_PLUS, r.getGrade());
    }

    @Test
    void percentageIsTotalOverThreeHundred() {
        assertEquals(75.5, record(2, "Y", 70.5, 80, 76).getPercentage(), 1e-9);
    }

    @Test
    void markBounds() {
        assertTrue(MarksCalculator.isValidMark(0));
        assertTrue(MarksCalculator.isValidMark(100));
        assertFalse(MarksCalculator.isValidMark(-1));
        assertFalse(MarksCalculator.isValidMark(100.01));
        assertFalse(MarksCalculator.isValidMark(Double.NaN));
    }
}
