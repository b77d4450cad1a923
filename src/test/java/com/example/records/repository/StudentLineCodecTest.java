package com.example.records.repository;

import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Grade;
import com.example.records.enums.Subject;
import com.example.records.exceptions.RecordsException;
import com.example.records.service.MarksCalculator;
import org.junit.jupiter.api.Test;

import static com.example.records.StoreFixture.record;
import static org.junit.jupiter.api.Assertions.*;

class StudentLineCodecTest {

    private final StudentLineCodec codec = new StudentLineCodec();

    @Test
    void encodesMarksWithTwoDecimals() {
        assertEquals("7|Asha Rao|90.50|80.00|70.25", codec.encode(record(7, "Asha Rao", 90.5, 80, 70.25)));
    }

    @Test
    void decodeRecomputesDerivedFields() {
        StudentRecord original = record(12, "Lena", 95.25, 88.5, 91.0);
        StudentRecord decoded = codec.decode(codec.encode(original));

        assertEquals(MarksCalculator.recompute(original.copy()), decoded);
        assertEquals(274.75, decoded.getTotal(), 1e-9);
        assertEquals(Grade.A_PLUS, decoded.getGrade());
    }

    @Test
    void ignoresStoredDerivedValuesAndExtraFields() {
        StudentRecord decoded = codec.decode("3|Omar|50.00|50.00|50.00|999|999|A+");
        assertEquals(150.0, decoded.getTotal(), 1e-9);
        assertEquals(Grade.D, decoded.getGrade());
    }

    @Test
    void missingTrailingMarksBecomeZero() {
        StudentRecord decoded = codec.decode("4|Mia|60.00");
        assertArrayEquals(new double[]{60.0, 0.0, 0.0}, decoded.getMarks());
        assertEquals(20.0, decoded.getPercentage(), 1e-9);
        assertEquals(Grade.F, decoded.getGrade());
    }

    @Test
    void stripsWindowsLineEndings() {
        StudentRecord decoded = codec.decode("5|Noor|10.00|20.00|30.00\r\n");
        assertEquals(30.0, decoded.getMark(Subject.ENGLISH), 1e-9);
    }

    @Test
    void rejectsNonIntegerId() {
        RecordsException ex = assertThrows(RecordsException.class, () -> codec.decode("x|Bad|1|2|3"));
        assertEquals(ErrorKind.MALFORMED_LINE, ex.getKind());
    }

    @Test
    void rejectsLineWithoutName() {
        assertThrows(RecordsException.class, () -> codec.decode("42"));
        assertThrows(RecordsException.class, () -> codec.decode("42|   |1|2|3"));
    }

    @Test
    void nonNumericMarkReadsAsZero() {
        StudentRecord decoded = codec.decode("1|Ann|abc|50.00|50.00");
        assertEquals(1, decoded.getId());
        assertArrayEquals(new double[]{0.0, 50.0, 50.0}, decoded.getMarks());
        assertEquals(100.0, decoded.getTotal(), 1e-9);
    }

    @Test
    void markIsReadFromItsLeadingNumber() {
        assertEquals(42.5, StudentLineCodec.parseMark("42.5kg"), 1e-9);
        assertEquals(7.0, StudentLineCodec.parseMark(" 7 "), 1e-9);
        assertEquals(-3.0, StudentLineCodec.parseMark("-3"), 1e-9);
        assertEquals(0.0, StudentLineCodec.parseMark(""), 1e-9);
        assertEquals(0.0, StudentLineCodec.parseMark("n/a"), 1e-9);
    }

    @Test
    void delimiterInNameShiftsTheFields() {
        String line = codec.encode(record(9, "Ann|Marie", 10, 20, 30));
        assertEquals("9|Ann|Marie|10.00|20.00|30.00", line);
        StudentRecord decoded = codec.decode(line);
        assertEquals("Ann", decoded.getName());
        assertArrayEquals(new double[]{0.0, 10.0, 20.0}, decoded.getMarks());
    }
}
