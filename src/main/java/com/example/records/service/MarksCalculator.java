package com.example.records.service;

import com.example.records.entities.StudentRecord;
import com.example.records.enums.Grade;
import com.example.records.enums.Subject;

/**
 * Derives total, percentage and grade from the raw marks of a record.
 */
public final class MarksCalculator {

    public static final double MAX_TOTAL = Subject.MAX_MARK * Subject.count();

    private MarksCalculator() {
    }

    /**
     * Overwrites the derived fields of {@code record} in place.
     */
    public static StudentRecord recompute(StudentRecord record) {
        double total = 0.0;
        for (double mark : record.getMarks()) {
            total += mark;
        }
        double percentage = total * 100.0 / MAX_TOTAL;
        record.setTotal(total);
        record.setPercentage(percentage);
        record.setGrade(gradeFor(percentage));
        return record;
    }

    public static Grade gradeFor(double percentage) {
        return Grade.forPercentage(percentage);
    }

    public static boolean isValidMark(double mark) {
        return mark >= 0.0 && mark <= Subject.MAX_MARK;
    }
}
