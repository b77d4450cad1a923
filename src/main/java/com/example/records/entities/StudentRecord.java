package com.example.records.entities;

import com.example.records.enums.Grade;
import com.example.records.enums.Subject;
import lombok.*;

/**
 * One line of the student file. total, percentage and grade are derived from
 * marks and are recalculated on every load and before every save.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StudentRecord {

    // roll number, supplied by the caller
    private int id;

    private String name;

    // indexed by Subject.ordinal()
    @Builder.Default
    private double[] marks = new double[Subject.count()];

    private double total;

    private double percentage;

    private Grade grade;

    public double getMark(Subject subject) {
        return marks[subject.ordinal()];
    }

    public void setMark(Subject subject, double mark) {
        marks[subject.ordinal()] = mark;
    }

    public StudentRecord copy() {
        return toBuilder().marks(marks.clone()).build();
    }
}
