package com.example.records.repository;

import com.example.records.entities.StudentRecord;
import com.example.records.enums.ErrorKind;
import com.example.records.enums.Subject;
import com.example.records.exceptions.RecordsException;
import com.example.records.service.MarksCalculator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line format of the student file: {@code id|name|mark1|mark2|mark3}, marks with two decimals.
 *
 * Names are written as they are. A name containing {@code |} yields a line
 * that decodes to a different record; callers must keep the delimiter out of names.
 */
@Component
public class StudentLineCodec {

    public static final char DELIMITER = '|';

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public String encode(StudentRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(record.getId()).append(DELIMITER).append(record.getName());
        for (double mark : record.getMarks()) {
            sb.append(DELIMITER).append(String.format(Locale.ROOT, "%.2f", mark));
        }
        return sb.toString();
    }

    /**
     * Parses one line. A mark is read from its leading number, so {@code 42.5kg}
     * reads as 42.5 and a missing or non-numeric mark reads as 0.0. Derived
     * fields are always recalculated, whatever the line held.
     *
     * @throws RecordsException with {@link ErrorKind#MALFORMED_LINE} if the id
     *         or name is missing or the id is not an integer
     */
    public StudentRecord decode(String line) {
        if (line == null) {
            throw malformed("null line");
        }
        String trimmed = stripLineEnding(line);
        String[] fields = trimmed.split("\\" + DELIMITER, -1);
        if (fields.length < 2 || fields[1].isBlank()) {
            throw malformed("expected at least id and name: " + trimmed);
        }

        int id;
        try {
            id = Integer.parseInt(fields[0].trim());
        } catch (NumberFormatException ex) {
            throw malformed("id is not an integer: " + fields[0]);
        }

        double[] marks = new double[Subject.count()];
        for (int i = 0; i < marks.length; i++) {
            int idx = i + 2;
            marks[i] = idx < fields.length ? parseMark(fields[idx]) : 0.0;
        }

        StudentRecord record = StudentRecord.builder()
                .id(id)
                .name(fields[1])
                .marks(marks)
                .build();
        return MarksCalculator.recompute(record);
    }

    static double parseMark(String field) {
        Matcher m = LEADING_NUMBER.matcher(field.trim());
        return m.find() ? Double.parseDouble(m.group()) : 0.0;
    }

    private static String stripLineEnding(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static RecordsException malformed(String detail) {
        return new RecordsException(ErrorKind.MALFORMED_LINE, "Malformed student line, " + detail);
    }
}
