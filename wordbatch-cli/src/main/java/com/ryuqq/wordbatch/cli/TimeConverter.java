package com.ryuqq.wordbatch.cli;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * "yyyy-MM-dd HH:mm" 형식의 시각 변환.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class TimeConverter implements ITypeConverter<LocalDateTime> {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    @Override
    public LocalDateTime convert(String value) {
        try {
            return LocalDateTime.parse(value.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new TypeConversionException("Invalid time '" + value + "'. Expected format: 'YYYY-MM-DD HH:MM'");
        }
    }
}
