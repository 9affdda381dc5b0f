package com.ryuqq.wordbatch.cli;

import com.ryuqq.wordbatch.core.model.RowRange;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * "start-end" 형식의 행 구간 변환.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class RowRangeConverter implements ITypeConverter<RowRange> {

    @Override
    public RowRange convert(String value) {
        try {
            return RowRange.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
