package com.ryuqq.wordbatch.core.model;

/**
 * 어휘 목록의 행 구간 [start, end).
 *
 * @param start 시작 행 (포함)
 * @param end 끝 행 (제외)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record RowRange(int start, int end) {

    public RowRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative (current: " + start + ")");
        }
        if (end < start) {
            throw new IllegalArgumentException(
                "end must be >= start (start: " + start + ", end: " + end + ")"
            );
        }
    }

    /**
     * "start-end" 형식 문자열 파싱.
     *
     * @param text 예: "0-100"
     * @return RowRange
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static RowRange parse(String text) {
        if (text == null || !text.contains("-")) {
            throw new IllegalArgumentException("Invalid range format: " + text + ". Use format: start-end");
        }
        String[] parts = text.split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid range format: " + text + ". Use format: start-end");
        }
        try {
            return new RowRange(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid range format: " + text + ". Use format: start-end", e);
        }
    }

    public int size() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
