package com.dataanalysis.forecast;

import com.dataanalysis.exception.ColumnNotFoundException;
import com.dataanalysis.exception.InsufficientDataException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

@Component
public class SeriesExtractor {

    public static final int MIN_POINTS = 10;

    // plain decimal notation only; Java literal suffixes and hex are not numbers here
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public TimeSeries extract(List<Map<String, Object>> rows, String column) {
        if (rows == null || rows.stream().noneMatch(row -> row != null && row.containsKey(column))) {
            throw new ColumnNotFoundException(column);
        }
        double[] values = rows.stream()
            .filter(Objects::nonNull)
            .map(row -> toNumber(row.get(column)))
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .toArray();
        if (values.length < MIN_POINTS) {
            throw new InsufficientDataException(column, values.length, MIN_POINTS);
        }
        return new TimeSeries(values);
    }

    static Double toNumber(Object raw) {
        Double value = null;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            value = parse(((String) raw).trim());
        }
        return value != null && Double.isFinite(value) ? value : null;
    }

    private static Double parse(String text) {
        // non-numeric text is treated as a missing value
        return DECIMAL.matcher(text).matches() ? Double.valueOf(text) : null;
    }
}
