package com.dataanalysis.forecast;

import com.dataanalysis.exception.ColumnNotFoundException;
import com.dataanalysis.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SeriesExtractorTest {

    private final SeriesExtractor extractor = new SeriesExtractor();

    @Test
    void extract_coercesAndCompactsValues() {
        List<Map<String, Object>> rows = new ArrayList<>();
        Object[] raw = {1, "2.5", null, "abc", 4L, true, " 6 ", "NaN", 7.0, "", 8, "1f", "2d", 9, "4D",
                        "0x5p0", 10, "1e1", 11, "Infinity", "-.5"};
        for (Object value : raw) {
            Map<String, Object> row = new HashMap<>();
            row.put("sales", value);
            rows.add(row);
        }

        TimeSeries series = extractor.extract(rows, "sales");

        assertThat(series.toArray()).containsExactly(1.0, 2.5, 4.0, 6.0, 7.0, 8.0, 9.0, 10.0, 10.0, 11.0, -0.5);
    }

    @Test
    void extract_javaLiteralSuffixesAndHex_countAsMissing() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String value : new String[] {"1f", "2d", "3F", "4D", "0x5p0", "6f", "7d", "8f", "9d", "10f"}) {
            rows.add(Map.of("sales", value));
        }

        assertThatThrownBy(() -> extractor.extract(rows, "sales"))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("has 0");
    }

    @Test
    void extract_columnPresentInSomeRowsOnly_isAccepted() {
        List<Map<String, Object>> rows = new ArrayList<>(SeriesFixtures.rows("sales", SeriesFixtures.line(10, 1, 0)));
        rows.add(0, Map.of("other", 3));

        assertThat(extractor.extract(rows, "sales").size()).isEqualTo(10);
    }

    @Test
    void extract_missingColumn_throwsColumnNotFound() {
        List<Map<String, Object>> rows = SeriesFixtures.rows("sales", SeriesFixtures.line(12, 1, 0));

        assertThatThrownBy(() -> extractor.extract(rows, "revenue"))
            .isInstanceOf(ColumnNotFoundException.class)
            .hasMessageContaining("revenue");
    }

    @Test
    void extract_nullRows_throwsColumnNotFound() {
        assertThatThrownBy(() -> extractor.extract(null, "sales"))
            .isInstanceOf(ColumnNotFoundException.class);
    }

    @Test
    void extract_fewerThanTenNumericValues_throwsInsufficientData() {
        List<Map<String, Object>> rows = new ArrayList<>(SeriesFixtures.rows("sales", SeriesFixtures.line(9, 1, 0)));
        Map<String, Object> blank = new HashMap<>();
        blank.put("sales", "n/a");
        rows.add(blank);

        assertThatThrownBy(() -> extractor.extract(rows, "sales"))
            .isInstanceOf(InsufficientDataException.class)
            .extracting("errorCode").isEqualTo("INSUFFICIENT_DATA");
    }
}
