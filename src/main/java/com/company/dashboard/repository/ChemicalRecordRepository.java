package com.company.dashboard.repository;

import com.company.dashboard.domain.ChemicalUsage;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.dashboard.util.NumericCoercion.readDouble;

/**
 * Chemical dosing records ("Rel_Quimico"), nine product fields Q1..Q9 in ml.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ChemicalRecordRepository {

    public static final String SOURCE = "chemicals";

    static final List<String> CHEMICAL_FIELDS = List.of("Q1", "Q2", "Q3", "Q4", "Q5", "Q6", "Q7", "Q8", "Q9");

    private static final String ROW_TOTAL = """
            COALESCE("Q1", 0) + COALESCE("Q2", 0) + COALESCE("Q3", 0)
            + COALESCE("Q4", 0) + COALESCE("Q5", 0) + COALESCE("Q6", 0)
            + COALESCE("Q7", 0) + COALESCE("Q8", 0) + COALESCE("Q9", 0)""";

    private final JdbcTemplate jdbcTemplate;

    public double sumTotal(TimeWindow window) {
        String sql = "SELECT COALESCE(SUM(" + ROW_TOTAL + "), 0) AS total_ml\n" + """
            FROM "Rel_Quimico"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """;

        try {
            Double total = jdbcTemplate.queryForObject(sql, (rs, rowNum) -> readDouble(rs, "total_ml"),
                    JdbcValues.start(window), JdbcValues.endExclusive(window));
            return total != null ? total : 0.0;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public Map<LocalDate, Double> sumByDay(TimeWindow window) {
        String sql = "SELECT CAST(\"Time_Stamp\" AS DATE) AS report_day,\n"
                + "COALESCE(SUM(" + ROW_TOTAL + "), 0) AS total_ml\n" + """
            FROM "Rel_Quimico"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            GROUP BY CAST("Time_Stamp" AS DATE)
            ORDER BY report_day
            """;

        try {
            Map<LocalDate, Double> result = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                result.put(JdbcValues.readDate(rs, "report_day"), readDouble(rs, "total_ml"));
            }, JdbcValues.start(window), JdbcValues.endExclusive(window));
            log.debug("Chemical totals for {} days in {}", result.size(), window);
            return result;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Window totals per chemical field, in field order Q1..Q9.
     */
    public List<ChemicalUsage> sumPerChemical(TimeWindow window) {
        String sql = """
            SELECT COALESCE(SUM("Q1"), 0) AS q1, COALESCE(SUM("Q2"), 0) AS q2, COALESCE(SUM("Q3"), 0) AS q3,
                   COALESCE(SUM("Q4"), 0) AS q4, COALESCE(SUM("Q5"), 0) AS q5, COALESCE(SUM("Q6"), 0) AS q6,
                   COALESCE(SUM("Q7"), 0) AS q7, COALESCE(SUM("Q8"), 0) AS q8, COALESCE(SUM("Q9"), 0) AS q9
            FROM "Rel_Quimico"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """;

        try {
            return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> {
                List<ChemicalUsage> usage = new ArrayList<>(CHEMICAL_FIELDS.size());
                for (String field : CHEMICAL_FIELDS) {
                    usage.add(new ChemicalUsage(field, readDouble(rs, field.toLowerCase())));
                }
                return usage;
            }, JdbcValues.start(window), JdbcValues.endExclusive(window));
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }
}
