package com.company.dashboard.repository;

import com.company.dashboard.domain.DailyProductionTotals;
import com.company.dashboard.domain.ProductionTotals;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.dashboard.util.NumericCoercion.readDouble;
import static com.company.dashboard.util.NumericCoercion.readLong;

/**
 * Consolidated daily records ("Rel_Diario"): C0 downtime minutes, C1 production minutes,
 * C2 water m3, C4 production kg, C5 client.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DailyReportRepository {

    public static final String SOURCE = "consolidated";

    private final JdbcTemplate jdbcTemplate;

    public ProductionTotals sumProduction(TimeWindow window, Integer clientId) {
        StringBuilder sql = new StringBuilder("""
            SELECT COUNT(*) AS records,
                   COUNT(CASE WHEN "C4" > 0 THEN 1 END) AS cycles,
                   COALESCE(SUM("C4"), 0) AS total_kg,
                   COALESCE(SUM("C1"), 0) AS production_minutes,
                   COALESCE(SUM("C0"), 0) AS downtime_minutes
            FROM "Rel_Diario"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """);

        List<Object> params = windowParams(window);
        if (clientId != null) {
            sql.append(" AND \"C5\" = ?");
            params.add(clientId);
        }

        try {
            return jdbcTemplate.queryForObject(sql.toString(), new ProductionTotalsRowMapper(), params.toArray());
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public List<DailyProductionTotals> sumProductionByDay(TimeWindow window) {
        String sql = """
            SELECT CAST("Time_Stamp" AS DATE) AS report_day,
                   COUNT(CASE WHEN "C4" > 0 THEN 1 END) AS cycles,
                   COALESCE(SUM("C4"), 0) AS total_kg,
                   COALESCE(SUM("C1"), 0) AS production_minutes,
                   COALESCE(SUM("C0"), 0) AS downtime_minutes
            FROM "Rel_Diario"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            GROUP BY CAST("Time_Stamp" AS DATE)
            ORDER BY report_day
            """;

        try {
            List<DailyProductionTotals> days = jdbcTemplate.query(sql, new DailyProductionRowMapper(),
                    windowParams(window).toArray());
            log.debug("Consolidated production for {} days in {}", days.size(), window);
            return days;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public double sumWater(TimeWindow window, Integer clientId) {
        StringBuilder sql = new StringBuilder("""
            SELECT COALESCE(SUM("C2"), 0) AS water_m3
            FROM "Rel_Diario"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """);

        List<Object> params = windowParams(window);
        if (clientId != null) {
            sql.append(" AND \"C5\" = ?");
            params.add(clientId);
        }

        try {
            Double water = jdbcTemplate.queryForObject(sql.toString(),
                    (rs, rowNum) -> readDouble(rs, "water_m3"), params.toArray());
            return water != null ? water : 0.0;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public Map<LocalDate, Double> sumWaterByDay(TimeWindow window) {
        String sql = """
            SELECT CAST("Time_Stamp" AS DATE) AS report_day,
                   COALESCE(SUM("C2"), 0) AS water_m3
            FROM "Rel_Diario"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            GROUP BY CAST("Time_Stamp" AS DATE)
            ORDER BY report_day
            """;

        try {
            Map<LocalDate, Double> result = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                result.put(JdbcValues.readDate(rs, "report_day"), readDouble(rs, "water_m3"));
            }, windowParams(window).toArray());
            return result;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    private static List<Object> windowParams(TimeWindow window) {
        List<Object> params = new ArrayList<>();
        params.add(JdbcValues.start(window));
        params.add(JdbcValues.endExclusive(window));
        return params;
    }

    private static class ProductionTotalsRowMapper implements RowMapper<ProductionTotals> {
        @Override
        public ProductionTotals mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ProductionTotals.builder()
                    .records(readLong(rs, "records"))
                    .cycles(readLong(rs, "cycles"))
                    .totalKg(readDouble(rs, "total_kg"))
                    .productionMinutes(readDouble(rs, "production_minutes"))
                    .downtimeMinutes(readDouble(rs, "downtime_minutes"))
                    .build();
        }
    }

    private static class DailyProductionRowMapper implements RowMapper<DailyProductionTotals> {
        @Override
        public DailyProductionTotals mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DailyProductionTotals.builder()
                    .day(JdbcValues.readDate(rs, "report_day"))
                    .cycles(readLong(rs, "cycles"))
                    .totalKg(readDouble(rs, "total_kg"))
                    .productionMinutes(readDouble(rs, "production_minutes"))
                    .downtimeMinutes(readDouble(rs, "downtime_minutes"))
                    .build();
        }
    }
}
