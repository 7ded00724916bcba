package com.company.dashboard.repository;

import com.company.dashboard.domain.ClientLoadTotals;
import com.company.dashboard.domain.LoadTotals;
import com.company.dashboard.domain.ProgramLoadTotals;
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
import static com.company.dashboard.util.NumericCoercion.readInt;
import static com.company.dashboard.util.NumericCoercion.readLong;

/**
 * Per-load ledger ("Rel_Carga"): C0 program, C1 client, C2 load kg, C3 load water m3.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LoadRecordRepository {

    public static final String SOURCE = "loads";

    private final JdbcTemplate jdbcTemplate;

    public LoadTotals sumTotals(TimeWindow window, Integer clientId) {
        StringBuilder sql = new StringBuilder("""
            SELECT COUNT(*) AS loads,
                   COUNT(CASE WHEN "C2" > 0 THEN 1 END) AS productive_loads,
                   COALESCE(SUM("C2"), 0) AS total_kg,
                   COALESCE(SUM(CASE WHEN "C2" > 0 THEN "C2" ELSE 0 END), 0) AS productive_kg,
                   COALESCE(SUM("C3"), 0) AS water_m3
            FROM "Rel_Carga"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """);

        List<Object> params = new ArrayList<>();
        params.add(JdbcValues.start(window));
        params.add(JdbcValues.endExclusive(window));
        if (clientId != null) {
            sql.append(" AND \"C1\" = ?");
            params.add(clientId);
        }

        try {
            return jdbcTemplate.queryForObject(sql.toString(), new LoadTotalsRowMapper(), params.toArray());
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Water of loads that actually carried laundry (kg &gt; 0 and water &gt; 0).
     */
    public double sumProductiveWater(TimeWindow window) {
        String sql = """
            SELECT COALESCE(SUM("C3"), 0) AS water_m3
            FROM "Rel_Carga"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            AND "C2" > 0 AND "C3" > 0
            """;

        try {
            Double water = jdbcTemplate.queryForObject(sql, (rs, rowNum) -> readDouble(rs, "water_m3"),
                    JdbcValues.start(window), JdbcValues.endExclusive(window));
            return water != null ? water : 0.0;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public List<ClientLoadTotals> sumByClient(TimeWindow window) {
        String sql = """
            SELECT "C1" AS client_id,
                   COUNT(*) AS loads,
                   COALESCE(SUM("C2"), 0) AS total_kg,
                   COALESCE(SUM("C3"), 0) AS water_m3
            FROM "Rel_Carga"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            AND "C1" IS NOT NULL
            GROUP BY "C1"
            ORDER BY total_kg DESC, client_id
            """;

        try {
            return jdbcTemplate.query(sql, new ClientLoadTotalsRowMapper(),
                    JdbcValues.start(window), JdbcValues.endExclusive(window));
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Loads grouped by wash program, named from "programas" where registered.
     */
    public List<ProgramLoadTotals> sumByProgram(TimeWindow window, Integer clientId) {
        StringBuilder sql = new StringBuilder("""
            SELECT rc."C0" AS program_id,
                   p.program_name AS program_name,
                   COUNT(*) AS loads,
                   COALESCE(SUM(rc."C2"), 0) AS total_kg,
                   COALESCE(AVG(rc."C2"), 0) AS avg_kg
            FROM "Rel_Carga" rc
            LEFT JOIN "programas" p ON rc."C0" = p.program_id
            WHERE rc."Time_Stamp" >= ? AND rc."Time_Stamp" < ?
            AND rc."C0" IS NOT NULL
            """);

        List<Object> params = new ArrayList<>();
        params.add(JdbcValues.start(window));
        params.add(JdbcValues.endExclusive(window));
        if (clientId != null) {
            sql.append(" AND rc.\"C1\" = ?");
            params.add(clientId);
        }
        sql.append("""

            GROUP BY rc."C0", p.program_name
            ORDER BY total_kg DESC, program_id
            """);

        try {
            List<ProgramLoadTotals> rows = jdbcTemplate.query(sql.toString(), new ProgramLoadTotalsRowMapper(),
                    params.toArray());
            log.debug("{} programs with loads in {} (client={})", rows.size(), window, clientId);
            return rows;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public Map<LocalDate, Long> countByDay(TimeWindow window) {
        String sql = """
            SELECT CAST("Time_Stamp" AS DATE) AS report_day, COUNT(*) AS loads
            FROM "Rel_Carga"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            GROUP BY CAST("Time_Stamp" AS DATE)
            ORDER BY report_day
            """;

        try {
            Map<LocalDate, Long> result = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                result.put(JdbcValues.readDate(rs, "report_day"), readLong(rs, "loads"));
            }, JdbcValues.start(window), JdbcValues.endExclusive(window));
            return result;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    private static class LoadTotalsRowMapper implements RowMapper<LoadTotals> {
        @Override
        public LoadTotals mapRow(ResultSet rs, int rowNum) throws SQLException {
            return LoadTotals.builder()
                    .loads(readLong(rs, "loads"))
                    .productiveLoads(readLong(rs, "productive_loads"))
                    .totalKg(readDouble(rs, "total_kg"))
                    .productiveKg(readDouble(rs, "productive_kg"))
                    .waterM3(readDouble(rs, "water_m3"))
                    .build();
        }
    }

    private static class ClientLoadTotalsRowMapper implements RowMapper<ClientLoadTotals> {
        @Override
        public ClientLoadTotals mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ClientLoadTotals.builder()
                    .clientId(readInt(rs, "client_id"))
                    .loads(readLong(rs, "loads"))
                    .totalKg(readDouble(rs, "total_kg"))
                    .waterM3(readDouble(rs, "water_m3"))
                    .build();
        }
    }

    private static class ProgramLoadTotalsRowMapper implements RowMapper<ProgramLoadTotals> {
        @Override
        public ProgramLoadTotals mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ProgramLoadTotals.builder()
                    .programId(readInt(rs, "program_id"))
                    .programName(rs.getString("program_name"))
                    .loads(readLong(rs, "loads"))
                    .totalKg(readDouble(rs, "total_kg"))
                    .avgKg(readDouble(rs, "avg_kg"))
                    .build();
        }
    }
}
