package com.tio.report.store;

import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import com.tio.report.PluginReport;
import com.tio.report.ReportStatus;
import com.tio.report.ReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC implementation of {@link ReportStore}. Persists to table tio_plugin_report; see
 * {@link com.tio.report.schema.ReportSchemaBootstrapper} for the schema.
 * <p>
 * Write failures are logged and swallowed: a report that cannot be stored never fails the plugin task.
 * Read failures propagate as {@link ReportStoreException}.
 */
public final class JdbcReportStore implements ReportStore {

    private static final String TABLE = "tio_plugin_report";
    private static final String COLUMNS =
            "job_id, plugin_kind, plugin_name, status, report_json, errors_json, task_id, start_time, end_time";
    private static final Logger log = LoggerFactory.getLogger(JdbcReportStore.class);

    private final ConnectionProvider connections;

    public JdbcReportStore(ConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    @Override
    public void save(PluginReport report) {
        String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?) "
                + "ON CONFLICT (job_id, plugin_name) DO UPDATE SET status=EXCLUDED.status, "
                + "report_json=EXCLUDED.report_json, errors_json=EXCLUDED.errors_json, task_id=EXCLUDED.task_id, "
                + "start_time=EXCLUDED.start_time, end_time=EXCLUDED.end_time";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, ReportSqlUtils.toUuid(report.getJobId()));
            ps.setString(2, report.getPlugin().getKind().name());
            ps.setString(3, report.getPlugin().getName());
            ps.setString(4, report.getStatus().name());
            ps.setObject(5, ReportSqlUtils.toJsonb(ReportSqlUtils.writeJson(report.getReport())));
            ps.setObject(6, ReportSqlUtils.toJsonb(ReportSqlUtils.writeJson(report.getErrors())));
            ps.setString(7, report.getTaskId());
            ps.setTimestamp(8, ReportSqlUtils.toTimestamp(report.getStartTime()));
            ps.setTimestamp(9, ReportSqlUtils.toTimestamp(report.getEndTime()));
            ps.executeUpdate();
            log.info("Report saved | {} | jobId={} plugin={} status={}", TABLE, report.getJobId(),
                    report.getPlugin(), report.getStatus());
        } catch (SQLException e) {
            log.error("Report save failed | jobId={} plugin={} status={} error={} SQLState={}", report.getJobId(),
                    report.getPlugin(), report.getStatus(), e.getMessage(), e.getSQLState(), e);
        }
    }

    @Override
    public Optional<PluginReport> find(String jobId, String pluginName) {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE job_id=? AND plugin_name=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, ReportSqlUtils.toUuid(jobId));
            ps.setString(2, pluginName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(jobId, rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ReportStoreException("Report lookup failed for job " + jobId + ", plugin " + pluginName, e);
        }
    }

    @Override
    public List<PluginReport> forJob(String jobId) {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE job_id=? ORDER BY created_at";
        List<PluginReport> out = new ArrayList<>();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, ReportSqlUtils.toUuid(jobId));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(jobId, rs));
                }
            }
        } catch (SQLException e) {
            throw new ReportStoreException("Report listing failed for job " + jobId, e);
        }
        return out;
    }

    private static PluginReport read(String jobId, ResultSet rs) throws SQLException {
        PluginRef plugin = PluginRef.of(PluginKind.fromString(rs.getString("plugin_kind")), rs.getString("plugin_name"));
        return PluginReport.builder(jobId, plugin)
                .status(ReportStatus.valueOf(rs.getString("status")))
                .report(ReportSqlUtils.readReport(rs.getString("report_json")))
                .errors(ReportSqlUtils.readErrors(rs.getString("errors_json")))
                .taskId(rs.getString("task_id"))
                .startTime(ReportSqlUtils.toInstant(rs.getTimestamp("start_time")))
                .endTime(ReportSqlUtils.toInstant(rs.getTimestamp("end_time")))
                .build();
    }
}
