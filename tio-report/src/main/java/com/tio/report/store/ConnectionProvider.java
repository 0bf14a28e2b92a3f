package com.tio.report.store;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of JDBC connections for the report store and its schema bootstrapper. */
@FunctionalInterface
public interface ConnectionProvider {
    Connection getConnection() throws SQLException;
}
