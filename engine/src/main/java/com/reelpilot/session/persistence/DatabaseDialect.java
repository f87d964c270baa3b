package com.reelpilot.session.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.Locale;

final class DatabaseDialect {
    private static final Logger log = LoggerFactory.getLogger(DatabaseDialect.class);

    private DatabaseDialect() {}

    static boolean isPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to H2 upserts", e);
            return false;
        }
    }
}
