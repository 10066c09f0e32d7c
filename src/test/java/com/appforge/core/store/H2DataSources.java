package com.appforge.core.store;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

final class H2DataSources {

    private H2DataSources() {}

    /** Fresh in-memory database per call. */
    static DataSource fresh() {
        var ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:appforge-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        return ds;
    }
}
