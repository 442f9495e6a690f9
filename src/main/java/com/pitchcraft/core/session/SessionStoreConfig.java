package com.pitchcraft.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the {@link SessionStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), sessions
 * are kept in a {@link JdbcSessionStore}. Otherwise an {@link InMemorySessionStore}
 * is used and sessions do not survive a restart.
 */
@Configuration
public class SessionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Bean
    public SessionStore sessionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC session store");
            var store = new JdbcSessionStore(ds);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory session store (sessions will not persist across restarts)");
        return new InMemorySessionStore();
    }
}
