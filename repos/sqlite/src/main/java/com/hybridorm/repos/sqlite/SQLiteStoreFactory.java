package com.hybridorm.repos.sqlite;

import com.hybridorm.core.StoreException;
import com.hybridorm.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.io.File;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Opens {@link SQLiteLocalStore}s, sharing one data source per database file.
 */
public class SQLiteStoreFactory implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SQLiteStoreFactory.class);

    private final Map<String, SQLiteDataSource> dataSources = new ConcurrentHashMap<>();
    private final List<SQLiteLocalStore> opened = new CopyOnWriteArrayList<>();

    /**
     * @throws IllegalArgumentException when the configured driver is not sqlite
     * @throws StoreException           when the connection cannot be opened
     */
    public SQLiteLocalStore create(DatabaseConfig config) {
        if (!DatabaseConfig.DEFAULT_DRIVER.equalsIgnoreCase(config.driver())) {
            throw new IllegalArgumentException("Unsupported database driver: " + config.driver());
        }
        SQLiteDataSource dataSource = dataSources.computeIfAbsent(config.database(), SQLiteStoreFactory::buildDataSource);
        try {
            SQLiteLocalStore store = new SQLiteLocalStore(dataSource.getConnection());
            opened.add(store);
            logger.info("Opened SQLite database {}", config.database());
            return store;
        } catch (SQLException e) {
            throw new StoreException("Could not open SQLite database " + config.database(), e);
        }
    }

    public SQLiteLocalStore create(String database) {
        return create(new DatabaseConfig(DatabaseConfig.DEFAULT_DRIVER, database));
    }

    /**
     * Closes every store this factory opened.
     */
    public void close() {
        for (SQLiteLocalStore store : opened) {
            try {
                store.close();
            } catch (StoreException e) {
                logger.error("Failed to close SQLite store", e);
            }
        }
        opened.clear();
    }

    /**
     * Closes every store this factory opened and deletes their database files.
     */
    public void cleanUp() {
        close();
        dataSources.keySet().forEach(database -> {
            if (!database.startsWith(DatabaseConfig.IN_MEMORY)) {
                File file = new File(database);
                if (file.exists() && !file.delete()) {
                    logger.warn("Could not delete SQLite database {}", database);
                }
            }
        });
        dataSources.clear();
    }

    private static SQLiteDataSource buildDataSource(String database) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + database);
        return dataSource;
    }
}
