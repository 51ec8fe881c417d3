package com.hybridorm.persistence;

import com.hybridorm.core.EventSink;
import com.hybridorm.core.RemoteResource;
import com.hybridorm.core.config.PersistenceConfig;
import com.hybridorm.remote.http.HttpRemoteResource;
import com.hybridorm.repos.sqlite.SQLiteLocalStore;
import com.hybridorm.repos.sqlite.SQLiteStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link PersistenceCoordinator} from configuration: a SQLite local store and, when
 * a base URL is configured, an HTTP remote resource.
 */
public class PersistenceFactory implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceFactory.class);

    private final SQLiteStoreFactory stores = new SQLiteStoreFactory();

    public PersistenceCoordinator create(PersistenceConfig config) {
        return create(config, EventSink.NONE);
    }

    public PersistenceCoordinator create(PersistenceConfig config, EventSink events) {
        SQLiteLocalStore local = stores.create(config.database());
        RemoteResource remote = null;
        if (config.network().enabled()) {
            remote = new HttpRemoteResource(config.network());
            logger.info("Remote resources at {}", config.network().baseUrl());
        } else {
            logger.info("No remote base URL configured, running local only");
        }
        return new PersistenceCoordinator(local, remote, events);
    }

    /**
     * Closes the local stores opened by this factory.
     */
    @Override
    public void close() {
        stores.close();
    }
}
