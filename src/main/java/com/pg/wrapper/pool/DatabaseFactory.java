package com.pg.wrapper.pool;

import com.pg.wrapper.db.ConnectionTarget;
import com.pg.wrapper.db.Database;
import com.pg.wrapper.db.PostgresDatabase;

/**
 * Opens new sessions on behalf of a pool.
 */
@FunctionalInterface
public interface DatabaseFactory {

    /**
     * Opens a new session to {@code target}.
     *
     * @throws com.pg.wrapper.db.ConnectionException if the session cannot be established
     */
    Database open(ConnectionTarget target);

    static DatabaseFactory postgres() {
        return PostgresDatabase::new;
    }
}
