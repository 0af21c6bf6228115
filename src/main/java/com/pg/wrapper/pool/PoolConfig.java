package com.pg.wrapper.pool;

import com.pg.wrapper.db.ConnectionTarget;

/**
 * Configuration for {@link BoundedConnectionPool}.
 */
public class PoolConfig {

    public static final int DEFAULT_MAX_CONNECTIONS = 10;

    private final ConnectionTarget target;
    private final int maxConnections;
    private final int maxIdle;
    private final String name;

    private PoolConfig(Builder builder) {
        this.target = builder.target;
        this.maxConnections = builder.maxConnections;
        this.maxIdle = builder.maxIdle < 0 ? builder.maxConnections : builder.maxIdle;
        this.name = builder.name;
    }

    public ConnectionTarget getTarget() { return target; }
    public int getMaxConnections() { return maxConnections; }
    public int getMaxIdle() { return maxIdle; }
    public String getName() { return name; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConnectionTarget target;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        // -1: same as maxConnections
        private int maxIdle = -1;
        private String name = "pg-pool";

        public Builder target(ConnectionTarget target) {
            this.target = target;
            return this;
        }

        public Builder target(String connectionString) {
            this.target = ConnectionTarget.parse(connectionString);
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Caps the idle stack below {@code maxConnections}; returned connections beyond it are closed.
         */
        public Builder maxIdle(int maxIdle) {
            if (maxIdle < 0) throw new IllegalArgumentException("maxIdle must be >= 0");
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder name(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            this.name = name;
            return this;
        }

        public PoolConfig build() {
            if (target == null) {
                throw new IllegalArgumentException("connection target is required");
            }
            if (maxIdle > maxConnections) {
                throw new IllegalArgumentException("maxIdle cannot exceed maxConnections");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "name='" + name + '\'' +
                ", target=" + target +
                ", maxConnections=" + maxConnections +
                ", maxIdle=" + maxIdle +
                '}';
    }
}
