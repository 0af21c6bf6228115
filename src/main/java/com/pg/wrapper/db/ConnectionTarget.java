package com.pg.wrapper.db;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable description of where and as whom to open a PostgreSQL session.
 *
 * <p>Accepted string forms for {@link #parse(String)}:</p>
 * <ul>
 *   <li>{@code jdbc:postgresql://host:port/dbname?user=u&password=p}</li>
 *   <li>{@code postgresql://u:p@host:port/dbname} (also {@code postgres://})</li>
 *   <li>{@code host=localhost port=5432 dbname=app user=u password='p w'} (libpq keyword/value)</li>
 * </ul>
 */
public final class ConnectionTarget {

    public static final int DEFAULT_PORT = 5432;

    private static final String JDBC_PREFIX = "jdbc:postgresql://";
    private static final String URI_PREFIX = "postgresql://";
    private static final String SHORT_URI_PREFIX = "postgres://";

    // libpq keyword -> PgJDBC property name
    private static final Map<String, String> KEYWORD_PROPERTIES = Map.of(
            "connect_timeout", "connectTimeout",
            "application_name", "ApplicationName",
            "sslmode", "sslmode",
            "options", "options",
            "target_session_attrs", "targetServerType"
    );

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;
    private final Map<String, String> properties;

    private ConnectionTarget(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.user = builder.user;
        this.password = builder.password;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    /**
     * Creates a target from individual connection parameters.
     */
    public static ConnectionTarget of(String host, int port, String database, String user, String password) {
        return builder()
                .host(host)
                .port(port)
                .database(database)
                .user(user)
                .password(password)
                .build();
    }

    /**
     * Parses a connection string in any of the supported forms.
     *
     * @throws IllegalArgumentException if the string is blank or malformed
     */
    public static ConnectionTarget parse(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string must not be null or blank");
        }
        String s = connectionString.trim();
        if (s.startsWith(JDBC_PREFIX)) {
            return parseUrl(s.substring(JDBC_PREFIX.length()), false);
        }
        if (s.startsWith(URI_PREFIX)) {
            return parseUrl(s.substring(URI_PREFIX.length()), true);
        }
        if (s.startsWith(SHORT_URI_PREFIX)) {
            return parseUrl(s.substring(SHORT_URI_PREFIX.length()), true);
        }
        if (s.contains("=")) {
            return parseKeywordValue(s);
        }
        throw new IllegalArgumentException("Unrecognised connection string format");
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public Map<String, String> getProperties() { return properties; }

    /**
     * Renders the JDBC URL. Credentials are not part of the URL; see {@link #toProperties()}.
     */
    public String toJdbcUrl() {
        return JDBC_PREFIX + host + ":" + port + "/" + (database != null ? database : "");
    }

    /**
     * Driver properties: credentials plus any extra settings.
     */
    public Properties toProperties() {
        Properties props = new Properties();
        props.putAll(properties);
        if (user != null) {
            props.setProperty("user", user);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        return props;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = DEFAULT_PORT;
        private String database;
        private String user;
        private String password;
        private final Map<String, String> properties = new LinkedHashMap<>();

        public Builder host(String host) {
            if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(key, value);
            return this;
        }

        public ConnectionTarget build() {
            return new ConnectionTarget(this);
        }
    }

    private static ConnectionTarget parseUrl(String rest, boolean allowUserInfo) {
        Builder builder = builder();

        String query = null;
        int q = rest.indexOf('?');
        if (q >= 0) {
            query = rest.substring(q + 1);
            rest = rest.substring(0, q);
        }

        String authority = rest;
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            authority = rest.substring(0, slash);
            String db = rest.substring(slash + 1);
            if (!db.isEmpty()) {
                builder.database(decode(db));
            }
        }

        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            if (!allowUserInfo) {
                throw new IllegalArgumentException("JDBC URL must not carry user info; use the user/password parameters");
            }
            String userInfo = authority.substring(0, at);
            authority = authority.substring(at + 1);
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                builder.user(decode(userInfo.substring(0, colon)));
                builder.password(decode(userInfo.substring(colon + 1)));
            } else {
                builder.user(decode(userInfo));
            }
        }

        applyHostPort(builder, authority);

        if (query != null && !query.isEmpty()) {
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq >= 0 ? pair.substring(0, eq) : pair);
                String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
                applyKeyword(builder, key, value);
            }
        }
        return builder.build();
    }

    private static void applyHostPort(Builder builder, String authority) {
        if (authority.isEmpty()) {
            return;
        }
        if (authority.contains(",")) {
            throw new IllegalArgumentException("Multi-host connection strings are not supported");
        }
        int colon = authority.lastIndexOf(':');
        if (colon >= 0 && authority.indexOf(']') < colon) {
            String portText = authority.substring(colon + 1);
            authority = authority.substring(0, colon);
            if (!portText.isEmpty()) {
                builder.port(parsePort(portText));
            }
        }
        if (!authority.isEmpty()) {
            builder.host(authority);
        }
    }

    private static ConnectionTarget parseKeywordValue(String s) {
        Builder builder = builder();
        int i = 0;
        int n = s.length();
        while (i < n) {
            while (i < n && Character.isWhitespace(s.charAt(i))) i++;
            if (i >= n) break;

            int keyStart = i;
            while (i < n && s.charAt(i) != '=' && !Character.isWhitespace(s.charAt(i))) i++;
            String key = s.substring(keyStart, i);
            while (i < n && Character.isWhitespace(s.charAt(i))) i++;
            if (i >= n || s.charAt(i) != '=') {
                throw new IllegalArgumentException("Missing '=' after keyword '" + key + "'");
            }
            i++;
            while (i < n && Character.isWhitespace(s.charAt(i))) i++;

            StringBuilder value = new StringBuilder();
            if (i < n && s.charAt(i) == '\'') {
                i++;
                boolean terminated = false;
                while (i < n) {
                    char c = s.charAt(i++);
                    if (c == '\\' && i < n) {
                        value.append(s.charAt(i++));
                    } else if (c == '\'') {
                        terminated = true;
                        break;
                    } else {
                        value.append(c);
                    }
                }
                if (!terminated) {
                    throw new IllegalArgumentException("Unterminated quoted value for keyword '" + key + "'");
                }
            } else {
                while (i < n && !Character.isWhitespace(s.charAt(i))) {
                    char c = s.charAt(i++);
                    if (c == '\\' && i < n) {
                        value.append(s.charAt(i++));
                    } else {
                        value.append(c);
                    }
                }
            }
            applyKeyword(builder, key, value.toString());
        }
        return builder.build();
    }

    private static void applyKeyword(Builder builder, String key, String value) {
        switch (key) {
            case "host":
            case "hostaddr":
                applyHostPort(builder, value);
                break;
            case "port":
                builder.port(parsePort(value));
                break;
            case "dbname":
                builder.database(value);
                break;
            case "user":
                builder.user(value);
                break;
            case "password":
                builder.password(value);
                break;
            default:
                builder.property(KEYWORD_PROPERTIES.getOrDefault(key, key), value);
        }
    }

    private static int parsePort(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: '" + text + "'", e);
        }
    }

    // percent escapes only; '+' is literal in URI components
    private static String decode(String s) {
        return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionTarget)) return false;
        ConnectionTarget that = (ConnectionTarget) o;
        return port == that.port
                && host.equals(that.host)
                && Objects.equals(database, that.database)
                && Objects.equals(user, that.user)
                && Objects.equals(password, that.password)
                && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, database, user, password, properties);
    }

    @Override
    public String toString() {
        return "ConnectionTarget{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", user='" + user + '\'' +
                ", password=" + (password != null ? "'****'" : "null") +
                ", properties=" + properties.keySet() +
                '}';
    }
}
