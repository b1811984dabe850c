package org.vellaric.provider;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PostgreSQL 引擎
 */
@Component
public class PostgresDatabaseEngine implements DatabaseEngine {
    
    @Override
    public String getEngineType() {
        return "postgres";
    }
    
    @Override
    public String getImage(String version) {
        return "postgres:" + version;
    }
    
    @Override
    public int getContainerPort() {
        return 5432;
    }
    
    @Override
    public String getDataMountPath() {
        return "/var/lib/postgresql";
    }
    
    @Override
    public Map<String, String> getContainerEnvironment(String username, String password, String database) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("POSTGRES_USER", username);
        env.put("POSTGRES_PASSWORD", password);
        env.put("POSTGRES_DB", database);
        return env;
    }
    
    @Override
    public String[] getReadinessCommand(String username) {
        return new String[] {"pg_isready", "-U", username};
    }
    
    @Override
    public boolean isReady(String readinessOutput) {
        return readinessOutput != null && readinessOutput.contains("accepting connections");
    }
    
    @Override
    public String[] getSizeQuery(String username, String database) {
        return psql(username, database, "SELECT pg_size_pretty(pg_database_size(current_database()))");
    }
    
    @Override
    public String[] getActiveConnectionsQuery(String username, String database) {
        return psql(username, database, "SELECT count(*) FROM pg_stat_activity WHERE state = 'active'");
    }
    
    private String[] psql(String username, String database, String sql) {
        return new String[] {"psql", "-U", username, "-d", database, "-t", "-c", sql};
    }
    
    @Override
    public String buildConnectionString(String username, String password, String host, int port,
                                        String database, String sslMode) {
        return String.format("postgresql://%s:%s@%s:%d/%s?sslmode=%s", username, password, host, port, database, sslMode);
    }
}
