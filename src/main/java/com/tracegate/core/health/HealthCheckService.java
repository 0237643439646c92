package com.tracegate.core.health;

import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final EntityGraphStore store;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) EntityGraphStore store,
            @Autowired(required = false) DataSource dataSource) {
        this.store = store;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkDatabase());
        return results;
    }

    public boolean allUp(List<HealthStatus> statuses) {
        return statuses.stream().noneMatch(HealthStatus::isDown);
    }

    private HealthStatus checkStore() {
        if (store == null) {
            return HealthStatus.down("store", "No EntityGraphStore configured", Map.of());
        }
        String impl = store.getClass().getSimpleName();
        try {
            store.findPlan("__health__");
            return HealthStatus.up("store", "Entity graph store readable", Map.of("implementation", impl));
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Store error: " + e.getMessage(), Map.of("implementation", impl));
        }
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.degraded("database", "No DataSource configured (in-memory store)");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage(), Map.of());
        }
    }
}
