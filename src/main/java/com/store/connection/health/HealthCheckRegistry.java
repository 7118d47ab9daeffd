package com.store.connection.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks queried for the aggregate health of a store connection.
 *
 * <p>Aggregation: the worst individual status wins (DOWN over DEGRADED over UP); the
 * aggregate message names the check that produced it and each check's result is
 * reported as a detail under its name.</p>
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus worst = null;
        String worstName = null;

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                result = HealthStatus.down(check.getName() + " check failed: " + e.getMessage());
            }

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", result.status().name());
            entry.put("message", result.message());
            entry.put("details", result.details());
            results.put(check.getName(), entry);

            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worst.isUp() ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, results);
    }

    public int size() {
        return checks.size();
    }
}
