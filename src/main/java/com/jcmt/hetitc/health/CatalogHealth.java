package com.jcmt.hetitc.health;

import com.jcmt.hetitc.catalog.StaticReceiverCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class CatalogHealth implements HealthIndicator {
    private final StaticReceiverCatalog catalog;

    public CatalogHealth(StaticReceiverCatalog catalog) { this.catalog = catalog; }

    @Override public Health health() {
        int receivers = catalog.getReceiverIds().size();
        int opacityTables = catalog.getOpacityReferences().size();
        boolean ok = receivers > 0 && opacityTables >= 2;

        return (ok ? Health.up() : Health.down())
                .withDetail("receivers", receivers)
                .withDetail("opacityTables", opacityTables)
                .build();
    }
}
