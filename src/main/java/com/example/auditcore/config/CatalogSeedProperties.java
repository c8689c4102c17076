package com.example.auditcore.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default roles and permissions created on startup (catalog.seed.*). Seeding is idempotent:
 * rows that already exist are left alone.
 */
@Component
@ConfigurationProperties(prefix = "catalog.seed")
@Data
public class CatalogSeedProperties {

    private boolean enabled = false;
    private String actor = "system";
    private List<SeedPermission> permissions = new ArrayList<>();
    private List<SeedRole> roles = new ArrayList<>();

    @Data
    public static class SeedPermission {
        private String name;
        private String description;
    }

    @Data
    public static class SeedRole {
        private String name;
        private String description;
        private List<String> permissions = new ArrayList<>();
    }
}
