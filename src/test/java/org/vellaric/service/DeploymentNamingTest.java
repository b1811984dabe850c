package org.vellaric.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.vellaric.config.NetworkProperties;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentNamingTest {

    private DeploymentNaming naming;

    @BeforeEach
    void setUp() {
        NetworkProperties properties = new NetworkProperties();
        properties.getDomain().setBaseDomain("example.com");
        naming = new DeploymentNaming(properties);
    }

    @Test
    @DisplayName("production branches get the bare subdomain")
    void productionDomain() {
        assertEquals("api.example.com", naming.domain("api", "main"));
        assertEquals("api.example.com", naming.domain("api", "master"));
    }

    @Test
    void otherBranchesAreSuffixed() {
        assertEquals("api-dev.example.com", naming.domain("api", "dev"));
    }

    @Test
    @DisplayName("project names are slugged and branch slashes replaced")
    void containerAndImageNames() {
        assertEquals("my-shop-feature-login", naming.containerName("My  Shop", "feature/login"));
        assertEquals("my-shop:feature-login", naming.imageTag("My Shop", "feature/login"));
        assertEquals("my-shop-feature-login.example.com", naming.domain("My Shop", "feature/login"));
    }

    @Test
    void databaseNames() {
        String container = naming.databaseContainerName("Orders_DB", "production");

        assertEquals("orders-db-production-postgres", container);
        assertEquals("orders-db-production-postgres.db.example.com", naming.databaseHost(container));
    }
}
