package dev.zzpscanner;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides one Testcontainers-managed PostgreSQL instance for the whole run. Flyway migrates it
 * when the first context starts. Tests do not clean up after themselves, so each one works on
 * rows it created (distinct locations, names or ids). Scheduled tasks are switched off so that a
 * cleanup never runs underneath a test.
 */
@SpringBootTest(properties = "scanner.schedule.enabled=false")
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }
}
