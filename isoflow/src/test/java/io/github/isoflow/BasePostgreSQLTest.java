/*
 * Copyright (c) 2023. Ned Wolpert
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.isoflow;

import static io.github.isoflow.dagger.IsoflowModule.LIQUIBASE_SETUP_XML;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.isoflow.dagger.IsoflowModule;
import io.github.isoflow.dbu.factory.JdbiFactory;
import io.github.isoflow.dbu.liquibase.LiquibaseHelper;
import io.github.isoflow.dbu.model.ImmutableDatabase;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.model.ImmutableConfiguration;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base test class using Testcontainers PostgreSQL for integration tests.
 * This validates the queries against PostgreSQL (the production database).
 * Skipped when no Docker environment is available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class BasePostgreSQLTest {

  @Container
  protected static final PostgreSQLContainer<?> POSTGRES_CONTAINER =
      new PostgreSQLContainer<>("postgres:17-alpine")
          .withDatabaseName("isoflow_test")
          .withUsername("test")
          .withPassword("test")
          .withReuse(true);

  protected Jdbi jdbi;
  protected Configuration configuration;
  protected ObjectMapper objectMapper;

  @BeforeEach
  void setupPostgreSQL() {
    configuration = ImmutableConfiguration.builder()
        .database(
            ImmutableDatabase.builder()
                .url(POSTGRES_CONTAINER.getJdbcUrl())
                .username(POSTGRES_CONTAINER.getUsername())
                .password(POSTGRES_CONTAINER.getPassword())
                .build()
        ).build();
    final IsoflowModule module = new IsoflowModule();
    jdbi = new JdbiFactory(configuration.database(), module.immutableClasses()).createJdbi();
    new LiquibaseHelper().runLiquibase(jdbi, LIQUIBASE_SETUP_XML);
    objectMapper = module.objectMapper();
  }

  @AfterEach
  void cleanupPostgreSQL() {
    if (jdbi != null) {
      try {
        // Drop all tables to clean up for next test
        jdbi.withHandle(handle -> {
          handle.execute("DROP SCHEMA public CASCADE");
          handle.execute("CREATE SCHEMA public");
          return null;
        });
      } catch (Exception e) {
        // Ignore cleanup errors
      }
    }
  }
}
