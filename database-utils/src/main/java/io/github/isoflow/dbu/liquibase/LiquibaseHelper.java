package io.github.isoflow.dbu.liquibase;

import javax.inject.Inject;
import javax.inject.Singleton;
import liquibase.Contexts;
import liquibase.LabelExpression;
import liquibase.Liquibase;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.LiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a liquibase changelog from the classpath.
 */
@Singleton
public class LiquibaseHelper {

  private static final Logger log = LoggerFactory.getLogger(LiquibaseHelper.class);

  /**
   * Instantiates a new Liquibase helper.
   */
  @Inject
  public LiquibaseHelper() {
    // Default constructor
  }

  /**
   * Run liquibase.
   *
   * @param jdbi      the jdbi
   * @param changeLog the classpath location of the change log
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLog) {
    log.info("runLiquibase({})", changeLog);
    jdbi.useHandle(handle -> {
      try {
        final Database database = DatabaseFactory.getInstance()
            .findCorrectDatabaseImplementation(new JdbcConnection(handle.getConnection()));
        final Liquibase liquibase = new Liquibase(changeLog, new ClassLoaderResourceAccessor(), database);
        liquibase.update(new Contexts(), new LabelExpression());
        // Jdbi refuses to close a handle with an open transaction.
        if (handle.isInTransaction()) {
          handle.commit();
        }
      } catch (LiquibaseException e) {
        throw new IllegalStateException("Unable to apply " + changeLog, e);
      }
    });
  }

}
