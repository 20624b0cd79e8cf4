package io.github.isoflow.dagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.isoflow.dao.DatasetDao;
import io.github.isoflow.dao.IsoImageDao;
import io.github.isoflow.dao.JobDao;
import io.github.isoflow.dao.OpticalImageDao;
import io.github.isoflow.dao.SumFormulaDao;
import io.github.isoflow.dao.TheorPeaksDao;
import io.github.isoflow.dbu.factory.JdbiFactory;
import io.github.isoflow.dbu.liquibase.LiquibaseHelper;
import io.github.isoflow.model.DatasetRow;
import io.github.isoflow.model.JobRecord;
import io.github.isoflow.model.OpticalTile;
import io.github.isoflow.model.SumFormula;
import io.github.isoflow.model.TheorPeakRow;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * Storage and serialization bindings.
 */
@Module
public class IsoflowModule {

  /**
   * The constant LIQUIBASE_SETUP_XML.
   */
  public static final String LIQUIBASE_SETUP_XML = "liquibase/liquibase-setup.xml";

  /**
   * Instantiates a new Isoflow module.
   */
  public IsoflowModule() {
    // Default constructor
  }

  /**
   * Jdbi with the schema migrated.
   *
   * @param factory         the factory
   * @param liquibaseHelper the liquibase helper
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final LiquibaseHelper liquibaseHelper) {
    final Jdbi jdbi = factory.createJdbi();
    liquibaseHelper.runLiquibase(jdbi, LIQUIBASE_SETUP_XML);
    return jdbi;
  }

  /**
   * Immutable classes mapped by jdbi.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(DatasetRow.class, JobRecord.class, OpticalTile.class, SumFormula.class, TheorPeakRow.class);
  }

  /**
   * Object mapper for JSON columns and queue messages.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return objectMapper;
  }

  @Provides
  @Singleton
  public DatasetDao datasetDao(final Jdbi jdbi) {
    return jdbi.onDemand(DatasetDao.class);
  }

  @Provides
  @Singleton
  public JobDao jobDao(final Jdbi jdbi) {
    return jdbi.onDemand(JobDao.class);
  }

  @Provides
  @Singleton
  public IsoImageDao isoImageDao(final Jdbi jdbi) {
    return jdbi.onDemand(IsoImageDao.class);
  }

  @Provides
  @Singleton
  public OpticalImageDao opticalImageDao(final Jdbi jdbi) {
    return jdbi.onDemand(OpticalImageDao.class);
  }

  @Provides
  @Singleton
  public SumFormulaDao sumFormulaDao(final Jdbi jdbi) {
    return jdbi.onDemand(SumFormulaDao.class);
  }

  @Provides
  @Singleton
  public TheorPeaksDao theorPeaksDao(final Jdbi jdbi) {
    return jdbi.onDemand(TheorPeaksDao.class);
  }
}
