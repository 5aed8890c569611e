/**
 * Database support for CityHive services.
 *
 * <p>Schema changes are plain SQL files under {@code db/migration}, applied by Flyway on startup
 * against the service's own {@link javax.sql.DataSource}. The tables use PostGIS for hive
 * locations, so the target database must have the {@code postgis} extension available.
 *
 * @see com.cityhive.database.migration.FlywayMigrationConfig
 * @see com.cityhive.database.health.JdbcRoundTripCheck
 */
package com.cityhive.database;
