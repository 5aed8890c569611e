/**
 * Flyway migration configuration.
 *
 * <ul>
 *   <li>{@link com.cityhive.database.migration.FlywayConfigProperties}: externalized settings
 *   <li>{@link com.cityhive.database.migration.FlywayMigrationConfig}: Spring
 *       {@code @Configuration} that migrates the application database on startup
 * </ul>
 */
package com.cityhive.database.migration;
