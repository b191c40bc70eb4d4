/**
 * Ephemeral PostgreSQL databases for test suites.
 *
 * <p>Every test gets a freshly created, uniquely named database, optionally populated from a
 * schema file or a directory of migrations. Nobody drops these databases explicitly: each new
 * provisioning call first garbage collects a bounded number of databases older than the
 * retention window, so a shared server stays bounded without a scheduled job.
 *
 * <ul>
 *   <li>{@link com.pgscratch.database.naming}: time-sortable unique names
 *   <li>{@link com.pgscratch.database.schema}: schema file and migration resolution
 *   <li>{@link com.pgscratch.database.gc}: the opportunistic garbage collector
 *   <li>{@link com.pgscratch.database.provision}: the provisioner tying them together
 *   <li>{@link com.pgscratch.database.config}: Spring Boot wiring
 *   <li>{@link com.pgscratch.database.testing}: JUnit 5 integration
 * </ul>
 *
 * @see com.pgscratch.database.provision.EphemeralDatabaseProvisioner
 */
package com.pgscratch.database;
