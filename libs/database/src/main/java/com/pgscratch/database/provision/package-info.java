/**
 * Database provisioning.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.pgscratch.database.provision.EphemeralDatabaseProvisioner}: creates a database
 *       and returns a connection to it
 *   <li>{@link com.pgscratch.database.provision.ProvisionOptions}: schema sources, URL override
 *       and caller tag for one call
 *   <li>{@link com.pgscratch.database.provision.Fataler}: how failures reach the test framework
 * </ul>
 */
package com.pgscratch.database.provision;
