/** Spring Boot configuration for ephemeral test databases. */
package com.pgscratch.database.config;
