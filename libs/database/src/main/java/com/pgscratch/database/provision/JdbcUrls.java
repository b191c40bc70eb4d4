package com.pgscratch.database.provision;

import com.pgscratch.database.ProvisioningException;
import com.pgscratch.database.naming.DatabaseName;

/**
 * Rewrites PostgreSQL JDBC URLs to point at another database on the same server.
 */
final class JdbcUrls {

    static final String JDBC_PREFIX = "jdbc:postgresql:";

    private JdbcUrls() {
        // Utility class, no instantiation
    }

    /**
     * Replaces the database of {@code adminUrl} with {@code name}, keeping hosts, ports and query.
     * <p>
     * Handles {@code jdbc:postgresql://host[:port][,host[:port]...]/[db][?query]} and the
     * host-less {@code jdbc:postgresql:db[?query]} form.
     *
     * @throws ProvisioningException of kind {@link ProvisioningException.Kind#CONFIGURATION} for
     *                               anything else
     */
    static String withDatabase(String adminUrl, DatabaseName name) {
        if (adminUrl == null || !adminUrl.startsWith(JDBC_PREFIX)) {
            throw malformed(adminUrl);
        }
        String rest = adminUrl.substring(JDBC_PREFIX.length());
        int q = rest.indexOf('?');
        String query = q >= 0 ? rest.substring(q) : "";
        String beforeQuery = q >= 0 ? rest.substring(0, q) : rest;

        if (!beforeQuery.startsWith("//")) {
            if (beforeQuery.contains("/")) {
                throw malformed(adminUrl);
            }
            return JDBC_PREFIX + name.value() + query;
        }

        String hostPart = beforeQuery.substring(2);
        int slash = hostPart.indexOf('/');
        String authority = slash >= 0 ? hostPart.substring(0, slash) : hostPart;
        if (authority.isEmpty() && slash < 0) {
            throw malformed(adminUrl);
        }
        return JDBC_PREFIX + "//" + authority + "/" + name.value() + query;
    }

    private static ProvisioningException malformed(String url) {
        return new ProvisioningException(
                ProvisioningException.Kind.CONFIGURATION, "Not a PostgreSQL JDBC URL: " + url);
    }
}
