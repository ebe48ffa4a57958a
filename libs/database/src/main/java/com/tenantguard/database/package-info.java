/**
 * Relational persistence for quota state: Flyway migrations and JDBC implementations of the
 * bucket and audit stores.
 */
package com.tenantguard.database;
