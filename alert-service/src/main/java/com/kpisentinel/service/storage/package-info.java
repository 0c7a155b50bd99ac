/**
 * Spring JDBC stores over the relational schema in {@code db/schema.sql}.
 */
package com.kpisentinel.service.storage;
