package com.example.cronpurge.compiler;

import org.springframework.stereotype.Component;

/**
 * Renders the pg_cron registration statement. The purge body is a CTE that selects at most
 * {@code limit} ids matching the predicate and deletes those rows; it is dollar-quoted so it can be
 * passed as a single {@code cron.schedule} argument.
 */
@Component
public class QueryAssembler {

    public static final String TABLE_ALIAS = "om";
    static final String CTE_NAME = TABLE_ALIAS + "_cte";

    public String innerQuery(String schema, String table, String predicate, int limit) {
        String target = schema + ".\"" + table + "\" " + TABLE_ALIAS;
        return "$$ with " + CTE_NAME + " as (select " + TABLE_ALIAS + ".\"Id\" from " + target
                + " WHERE " + predicate + " LIMIT " + limit + ")"
                + " delete from " + target
                + " where " + TABLE_ALIAS + ".\"Id\" in (select \"Id\" from " + CTE_NAME + ");$$";
    }

    public String scheduleStatement(String jobKey, String cronExpression, String innerQuery, String databaseName) {
        return "SELECT cron.schedule('" + jobKey + "', '" + cronExpression + "', "
                + innerQuery + ", '" + databaseName + "');";
    }

    public static String jobKey(String databaseName, String jobName) {
        return databaseName + "-" + jobName + "-job";
    }
}
