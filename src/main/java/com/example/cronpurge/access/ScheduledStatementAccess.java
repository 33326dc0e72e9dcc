package com.example.cronpurge.access;

import com.example.cronpurge.models.ScheduledStatement;
import java.util.Optional;

/**
 * Storage abstraction for generated scheduler statements. Only the SQL text and the names it was
 * derived from are kept; job definitions themselves are never stored.
 */
public interface ScheduledStatementAccess {

    /**
     * Stores the statement, replacing any earlier one submitted under the same job key.
     *
     * @param statement the compiled statement to hand off
     * @return the stored item, as acknowledgement
     */
    ScheduledStatement submit(ScheduledStatement statement);

    Optional<ScheduledStatement> findByJobKey(String jobKey);
}
