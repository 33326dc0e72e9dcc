package com.example.cronpurge.compiler;

import com.example.cronpurge.models.RetentionFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/**
 * Builds the WHERE predicate of the purge query: one UTC age comparison per retention filter,
 * joined with {@code AND}.
 */
@Component
public class FilterClauseBuilder {

    private static final String CLAUSE_TEMPLATE =
            "%s.\"%s\" AT TIME ZONE 'UTC' < NOW() AT TIME ZONE 'UTC' - INTERVAL '%d days'";

    private final ThresholdEnforcer thresholdEnforcer;

    public FilterClauseBuilder(ThresholdEnforcer thresholdEnforcer) {
        this.thresholdEnforcer = thresholdEnforcer;
    }

    public FilterClause build(List<RetentionFilter> filters, String alias) {
        if (filters == null || filters.isEmpty()) {
            throw JobCompilerException.missingFilters();
        }

        StringJoiner predicate = new StringJoiner(" AND ");
        List<ThresholdEnforcer.Clamped> days = new ArrayList<>(filters.size());
        for (int i = 0; i < filters.size(); i++) {
            RetentionFilter filter = filters.get(i);
            String column = SqlIdentifiers.requireIdentifier("filters[" + i + "].column", filter.column());
            ThresholdEnforcer.Clamped clamped = thresholdEnforcer.retentionDays(filter.days());
            predicate.add(String.format(Locale.ROOT, CLAUSE_TEMPLATE, alias, column, clamped.effective()));
            days.add(clamped);
        }
        return new FilterClause(predicate.toString(), List.copyOf(days));
    }

    /**
     * @param predicate SQL boolean expression
     * @param retentionDays requested and effective days, in filter order
     */
    public record FilterClause(String predicate, List<ThresholdEnforcer.Clamped> retentionDays) { }
}
