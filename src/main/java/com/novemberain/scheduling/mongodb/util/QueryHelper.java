package com.novemberain.scheduling.mongodb.util;

import com.mongodb.client.model.Filters;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Collection;
import java.util.regex.Pattern;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;

public class QueryHelper {

    public Bson matchingKeysConditionFor(GroupMatcher<?> matcher) {
        final String compareToValue = Pattern.quote(matcher.getCompareToValue());

        switch (matcher.getCompareWithOperator()) {
            case EQUALS:
                return Filters.eq(KEY_GROUP, matcher.getCompareToValue());
            case STARTS_WITH:
                return Filters.regex(KEY_GROUP, "^" + compareToValue + ".*");
            case ENDS_WITH:
                return Filters.regex(KEY_GROUP, ".*" + compareToValue + "$");
            case CONTAINS:
                return Filters.regex(KEY_GROUP, compareToValue);
            case ANYTHING:
            default:
                return new BsonDocument();
        }
    }

    public Bson inGroups(Collection<String> groups) {
        return Filters.in(KEY_GROUP, groups);
    }

    /**
     * Evaluate the matcher against a group name held in memory.
     */
    public static boolean groupMatches(GroupMatcher<?> matcher, String group) {
        return matcher.getCompareWithOperator().evaluate(group, matcher.getCompareToValue());
    }
}
