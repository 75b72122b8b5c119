package com.novemberain.quartz.store.util;

import com.mongodb.client.model.Filters;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Collection;
import java.util.regex.Pattern;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;

/**
 * Translates Quartz group matchers into filters on the stored key group.
 */
public class QueryHelper {

    public Bson matchingKeysConditionFor(GroupMatcher<?> matcher) {
        final String compareToValue = Pattern.quote(matcher.getCompareToValue());

        switch (matcher.getCompareWithOperator()) {
            case EQUALS:
                return Filters.eq(KEY_GROUP, matcher.getCompareToValue());
            case STARTS_WITH:
                return Filters.regex(KEY_GROUP, "^" + compareToValue);
            case ENDS_WITH:
                return Filters.regex(KEY_GROUP, compareToValue + "$");
            case CONTAINS:
                return Filters.regex(KEY_GROUP, compareToValue);
            default:
                return new BsonDocument();
        }
    }

    public Bson inGroups(Collection<String> groups) {
        return Filters.in(KEY_GROUP, groups);
    }
}
