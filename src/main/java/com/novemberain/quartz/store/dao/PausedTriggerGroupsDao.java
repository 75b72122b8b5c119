package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.DuplicateKeyException;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.QueryHelper;
import org.bson.Document;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;

/**
 * Paused group markers. New triggers stored into a marked group start paused.
 */
public class PausedTriggerGroupsDao {

    private static final Logger log = LoggerFactory.getLogger(PausedTriggerGroupsDao.class);

    private final DocumentCollection triggerGroupsCollection;
    private final QueryHelper queryHelper;

    public PausedTriggerGroupsDao(DocumentCollection triggerGroupsCollection, QueryHelper queryHelper) {
        this.triggerGroupsCollection = triggerGroupsCollection;
        this.queryHelper = queryHelper;
    }

    public void createIndex() {
        triggerGroupsCollection.createUniqueIndex(KEY_GROUP);
    }

    public Set<String> getPausedGroups(Session session) {
        return new HashSet<>(triggerGroupsCollection.distinct(session, KEY_GROUP, Filters.empty(), String.class));
    }

    public boolean isPaused(Session session, String group) {
        return triggerGroupsCollection.count(session, Filters.eq(KEY_GROUP, group)) > 0;
    }

    /**
     * Marks the group as paused, unless it already is.
     */
    public void pauseGroup(Session session, String group) {
        if (isPaused(session, group)) {
            return;
        }
        try {
            triggerGroupsCollection.insertOne(session, new Document(KEY_GROUP, group));
        } catch (DuplicateKeyException e) {
            log.debug("Trigger group '{}' was paused concurrently", group);
        }
    }

    public void unpauseGroup(Session session, String group) {
        triggerGroupsCollection.deleteMany(session, Filters.eq(KEY_GROUP, group));
    }

    /**
     * Removes markers of groups matching the matcher.
     *
     * @return the groups that were marked
     */
    public Set<String> unpauseGroups(Session session, GroupMatcher<TriggerKey> matcher) {
        Set<String> groups = new HashSet<>(triggerGroupsCollection.distinct(
                session, KEY_GROUP, queryHelper.matchingKeysConditionFor(matcher), String.class));
        triggerGroupsCollection.deleteMany(session, queryHelper.inGroups(groups));
        return groups;
    }

    public void remove(Session session) {
        triggerGroupsCollection.deleteMany(session, Filters.empty());
    }
}
