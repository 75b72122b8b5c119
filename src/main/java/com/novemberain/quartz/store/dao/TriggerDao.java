package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.novemberain.quartz.store.Constants;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.DuplicateKeyException;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.TriggerConverter;
import com.novemberain.quartz.store.trigger.TriggerStatus;
import com.novemberain.quartz.store.util.Keys;
import com.novemberain.quartz.store.util.QueryHelper;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;
import static com.novemberain.quartz.store.util.Keys.toFilter;

/**
 * Trigger documents. State changes are compare-and-set: they name the states
 * a trigger must be in to be updated and report how many were.
 */
public class TriggerDao {

    private static final Logger log = LoggerFactory.getLogger(TriggerDao.class);

    private static final Bson FIRING_ORDER = Sorts.orderBy(
            Sorts.ascending(Constants.TRIGGER_NEXT_FIRE_TIME),
            Sorts.descending(Constants.TRIGGER_PRIORITY));

    private final DocumentCollection triggerCollection;
    private final QueryHelper queryHelper;
    private final TriggerConverter triggerConverter;

    public TriggerDao(DocumentCollection triggerCollection, QueryHelper queryHelper,
                      TriggerConverter triggerConverter) {
        this.triggerCollection = triggerCollection;
        this.queryHelper = queryHelper;
        this.triggerConverter = triggerConverter;
    }

    public void createIndex() {
        triggerCollection.createUniqueIndex(Keys.KEY_GROUP, Keys.KEY_NAME);
    }

    public long clear(Session session) {
        return triggerCollection.deleteMany(session, Filters.empty());
    }

    public boolean exists(Session session, TriggerKey key) {
        return triggerCollection.count(session, toFilter(key)) > 0;
    }

    /**
     * Selects up to {@code limit} waiting triggers due no later than the given time,
     * earliest first and, for the same time, highest priority first.
     */
    public List<Document> findEligibleToRun(Session session, Date noLaterThan, int limit) {
        Bson query = Filters.and(
                Filters.eq(Constants.TRIGGER_STATE, Constants.STATE_WAITING),
                Filters.lte(Constants.TRIGGER_NEXT_FIRE_TIME, noLaterThan));
        List<Document> found = triggerCollection.find(session, query, FIRING_ORDER, limit);
        log.debug("Found {} triggers which are eligible to be run.", found.size());
        return found;
    }

    /**
     * @return trigger document or null
     */
    public Document findTrigger(Session session, TriggerKey key) {
        return triggerCollection.first(session, toFilter(key));
    }

    public int getCount(Session session) {
        return (int) triggerCollection.count(session, Filters.empty());
    }

    public List<String> getGroupNames(Session session) {
        return new ArrayList<>(triggerCollection.distinct(session, KEY_GROUP, Filters.empty(), String.class));
    }

    public List<String> getGroupNames(Session session, GroupMatcher<TriggerKey> matcher) {
        return new ArrayList<>(triggerCollection.distinct(
                session, KEY_GROUP, queryHelper.matchingKeysConditionFor(matcher), String.class));
    }

    /**
     * @return stored state or null when there is no such trigger
     */
    public String getState(Session session, TriggerKey triggerKey) {
        Document doc = findTrigger(session, triggerKey);
        return doc == null ? null : doc.getString(Constants.TRIGGER_STATE);
    }

    /**
     * @return status or null when there is no such trigger
     */
    public TriggerStatus getStatus(Session session, TriggerKey triggerKey) {
        Document doc = findTrigger(session, triggerKey);
        if (doc == null) {
            return null;
        }
        return new TriggerStatus(triggerKey, Keys.toJobKeyOfTrigger(doc),
                doc.getString(Constants.TRIGGER_STATE), doc.getDate(Constants.TRIGGER_NEXT_FIRE_TIME));
    }

    /**
     * @return trigger or null when there is no such trigger
     * @throws JobPersistenceException when the stored trigger cannot be read
     */
    public OperableTrigger getTrigger(Session session, TriggerKey triggerKey) throws JobPersistenceException {
        Document doc = findTrigger(session, triggerKey);
        if (doc == null) {
            return null;
        }
        return triggerConverter.toTrigger(doc);
    }

    public OperableTrigger toTrigger(Document doc) throws JobPersistenceException {
        return triggerConverter.toTrigger(doc);
    }

    public List<OperableTrigger> getTriggersForJob(Session session, JobKey jobKey) throws JobPersistenceException {
        final List<OperableTrigger> triggers = new LinkedList<>();
        for (Document item : triggerCollection.find(session, Keys.triggersOf(jobKey))) {
            triggers.add(triggerConverter.toTrigger(item));
        }
        return triggers;
    }

    public List<TriggerKey> getTriggerKeysForJob(Session session, JobKey jobKey) {
        return toKeys(triggerCollection.find(session, Keys.triggersOf(jobKey)));
    }

    public long countForJob(Session session, JobKey jobKey) {
        return triggerCollection.count(session, Keys.triggersOf(jobKey));
    }

    public Set<TriggerKey> getTriggerKeys(Session session, GroupMatcher<TriggerKey> matcher) {
        return new HashSet<>(toKeys(triggerCollection.find(session, queryHelper.matchingKeysConditionFor(matcher))));
    }

    public List<TriggerKey> getTriggerKeysInState(Session session, String... states) {
        return toKeys(triggerCollection.find(session, Filters.in(Constants.TRIGGER_STATE, (Object[]) states)));
    }

    public List<TriggerKey> getTriggerKeysForCalendar(Session session, String calendarName) {
        return toKeys(triggerCollection.find(session, Filters.eq(Constants.TRIGGER_CALENDAR_NAME, calendarName)));
    }

    public boolean isCalendarReferenced(Session session, String calendarName) {
        return triggerCollection.count(session, Filters.eq(Constants.TRIGGER_CALENDAR_NAME, calendarName)) > 0;
    }

    public void insert(Session session, OperableTrigger trigger, String state) throws JobPersistenceException {
        try {
            triggerCollection.insertOne(session, triggerConverter.toDocument(trigger, state));
        } catch (DuplicateKeyException e) {
            throw new ObjectAlreadyExistsException(trigger);
        }
    }

    public boolean replace(Session session, OperableTrigger trigger, String state) throws JobPersistenceException {
        return triggerCollection.replaceOne(session, toFilter(trigger.getKey()),
                triggerConverter.toDocument(trigger, state)) > 0;
    }

    public boolean remove(Session session, TriggerKey triggerKey) {
        return triggerCollection.deleteMany(session, toFilter(triggerKey)) > 0;
    }

    public void setState(Session session, TriggerKey triggerKey, String state) {
        triggerCollection.updateMany(session, toFilter(triggerKey), stateUpdate(state));
    }

    /**
     * Moves the trigger to {@code newState} if it is in one of the old states.
     *
     * @return if the trigger was moved
     */
    public boolean transferState(Session session, TriggerKey triggerKey, String newState, String... oldStates) {
        return triggerCollection.updateMany(session,
                Filters.and(toFilter(triggerKey), inStates(oldStates)),
                stateUpdate(newState)) > 0;
    }

    public long setStateForJob(Session session, JobKey jobKey, String state) {
        return triggerCollection.updateMany(session, Keys.triggersOf(jobKey), stateUpdate(state));
    }

    public long transferStateForJob(Session session, JobKey jobKey, String newState, String... oldStates) {
        return triggerCollection.updateMany(session,
                Filters.and(Keys.triggersOf(jobKey), inStates(oldStates)),
                stateUpdate(newState));
    }

    public long transferStateInMatching(Session session, GroupMatcher<TriggerKey> matcher,
                                        String newState, String... oldStates) {
        return triggerCollection.updateMany(session,
                Filters.and(queryHelper.matchingKeysConditionFor(matcher), inStates(oldStates)),
                stateUpdate(newState));
    }

    public long transferStateInAll(Session session, String newState, String... oldStates) {
        return triggerCollection.updateMany(session, inStates(oldStates), stateUpdate(newState));
    }

    /**
     * Moves waiting triggers due before {@code misfireTime} to the misfired state.
     * Triggers ignoring misfires stay waiting.
     *
     * @return number of reclassified triggers
     */
    public long reclassifyMisfired(Session session, Date misfireTime) {
        return triggerCollection.updateMany(session, misfireCandidates(misfireTime),
                stateUpdate(Constants.STATE_MISFIRED));
    }

    /**
     * Counts triggers {@link #reclassifyMisfired(Session, Date)} would move, plus those
     * already misfired. Takes no locks.
     */
    public long countMisfired(Session session, Date misfireTime) {
        return triggerCollection.count(session, Filters.or(
                misfireCandidates(misfireTime),
                Filters.eq(Constants.TRIGGER_STATE, Constants.STATE_MISFIRED)));
    }

    /**
     * @param limit maximum number of triggers, zero or negative for all
     */
    public List<Document> findMisfired(Session session, int limit) {
        return triggerCollection.find(session,
                Filters.eq(Constants.TRIGGER_STATE, Constants.STATE_MISFIRED), FIRING_ORDER, limit);
    }

    private Bson misfireCandidates(Date misfireTime) {
        return Filters.and(
                Filters.eq(Constants.TRIGGER_STATE, Constants.STATE_WAITING),
                Filters.ne(Constants.TRIGGER_MISFIRE_INSTRUCTION, Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY),
                Filters.lt(Constants.TRIGGER_NEXT_FIRE_TIME, misfireTime));
    }

    private Bson inStates(String... states) {
        return Filters.in(Constants.TRIGGER_STATE, (Object[]) states);
    }

    private Document stateUpdate(String state) {
        return new Document(Constants.TRIGGER_STATE, state);
    }

    private List<TriggerKey> toKeys(List<Document> docs) {
        List<TriggerKey> keys = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            keys.add(Keys.toTriggerKey(doc));
        }
        return keys;
    }
}
