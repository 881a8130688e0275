package com.example.groupmix.compliance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.example.groupmix.domain.Assignment;

/**
 * Queryable view over the assignment records of one schedule.
 *
 * <p>Group membership keeps record order. Neither group capacity nor the
 * one-group-per-session rule is checked here; when a person appears in several groups
 * of a session the last record wins for {@link #groupOf(String, int)}.
 */
public class ScheduleIndex {

    private final int numSessions;

    // session -> group -> person ids
    private final Map<Integer, Map<String, List<String>>> bySessionThenGroup;

    private final List<Assignment> assignments;

    // built on first lookup
    private Map<String, Map<Integer, String>> byPersonThenSession;

    private ScheduleIndex(int numSessions, Map<Integer, Map<String, List<String>>> bySessionThenGroup,
                          List<Assignment> assignments) {
        this.numSessions = numSessions;
        this.bySessionThenGroup = bySessionThenGroup;
        this.assignments = assignments;
    }

    public static ScheduleIndex build(List<Assignment> assignments, int numSessions) {
        Map<Integer, Map<String, List<String>>> building = new TreeMap<>();
        for (Assignment a : assignments) {
            building.computeIfAbsent(a.getSessionId(), s -> new LinkedHashMap<>())
                    .computeIfAbsent(a.getGroupId(), g -> new ArrayList<>())
                    .add(a.getPersonId());
        }

        Map<Integer, Map<String, List<String>>> frozen = new TreeMap<>();
        building.forEach((session, groups) -> {
            Map<String, List<String>> frozenGroups = new LinkedHashMap<>();
            groups.forEach((groupId, members) -> frozenGroups.put(groupId, Collections.unmodifiableList(members)));
            frozen.put(session, Collections.unmodifiableMap(frozenGroups));
        });
        return new ScheduleIndex(numSessions, Collections.unmodifiableMap(frozen), List.copyOf(assignments));
    }

    public int getNumSessions() {
        return numSessions;
    }

    /**
     * Sessions that have at least one record, ascending. May include indices outside
     * {@code [0, numSessions)} when the records do.
     */
    public Set<Integer> getScheduledSessions() {
        return bySessionThenGroup.keySet();
    }

    /**
     * Groups of a session with their members, in record order. Empty when the session has no records.
     */
    public Map<String, List<String>> groupsIn(int session) {
        return bySessionThenGroup.getOrDefault(session, Map.of());
    }

    public List<String> membersOf(int session, String groupId) {
        return groupsIn(session).getOrDefault(groupId, List.of());
    }

    /**
     * @return the group of the person in that session, or null when unassigned
     */
    public String groupOf(String personId, int session) {
        Map<Integer, String> sessions = personIndex().get(personId);
        return sessions == null ? null : sessions.get(session);
    }

    private synchronized Map<String, Map<Integer, String>> personIndex() {
        if (byPersonThenSession == null) {
            Map<String, Map<Integer, String>> index = new HashMap<>();
            for (Assignment a : assignments) {
                index.computeIfAbsent(a.getPersonId(), p -> new HashMap<>()).put(a.getSessionId(), a.getGroupId());
            }
            byPersonThenSession = index;
        }
        return byPersonThenSession;
    }

    /**
     * Number of distinct unordered pairs of people who share a group at least once.
     */
    public int countUniqueContacts() {
        Set<String> seen = new HashSet<>();
        for (Map<String, List<String>> groups : bySessionThenGroup.values()) {
            for (List<String> members : groups.values()) {
                for (int i = 0; i < members.size(); i++) {
                    for (int j = i + 1; j < members.size(); j++) {
                        String a = members.get(i);
                        String b = members.get(j);
                        if (a.equals(b)) continue;
                        seen.add(a.compareTo(b) < 0 ? a + "\u0000" + b : b + "\u0000" + a);
                    }
                }
            }
        }
        return seen.size();
    }

    /**
     * Average number of unique contacts per person, each contact counting for both people.
     */
    public double averageUniqueContacts(int peopleCount) {
        return countUniqueContacts() * 2.0 / Math.max(1, peopleCount);
    }
}
