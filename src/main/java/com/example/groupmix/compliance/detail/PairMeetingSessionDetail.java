package com.example.groupmix.compliance.detail;

import java.util.Objects;

/**
 * Whether a pair under a meeting-count constraint shared a group in one session.
 */
public class PairMeetingSessionDetail extends ViolationDetail {

    private final int session;

    private final PersonPair pair;

    // group they shared, null when apart
    private final String groupId;

    private PairMeetingSessionDetail(int session, PersonPair pair, String groupId) {
        this.session = session;
        this.pair = Objects.requireNonNull(pair, "pair");
        this.groupId = groupId;
    }

    public static PairMeetingSessionDetail together(int session, PersonPair pair, String groupId) {
        return new PairMeetingSessionDetail(session, pair, Objects.requireNonNull(groupId, "groupId"));
    }

    public static PairMeetingSessionDetail apart(int session, PersonPair pair) {
        return new PairMeetingSessionDetail(session, pair, null);
    }

    @Override
    public DetailKind getKind() {
        return groupId != null ? DetailKind.PAIR_MEETING_TOGETHER : DetailKind.PAIR_MEETING_APART;
    }

    public int getSession() {
        return session;
    }

    public PersonPair getPair() {
        return pair;
    }

    public String getGroupId() {
        return groupId;
    }

    public boolean isTogether() {
        return groupId != null;
    }

    @Override
    public String toString() {
        return "session " + session + ": " + pair + (groupId != null ? " together in " + groupId : " apart");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PairMeetingSessionDetail that = (PairMeetingSessionDetail) o;
        return session == that.session && pair.equals(that.pair) && Objects.equals(groupId, that.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, pair, groupId);
    }
}
