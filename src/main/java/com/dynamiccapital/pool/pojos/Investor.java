package com.dynamiccapital.pool.pojos;

import java.time.Instant;

/**
 * A profile's membership in the private pool.
 * Stored in investors/{investorId}. One per profile, never deleted.
 */
public class Investor {
    public static final String STATUS_ACTIVE = "active";

    private String id;
    private String profileId;
    private String status;
    private Instant joinedAt;

    public Investor() {}

    public Investor(String id, String profileId, String status, Instant joinedAt) {
        this.id = id;
        this.profileId = profileId;
        this.status = status;
        this.joinedAt = joinedAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getProfileId() { return profileId; }
    public void setProfileId(String profileId) { this.profileId = profileId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Instant getJoinedAt() { return joinedAt; }
    public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }

    @Override
    public String toString() {
        return "Investor{" +
                "id='" + id + '\'' +
                ", profileId='" + profileId + '\'' +
                ", status='" + status + '\'' +
                ", joinedAt=" + joinedAt +
                '}';
    }
}
