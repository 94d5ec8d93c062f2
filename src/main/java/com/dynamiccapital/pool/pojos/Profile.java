package com.dynamiccapital.pool.pojos;

/**
 * Identity record owned by the identity provider.
 * Stored in profiles/{profileId}; the ledger only reads it.
 */
public class Profile {
    private String id;
    private UserRole role;
    private String telegramId;
    private String displayName;

    public Profile() {}

    public Profile(String id, UserRole role, String telegramId, String displayName) {
        this.id = id;
        this.role = role;
        this.telegramId = telegramId;
        this.displayName = displayName;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public UserRole getRole() { return role; }
    public void setRole(UserRole role) { this.role = role; }

    public String getTelegramId() { return telegramId; }
    public void setTelegramId(String telegramId) { this.telegramId = telegramId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    @Override
    public String toString() {
        return "Profile{" +
                "id='" + id + '\'' +
                ", role=" + role +
                ", telegramId='" + telegramId + '\'' +
                '}';
    }
}
