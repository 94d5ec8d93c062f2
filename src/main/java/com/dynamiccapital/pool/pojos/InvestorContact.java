package com.dynamiccapital.pool.pojos;

/**
 * Investor joined with the contact fields of its profile.
 */
public class InvestorContact {
    private String investorId;
    private String profileId;
    private String telegramId;
    private String displayName;

    public InvestorContact() {}

    public InvestorContact(String investorId, String profileId, String telegramId, String displayName) {
        this.investorId = investorId;
        this.profileId = profileId;
        this.telegramId = telegramId;
        this.displayName = displayName;
    }

    public String getInvestorId() { return investorId; }
    public void setInvestorId(String investorId) { this.investorId = investorId; }

    public String getProfileId() { return profileId; }
    public void setProfileId(String profileId) { this.profileId = profileId; }

    public String getTelegramId() { return telegramId; }
    public void setTelegramId(String telegramId) { this.telegramId = telegramId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
}
