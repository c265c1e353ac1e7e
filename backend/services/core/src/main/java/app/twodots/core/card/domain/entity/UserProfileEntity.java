package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of the {@code users} table, used when a card points at the
 * user themselves. The display name doubles as the title.
 */
@Entity
@Table(name = "users", schema = "app_core")
public class UserProfileEntity implements SourceEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "name")
    private String name;

    @Column(name = "profile_summary")
    private String profileSummary;

    @Column(name = "timezone")
    private String timezone;

    @Column(name = "account_status", nullable = false)
    private String accountStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_active_at")
    private Instant lastActiveAt;

    public UserProfileEntity() {
    }

    public UserProfileEntity(UUID userId, String email, String name, String profileSummary, Instant createdAt) {
        this.userId = userId;
        this.email = email;
        this.name = name;
        this.profileSummary = profileSummary;
        this.accountStatus = "active";
        this.createdAt = createdAt;
    }

    @Override
    public UUID getEntityId() {
        return userId;
    }

    @Override
    public String getTitle() {
        return name != null && !name.isBlank() ? name : email;
    }

    @Override
    public String getContent() {
        return profileSummary;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public String getTimezone() {
        return timezone;
    }

    public String getAccountStatus() {
        return accountStatus;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }
}
