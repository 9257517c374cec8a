package com.collegeportal.backend.modules.auth.domain;

import java.util.Locale;
import java.util.UUID;

import com.collegeportal.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Account of anyone who can sign in. {@code created_at} doubles as the date joined.
 */
@Entity
@Table(name = "portal_user")
public class PortalUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 30)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 30)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private PortalRole role = PortalRole.STUDENT;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_staff", nullable = false)
    private boolean staff;

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = normalizeEmail(email);
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName == null ? "" : firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName == null ? "" : lastName;
    }

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    public PortalRole getRole() {
        return role;
    }

    /**
     * Sets the role for a new account. Existing accounts change role only through
     * {@link #assumeRole(PortalRole)}.
     */
    public void setInitialRole(PortalRole role) {
        if (id != null) {
            throw new IllegalStateException("role of a persisted user is derived from its profile");
        }
        this.role = role;
    }

    /**
     * Aligns the role with the profile that owns this account.
     *
     * @return {@code true} when the role had to change
     */
    public boolean assumeRole(PortalRole expected) {
        if (role == expected) {
            return false;
        }
        this.role = expected;
        return true;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isStaff() {
        return staff;
    }

    public void setStaff(boolean staff) {
        this.staff = staff;
    }
}
