package com.bbthechange.mobilelogin.model;

/**
 * Result of registering a mobile number.
 *
 * @param user the stored user, either just created or already present
 * @param newUser true if this call created the user
 */
public record RegisteredUser(User user, boolean newUser) {
}
