package com.bbthechange.mobilelogin.model;

/**
 * Result of trying to insert a new user together with its user number.
 */
public enum RegistrationOutcome {
    INSERTED,
    /** Another user already owns the mobile number. */
    MOBILE_TAKEN,
    /** The counter moved since it was read; read it again and retry. */
    NUMBER_TAKEN
}
