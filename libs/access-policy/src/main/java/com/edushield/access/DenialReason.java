package com.edushield.access;

/**
 * Which policy level removed a requested resource.
 */
public enum DenialReason {

    UNKNOWN_RESOURCE("no such resource"),
    INSTITUTION_RESTRICTED("not permitted for this role by the institution"),
    NOT_GRANTED("not granted to this role"),
    PROHIBITED_COMBINATION("prohibited for this role by institution policy");

    private final String description;

    DenialReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
