package com.edushield.access;

/**
 * Kind of institutional data a resource holds.
 * <p>
 * Declaration order is the section order used when filtered data is rendered as text.
 * Only {@link #PERSON} and {@link #FINANCIAL} resources are eligible for field masking;
 * grade, class and document resources are never masked even when a mask list names one
 * of their fields.
 */
public enum ResourceCategory {

    PERSON("PERSONS", true),
    FINANCIAL("FINANCIAL INFORMATION", true),
    ACADEMIC("GRADES", false),
    INSTITUTIONAL("CLASSES", false),
    DOCUMENT("DOCUMENTS", false);

    private final String sectionTitle;
    private final boolean maskable;

    ResourceCategory(String sectionTitle, boolean maskable) {
        this.sectionTitle = sectionTitle;
        this.maskable = maskable;
    }

    /** Heading used for this category in rendered output. */
    public String sectionTitle() {
        return sectionTitle;
    }

    /** Whether mask lists apply to resources of this category. */
    public boolean maskable() {
        return maskable;
    }
}
