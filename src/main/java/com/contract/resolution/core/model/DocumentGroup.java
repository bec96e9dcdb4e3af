package com.contract.resolution.core.model;

/**
 * The six fixed contract-structure groups a document is filed under.
 * The letter is the group's code in filenames and storage paths.
 */
public enum DocumentGroup {
    /** Form of Agreement. */
    A("Agreement"),

    /** Letter of Acceptance. */
    B("Letter of Acceptance"),

    /** Conditions of Contract, general and particular. */
    C("Conditions of Contract"),

    /** Addendums; later addendums supersede earlier ones. */
    D("Addendums"),

    /** Bills of Quantities. */
    I("Bills of Quantities"),

    /** Schedules and Annexes. */
    N("Schedules/Annexes");

    private final String label;

    DocumentGroup(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a group code case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static DocumentGroup fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Document group code must not be blank");
        }
        for (DocumentGroup group : values()) {
            if (group.name().equalsIgnoreCase(code.trim())) {
                return group;
            }
        }
        throw new IllegalArgumentException("Unknown document group: " + code);
    }
}
