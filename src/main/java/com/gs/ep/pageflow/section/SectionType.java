package com.gs.ep.pageflow.section;

/**
 * How a section break relates to the page flow.
 */
public enum SectionType {

    /**
     * New section starts on the same page; may still start a new column region
     */
    CONTINUOUS("continuous"),

    /**
     * New section starts on the next page
     */
    NEXT_PAGE("nextPage"),

    /**
     * New section starts on the next even-numbered page
     */
    EVEN_PAGE("evenPage"),

    /**
     * New section starts on the next odd-numbered page
     */
    ODD_PAGE("oddPage");

    private final String value;

    SectionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Section type for a document value such as {@code "nextPage"}; unknown or missing values map to
     * {@link #CONTINUOUS}.
     */
    public static SectionType fromValue(String value) {
        if (value != null) {
            for (SectionType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        return CONTINUOUS;
    }

    @Override
    public String toString() {
        return value;
    }
}
