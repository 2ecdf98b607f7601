package com.openforge.searchmate.search;

import java.util.Locale;

/** Kind of lookup; the wire value is what appears in the search_type argument. */
public enum SearchMode {
    WEB("web"),
    NEWS("news");

    private final String wireValue;

    SearchMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Anything other than "news" is a web search. */
    public static SearchMode fromWire(String value) {
        if (value != null && NEWS.wireValue.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return NEWS;
        }
        return WEB;
    }
}
