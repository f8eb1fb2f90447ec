package com.delta.jobfeed.sync.model;

public record RecordLocation(
    String city,
    String state,
    String country
) {
    public RecordLocation {
        city = city == null ? "" : city.trim();
        state = state == null ? "" : state.trim();
        country = country == null ? "" : country.trim();
    }

    public static RecordLocation empty() {
        return new RecordLocation("", "", "");
    }
}
