package com.delta.jobfeed.sync.model;

public record Classification(
    boolean success,
    String jobFunction,
    String industries,
    String seniorityLevel,
    String error
) {
    public static Classification of(String jobFunction, String industries, String seniorityLevel) {
        return new Classification(true, jobFunction, industries, seniorityLevel, null);
    }

    public static Classification failed(String error) {
        return new Classification(false, "", "", "", error);
    }
}
