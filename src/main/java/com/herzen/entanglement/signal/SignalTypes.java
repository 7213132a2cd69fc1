package com.herzen.entanglement.signal;

public final class SignalTypes {
    public static final String QUIZ = "quiz";
    public static final String PLAYGROUND = "playground";
    public static final String SECTION_TIME = "sectionTime";
    public static final String ERROR_PATTERN = "errorPattern";
    public static final String VIDEO = "video";
    public static final String NAVIGATION = "navigation";

    private SignalTypes() {}
}
