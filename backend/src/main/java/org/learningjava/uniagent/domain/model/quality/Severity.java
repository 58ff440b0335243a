package org.learningjava.uniagent.domain.model.quality;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum Severity {
    WARN,
    ERROR;

    @JsonCreator
    public static Severity parse(String raw) {
        return raw == null ? WARN : Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
