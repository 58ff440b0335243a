package org.learningjava.uniagent.domain.model.quality;

public record Issue(String name, String detail, String hint, Severity severity) {

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
