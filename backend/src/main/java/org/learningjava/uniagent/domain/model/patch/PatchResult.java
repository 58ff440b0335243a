package org.learningjava.uniagent.domain.model.patch;

public record PatchResult(String document, boolean success, String reason) {

    public static PatchResult applied(String document) {
        return new PatchResult(document, true, "");
    }

    public static PatchResult failed(String original, String reason) {
        return new PatchResult(original, false, reason);
    }
}
