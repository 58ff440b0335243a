package org.learningjava.uniagent.domain.model.round;

public enum ControllerPhase {
    AWAITING_RESPONSE,
    PROCESSING_RESPONSE,
    PATCH_APPLYING,
    DOCUMENT_REPLACING,
    NEITHER,
    COMMAND_DISPATCH,
    FEEDBACK_EMISSION,
    FINALIZED,
    EXHAUSTED
}
