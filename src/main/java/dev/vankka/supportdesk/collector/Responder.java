package dev.vankka.supportdesk.collector;

import dev.vankka.supportdesk.message.ModalForm;

/**
 * Acknowledges an interaction. Each interaction must be acknowledged exactly once.
 */
public interface Responder {

    /**
     * Acknowledges the interaction, the surface it came from will be edited later.
     */
    void deferEdit();

    /**
     * Acknowledges the interaction by showing a form. Only possible for interactions that aren't form submissions.
     */
    void openModal(ModalForm form);
}
