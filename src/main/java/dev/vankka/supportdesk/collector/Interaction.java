package dev.vankka.supportdesk.collector;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A user's response on an interactive surface: a button press, a menu selection or a form submission.
 */
@Value
@Builder
public class Interaction {

    public enum Type {
        BUTTON,
        SELECT,
        MODAL
    }

    String id;
    String surfaceId;
    String principalId;
    Type type;
    String componentId;
    @Singular List<String> values;
    @Singular Map<String, String> fields;
    Responder responder;

    public Optional<String> firstValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public String field(String fieldId) {
        return fields.get(fieldId);
    }

    public boolean is(Type type, String componentId) {
        return this.type == type && componentId.equals(this.componentId);
    }
}
