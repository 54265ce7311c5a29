package dev.vankka.supportdesk.message;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A pop-up form with text inputs, answered by a single submission.
 */
@Value
@Builder
public class ModalForm {

    String id;
    String title;
    @Singular List<Field> fields;

    @Value
    @Builder
    public static class Field {

        String id;
        String label;
        /**
         * Pre-filled value, may be {@code null}.
         */
        String value;
        boolean paragraph;
        @Builder.Default boolean required = true;
        @Builder.Default int maxLength = 100;
    }
}
