package dev.vankka.supportdesk.storage;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Partial-update merging and input rules shared by the stores.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Fields {

    private static final Pattern HEX_COLOR = Pattern.compile("^#([A-Fa-f0-9]{6}|[A-Fa-f0-9]{3})$");

    /**
     * Merges an optional text field: {@code null} keeps the current value, an empty or blank value clears it.
     */
    static String mergeOptional(String update, String current) {
        if (update == null) {
            return current;
        }
        return StringUtils.isBlank(update) ? null : update.trim();
    }

    static <T> T merge(T update, T current) {
        return update != null ? update : current;
    }

    /**
     * Normalizes a hex color to {@code #RRGGBB}/{@code #RGB} form.
     *
     * @return the normalized color, or {@code null} if the input is not a valid color
     */
    public static String normalizeColor(String color) {
        if (color == null) {
            return null;
        }
        String candidate = color.trim();
        if (!candidate.startsWith("#")) {
            candidate = "#" + candidate;
        }
        return HEX_COLOR.matcher(candidate).matches() ? candidate.toUpperCase() : null;
    }

    static boolean isInvalidColorUpdate(String update) {
        return update != null && !update.isEmpty() && normalizeColor(update) == null;
    }

    static String mergeColor(String update, String current) {
        if (update == null) {
            return current;
        }
        return update.isEmpty() ? null : normalizeColor(update);
    }

    static boolean isInvalidRequired(String update, int maxLength) {
        return update != null && (StringUtils.isBlank(update) || update.trim().length() > maxLength);
    }
}
