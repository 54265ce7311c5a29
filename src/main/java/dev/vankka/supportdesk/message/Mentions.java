package dev.vankka.supportdesk.message;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.time.Instant;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Mentions {

    public static String user(String id) {
        return "<@" + id + ">";
    }

    public static String role(String id) {
        return "<@&" + id + ">";
    }

    public static String channel(String id) {
        return "<#" + id + ">";
    }

    /**
     * A timestamp every reader sees in their own time zone.
     */
    public static String time(Instant instant) {
        return "<t:" + instant.getEpochSecond() + ":F>";
    }
}
