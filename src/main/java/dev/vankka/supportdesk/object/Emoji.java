package dev.vankka.supportdesk.object;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Emoji {

    public static final String TICKET = "🎫";
    public static final String LOCK = "🔒";
    public static final String UNLOCK = "🔓";
    public static final String FILE_FOLDER = "📁";
    public static final String WASTEBASKET = "🗑";
    public static final String RAISING_HAND = "🙋";
    public static final String WHITE_CHECK_MARK = "✅";
    public static final String CROSS_MARK = "❌";
    public static final String HEAVY_PLUS_SIGN = "➕";
    public static final String HEAVY_MINUS_SIGN = "➖";
    public static final String WARNING = "⚠";
    public static final String WRENCH = "🔧";
}
