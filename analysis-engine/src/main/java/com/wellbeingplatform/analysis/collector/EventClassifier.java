package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.InteractionEvent;

import java.util.Locale;
import java.util.Set;

/**
 * Shared predicates for classifying raw interaction events. Collectors use them for
 * whole-session tallies, {@link SessionDataAssembler} for window tallies.
 */
public final class EventClassifier {

    public enum ColorTone { WARM, COOL, DARK, NEUTRAL }

    static final long   CLICK_BURST_GAP_MS     = 300;
    static final double HESITATION_PAUSE_MS    = 3000;

    private static final Set<String> WARM = Set.of("red", "orange", "yellow", "pink", "gold", "magenta");
    private static final Set<String> COOL = Set.of("blue", "green", "purple", "teal", "cyan", "violet");
    private static final Set<String> DARK = Set.of("black", "gray", "grey", "brown", "navy", "charcoal");

    private EventClassifier() {}

    public static boolean isError(InteractionEvent e) {
        return e.isType("error") || e.flag("error");
    }

    public static boolean isHelpRequest(InteractionEvent e) {
        return e.isType("help") || e.isType("help_request") || e.flag("helpRequested");
    }

    public static boolean isRetry(InteractionEvent e) {
        return e.isType("retry") || e.flag("retry");
    }

    public static boolean isBacktrack(InteractionEvent e) {
        return e.isType("undo") || e.isType("backtrack");
    }

    public static boolean isClick(InteractionEvent e) {
        return e.isType("click");
    }

    public static boolean isHesitation(InteractionEvent e) {
        return e.number(SessionMetrics.PAUSE_DURATION).orElse(0.0) > HESITATION_PAUSE_MS;
    }

    /** Two clicks closer than {@value #CLICK_BURST_GAP_MS} ms form a burst. */
    public static boolean isBurst(InteractionEvent previous, InteractionEvent current) {
        return previous != null && isClick(previous) && isClick(current)
            && current.timestamp().toEpochMilli() - previous.timestamp().toEpochMilli() < CLICK_BURST_GAP_MS;
    }

    /** Tone of the event's {@code color} field (a name or {@code #rrggbb}), or null when absent. */
    public static ColorTone colorTone(InteractionEvent e) {
        String raw = e.text(SessionMetrics.COLOR);
        if (raw == null || raw.isBlank()) return null;
        String color = raw.trim().toLowerCase(Locale.ROOT);
        if (color.startsWith("#") && color.length() == 7) {
            return hexTone(color);
        }
        if (WARM.contains(color)) return ColorTone.WARM;
        if (COOL.contains(color)) return ColorTone.COOL;
        if (DARK.contains(color)) return ColorTone.DARK;
        return ColorTone.NEUTRAL;
    }

    private static ColorTone hexTone(String hex) {
        try {
            int r = Integer.parseInt(hex.substring(1, 3), 16);
            int g = Integer.parseInt(hex.substring(3, 5), 16);
            int b = Integer.parseInt(hex.substring(5, 7), 16);
            int brightness = (r * 299 + g * 587 + b * 114) / 1000;
            if (brightness < 64) return ColorTone.DARK;
            if (Math.abs(r - b) < 24 && Math.abs(r - g) < 24) return ColorTone.NEUTRAL;
            return r > b ? ColorTone.WARM : ColorTone.COOL;
        } catch (NumberFormatException e) {
            return ColorTone.NEUTRAL;
        }
    }
}
