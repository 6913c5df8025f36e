package com.questrail.tracewire.codec.text;

import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * PatternParser
 * -----------------------------------------------------------------------------
 * Expands a line pattern such as {@code [%timestamp%] %level%: %title%} for
 * one log entry.
 *
 * <p>With indentation enabled the parser tracks method nesting: a
 * {@link LogEntryType#LEAVE_METHOD} entry decreases the level before it is
 * rendered, an {@link LogEntryType#ENTER_METHOD} entry increases it after.
 * Each level prefixes indentable tokens with three spaces.</p>
 *
 * <p>Not thread safe.</p>
 */
public final class PatternParser
{
    private static final String SPACES = "   ";

    private final String pattern;
    private final boolean indent;
    private final List<PatternToken> tokens;
    private int indentLevel;

    public PatternParser(String pattern, boolean indent, ZoneId zone)
    {
        this.pattern = pattern == null ? "" : pattern.trim();
        this.indent = indent;
        this.tokens = Collections.unmodifiableList(parse(this.pattern, Objects.requireNonNull(zone, "zone")));
    }

    public String pattern()
    {
        return pattern;
    }

    public boolean indent()
    {
        return indent;
    }

    public String expand(LogEntry entry)
    {
        if (tokens.isEmpty()) {
            return "";
        }

        if (entry.logEntryType() == LogEntryType.LEAVE_METHOD && indentLevel > 0) {
            indentLevel--;
        }

        StringBuilder sb = new StringBuilder();
        for (PatternToken token : tokens) {
            if (indent && token.indent()) {
                sb.append(SPACES.repeat(indentLevel));
            }

            String expanded = token.expand(entry);
            int width = token.width();
            if (width < 0) {
                sb.append(expanded);
                pad(sb, -width - expanded.length());
            } else if (width > 0) {
                pad(sb, width - expanded.length());
                sb.append(expanded);
            } else {
                sb.append(expanded);
            }
        }

        if (entry.logEntryType() == LogEntryType.ENTER_METHOD) {
            indentLevel++;
        }
        return sb.toString();
    }

    private static void pad(StringBuilder sb, int count)
    {
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
    }

    // Splits into alternating literal runs and %...% variables.
    private static List<PatternToken> parse(String pattern, ZoneId zone)
    {
        List<PatternToken> result = new ArrayList<>();
        int length = pattern.length();
        int position = 0;
        while (position < length) {
            boolean variable = pattern.charAt(position) == '%';
            int pos = variable ? position + 1 : position;
            while (pos < length) {
                if (pattern.charAt(pos) == '%') {
                    if (variable) {
                        pos++;
                    }
                    break;
                }
                pos++;
            }
            result.add(PatternToken.of(pattern.substring(position, pos), zone));
            position = pos;
        }
        return result;
    }
}
