package com.swiftaudit.parser;

import com.swiftaudit.model.SyntaxKind;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.SyntaxToken;
import com.swiftaudit.parser.SuppressionRegions.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 行内规则开关注释解析器
 * <p>
 * 支持的写法（只在注释中生效）：
 * <pre>
 * // swiftlint:disable control_statement
 * // swiftlint:enable control_statement
 * // swiftlint:disable:next control_statement
 * if (x) { } // swiftlint:disable:this control_statement
 * // swiftlint:disable:previous all
 * </pre>
 */
@Component
public class SuppressionCommentParser {

    private static final Logger log = LoggerFactory.getLogger(SuppressionCommentParser.class);

    private static final Pattern COMMAND = Pattern.compile(
            "swiftlint:(enable|disable)(?::(previous|this|next))?((?:[ \\t]+[\\w.]+)+)");

    public SuppressionRegions parse(String contents, SyntaxMap syntaxMap) {
        int[] lineStarts = lineStarts(contents);
        List<Event> events = new ArrayList<>();

        for (SyntaxToken token : syntaxMap.tokens()) {
            if (token.kind() != SyntaxKind.COMMENT) {
                continue;
            }
            String comment = contents.substring(token.offset(), token.end());
            Matcher matcher = COMMAND.matcher(comment);
            while (matcher.find()) {
                int commandOffset = token.offset() + matcher.start();
                boolean disable = "disable".equals(matcher.group(1));
                String modifier = matcher.group(2);
                Set<String> ruleIds = new LinkedHashSet<>(
                        Arrays.asList(matcher.group(3).trim().split("\\s+")));
                expand(events, lineStarts, contents.length(), commandOffset, disable, modifier, ruleIds);
            }
        }

        events.sort(Comparator.comparingInt(Event::offset));
        if (!events.isEmpty()) {
            log.debug("解析到 {} 条规则开关事件", events.size());
        }
        return new SuppressionRegions(events);
    }

    private void expand(List<Event> events, int[] lineStarts, int length, int commandOffset,
                        boolean disable, String modifier, Set<String> ruleIds) {
        if (modifier == null) {
            events.add(new Event(commandOffset, disable, ruleIds));
            return;
        }
        int line = lineIndexOf(lineStarts, commandOffset);
        int firstLine = switch (modifier) {
            case "previous" -> line - 1;
            case "next" -> line + 1;
            default -> line;
        };
        events.add(new Event(lineStart(lineStarts, length, firstLine), disable, ruleIds));
        events.add(new Event(lineStart(lineStarts, length, firstLine + 1), !disable, ruleIds));
    }

    private int[] lineStarts(String contents) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < contents.length(); i++) {
            if (contents.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private int lineIndexOf(int[] lineStarts, int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }

    private int lineStart(int[] lineStarts, int length, int line) {
        if (line < 0) {
            return 0;
        }
        if (line >= lineStarts.length) {
            return length;
        }
        return lineStarts[line];
    }
}
