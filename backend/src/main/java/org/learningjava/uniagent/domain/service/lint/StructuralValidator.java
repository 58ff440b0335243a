package org.learningjava.uniagent.domain.service.lint;

import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.service.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximate HTML well-formedness check: required elements, balanced script/style,
 * and a tag stack over the markup with script/style bodies removed.
 * Not a parser; it only has to catch what an LLM typically breaks.
 */
@Component
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    static final Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta",
            "param", "source", "track", "wbr", "command", "keygen", "menuitem");

    private static final List<String> REQUIRED_TAGS = List.of("html", "head", "body");
    private static final List<String> RAW_TEXT_TAGS = List.of("script", "style");

    private static final Pattern COMMENT = Pattern.compile("<!--[\\s\\S]*?-->");
    private static final Pattern DOCTYPE = Pattern.compile("\\s*<!doctype\\s+html\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<\\s*(/)?\\s*([a-zA-Z][a-zA-Z0-9\\-]*)\\b[^>]*?>");

    public List<Defect> validate(String html) {
        List<Defect> defects = new ArrayList<>();
        String stripped = COMMENT.matcher(TextLines.stripCodeFences(html)).replaceAll("");
        String scrubbed = stripped;
        for (String tag : RAW_TEXT_TAGS) {
            scrubbed = blockPattern(tag).matcher(scrubbed).replaceAll("");
        }
        LineIndex index = new LineIndex(stripped);

        if (!DOCTYPE.matcher(stripped).lookingAt()) {
            defects.add(new Defect("Missing <!DOCTYPE html> at top", 1, index.trimmedLine(0)));
        }

        for (String tag : REQUIRED_TAGS) {
            int count = count(openPattern(tag), stripped);
            if (count == 0) {
                defects.add(Defect.global("Missing <" + tag + "> tag"));
            } else if (count > 1) {
                defects.add(Defect.global("Multiple <" + tag + "> tags found (" + count + ")"));
            }
        }

        for (String tag : RAW_TEXT_TAGS) {
            int opens = count(openPattern(tag), stripped);
            int closes = count(closePattern(tag), stripped);
            if (opens != closes) {
                defects.add(Defect.global("Unbalanced <" + tag + "> tags (open=" + opens + ", close=" + closes + ")"));
            }
        }

        scanTags(scrubbed, index, defects);

        if (log.isDebugEnabled()) {
            log.debug("validate: {} chars, {} lines -> {} defects", stripped.length(), index.size(), defects.size());
        }
        return defects;
    }

    // Offsets come from the scrubbed text but resolve against the stripped text's lines.
    private void scanTags(String scrubbed, LineIndex index, List<Defect> defects) {
        Deque<OpenTag> stack = new ArrayDeque<>();
        Matcher m = TAG.matcher(scrubbed);
        while (m.find()) {
            boolean closing = m.group(1) != null;
            String tag = m.group(2).toLowerCase(Locale.ROOT);
            int pos = m.start();
            boolean selfClosed = m.group().stripTrailing().endsWith("/>");

            if (!closing) {
                if (VOID_TAGS.contains(tag) || selfClosed) continue;
                stack.push(new OpenTag(tag, pos));
                continue;
            }
            if (VOID_TAGS.contains(tag)) {
                defects.add(at(index, pos, "Unexpected closing tag </" + tag + "> for void element"));
                continue;
            }
            if (stack.isEmpty()) {
                defects.add(at(index, pos, "Unmatched closing tag </" + tag + ">"));
                continue;
            }
            OpenTag top = stack.pop();
            if (!top.name().equals(tag)) {
                defects.add(at(index, pos, "Mismatched closing tag </" + tag + ">; expected </" + top.name() + ">"));
            }
        }

        Iterator<OpenTag> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            OpenTag open = bottomUp.next();
            defects.add(at(index, open.offset(), "Unclosed <" + open.name() + "> tag"));
        }
    }

    private static Defect at(LineIndex index, int offset, String message) {
        int line = index.lineOf(offset);
        return new Defect(message, line + 1, index.trimmedLine(line));
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static Pattern openPattern(String tag) {
        return Pattern.compile("<\\s*" + tag + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static Pattern closePattern(String tag) {
        return Pattern.compile("</\\s*" + tag + "\\s*>", Pattern.CASE_INSENSITIVE);
    }

    private static Pattern blockPattern(String tag) {
        return Pattern.compile("<" + tag + "\\b[\\s\\S]*?</" + tag + "\\s*>", Pattern.CASE_INSENSITIVE);
    }

    private record OpenTag(String name, int offset) {}
}
