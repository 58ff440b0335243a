package org.learningjava.uniagent.domain.service.protocol;

import org.learningjava.uniagent.domain.model.protocol.ParsedResponse;
import org.learningjava.uniagent.domain.model.protocol.RawCommand;
import org.learningjava.uniagent.domain.service.text.TextLines;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the HTML document, the patch block and the {@code [[COMMAND]]} lines out of
 * free-form engine output. Nothing here throws on malformed input; missing parts
 * come back empty.
 */
@Component
public class ProtocolParser {

    private static final Pattern HTML_DOCUMENT = Pattern.compile(
            "<!doctype\\s+html[^>]*>.*?</html\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // keywords are case-sensitive on purpose: "*** begin patch" in prose is not a block
    private static final Pattern PATCH_BLOCK = Pattern.compile(
            "\\*\\*\\*\\s*Begin Patch.*?\\*\\*\\*\\s*End Patch", Pattern.DOTALL);

    private static final Pattern COMMAND = Pattern.compile(
            "^\\s*\\[\\[\\s*([A-Z_]+)(?::\\s*(.+?))?\\s*\\]\\]\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    public ParsedResponse parse(String raw) {
        String text = TextLines.stripCodeFences(raw);
        return new ParsedResponse(text, extractDocument(text), extractPatchBlock(text), parseCommands(text));
    }

    public Optional<String> extractDocument(String text) {
        if (text == null) return Optional.empty();
        Matcher m = HTML_DOCUMENT.matcher(TextLines.stripCodeFences(text));
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    public Optional<String> extractPatchBlock(String text) {
        if (text == null) return Optional.empty();
        Matcher m = PATCH_BLOCK.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    public List<RawCommand> parseCommands(String text) {
        List<RawCommand> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = COMMAND.matcher(text);
        while (m.find()) {
            String name = m.group(1).toUpperCase(Locale.ROOT).strip();
            String arg = m.group(2) == null ? "" : m.group(2).strip();
            out.add(new RawCommand(name, arg));
        }
        return out;
    }
}
