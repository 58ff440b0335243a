package org.learningjava.uniagent.domain.service.patch;

import org.learningjava.uniagent.domain.model.patch.PatchBlock;
import org.learningjava.uniagent.domain.model.patch.PatchResult;
import org.learningjava.uniagent.domain.service.protocol.ProtocolParser;
import org.learningjava.uniagent.domain.service.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the line-number patch dialect:
 * <pre>
 * *** Begin Patch
 * *** Update File: index.html
 * &#64;&#64; context
 * -12
 * +&lt;full new line&gt;
 * *** End Patch
 * </pre>
 * Deletions refer to the document as it was before the patch. All additions go in one
 * contiguous run at the first deleted line (or at the end when nothing is deleted), so
 * a patch is effectively one hunk.
 */
@Component
public class PatchEngine {

    private static final Logger log = LoggerFactory.getLogger(PatchEngine.class);

    private static final Pattern DELETION = Pattern.compile("^-\\s*(\\d+)\\s*$");

    private final ProtocolParser parser;

    public PatchEngine(ProtocolParser parser) {
        this.parser = parser;
    }

    public PatchResult apply(String currentDocument, String patchText) {
        String original = currentDocument == null ? "" : currentDocument;
        try {
            Optional<String> block = parser.extractPatchBlock(patchText);
            if (block.isEmpty()) {
                return PatchResult.failed(original, "No patch block found.");
            }
            PatchBlock patch = parse(block.get());
            String patched = applyParsed(original, patch);
            log.debug("Patch applied: {} deletions, {} additions", patch.deletions().size(), patch.additions().size());
            return PatchResult.applied(patched);
        } catch (RuntimeException e) {
            log.warn("Patch apply error: {}", e.toString());
            return PatchResult.failed(original, "Patch apply error: " + e.getMessage());
        }
    }

    PatchBlock parse(String block) {
        List<Integer> deletions = new ArrayList<>();
        List<String> additions = new ArrayList<>();
        for (String raw : TextLines.split(block)) {
            String trimmed = raw.strip();
            if (trimmed.startsWith("***") || trimmed.startsWith("@@")) continue;

            if (raw.startsWith("-")) {
                Matcher m = DELETION.matcher(trimmed);
                if (m.matches()) {
                    deletions.add(lineNumber(m.group(1)));
                }
            } else if (raw.startsWith("+")) {
                String line = raw.substring(1);
                if (line.startsWith(" ")) {
                    line = line.substring(1);
                }
                additions.add(line);
            }
            // anything else is context
        }
        return new PatchBlock(deletions, additions);
    }

    // oversized numbers clamp to MAX_VALUE, past the end of any document
    private static int lineNumber(String digits) {
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() > 10) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Long.parseLong(significant), Integer.MAX_VALUE);
    }

    String applyParsed(String document, PatchBlock patch) {
        List<String> lines = TextLines.splitKeepEnds(document);

        for (int n : new TreeSet<>(patch.deletions()).descendingSet()) {
            if (n >= 1 && n <= lines.size()) {
                lines.remove(n - 1);
            }
        }

        int insertAt;
        if (!patch.deletions().isEmpty()) {
            int smallest = Collections.min(patch.deletions());
            insertAt = Math.max(Math.min(smallest - 1, lines.size()), 0);
        } else {
            insertAt = lines.size();
        }

        if (!patch.additions().isEmpty()) {
            if (insertAt > 0 && insertAt == lines.size() && !TextLines.hasTerminator(lines.get(insertAt - 1))) {
                lines.set(insertAt - 1, lines.get(insertAt - 1) + "\n");
            }
            List<String> block = new ArrayList<>(patch.additions().size());
            for (String add : patch.additions()) {
                block.add(TextLines.stripTerminator(add) + "\n");
            }
            lines.addAll(insertAt, block);
        }

        return String.join("", lines);
    }
}
