package org.learningjava.uniagent.domain.service.quality;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.learningjava.uniagent.domain.model.quality.Issue;
import org.learningjava.uniagent.domain.model.quality.Severity;
import org.learningjava.uniagent.domain.policy.QualityRule;
import org.learningjava.uniagent.domain.policy.QualityRuleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mobile mini-game heuristics. Regex rules come from {@code /quality_rules/rules.yml};
 * the two rules that need counting or per-match follow-ups live here and run where the
 * rules file places their {@code builtin} entries.
 */
@Component
public class MiniGameHeuristicChecker implements HeuristicChecker {

    private static final Logger log = LoggerFactory.getLogger(MiniGameHeuristicChecker.class);

    static final String DEFAULT_RULES = "/quality_rules/rules.yml";

    static final String BUTTON_NO_HANDLER = "button_no_handler";
    static final String UNBALANCED_SCRIPT_TAGS = "unbalanced_script_tags";

    private static final Pattern BUTTON_ID = Pattern.compile(
            "id\\s*=\\s*[\"'](restart|start|pause|menu)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_OPEN = Pattern.compile("<\\s*script\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_CLOSE = Pattern.compile("</\\s*script\\s*>", Pattern.CASE_INSENSITIVE);

    private final List<CompiledRule> rules;

    public MiniGameHeuristicChecker() {
        this(DEFAULT_RULES);
    }

    MiniGameHeuristicChecker(String rulesResource) {
        try (InputStream in = getClass().getResourceAsStream(rulesResource)) {
            if (in == null) {
                throw new IllegalStateException("Rules resource not found on classpath: " + rulesResource);
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            QualityRuleConfig config = mapper.readValue(in, QualityRuleConfig.class);
            this.rules = config.getRules().stream().map(CompiledRule::of).toList();
            log.info("Loaded {} quality rules from {}", rules.size(), rulesResource);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load quality rules from " + rulesResource, e);
        }
    }

    @Override
    public List<Issue> check(String html) {
        String doc = html == null ? "" : html;
        List<Issue> issues = new ArrayList<>();

        for (CompiledRule rule : rules) {
            if (!rule.rule().isBuiltin()) {
                if (rule.fires(doc)) {
                    issues.add(rule.toIssue());
                }
            } else if (BUTTON_NO_HANDLER.equals(rule.rule().getName())) {
                checkButtonHandlers(doc, issues);
            } else {
                checkScriptBalance(doc, issues);
            }
        }

        log.debug("Heuristic check -> {} issues", issues.size());
        return issues;
    }

    private static void checkButtonHandlers(String doc, List<Issue> issues) {
        Matcher buttons = BUTTON_ID.matcher(doc);
        while (buttons.find()) {
            String id = buttons.group(1);
            Pattern handler = Pattern.compile("document\\.getElementById\\(\\s*['\"]" + Pattern.quote(id)
                    + "['\"]\\s*\\)\\.addEventListener");
            if (!handler.matcher(doc).find()) {
                issues.add(new Issue(BUTTON_NO_HANDLER,
                        "Button #" + id + " lacks event listener.",
                        "Add: document.getElementById('" + id + "').addEventListener('click', ...)",
                        Severity.WARN));
            }
        }
    }

    private static void checkScriptBalance(String doc, List<Issue> issues) {
        int opens = count(SCRIPT_OPEN, doc);
        int closes = count(SCRIPT_CLOSE, doc);
        if (opens != closes) {
            issues.add(new Issue(UNBALANCED_SCRIPT_TAGS,
                    "Script tags open=" + opens + " close=" + closes + ".",
                    "Fix unbalanced <script> tags.",
                    Severity.ERROR));
        }
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private record CompiledRule(QualityRule rule, Pattern pattern, Pattern requires) {

        static CompiledRule of(QualityRule rule) {
            if (rule.isBuiltin()) {
                if (!BUTTON_NO_HANDLER.equals(rule.getName()) && !UNBALANCED_SCRIPT_TAGS.equals(rule.getName())) {
                    throw new IllegalStateException("Unknown builtin quality check: " + rule.getName());
                }
                return new CompiledRule(rule, null, null);
            }
            int flags = rule.isIgnoreCase() ? Pattern.CASE_INSENSITIVE : 0;
            Pattern requires = rule.getRequires() == null ? null : Pattern.compile(rule.getRequires());
            return new CompiledRule(rule, Pattern.compile(rule.getPattern(), flags), requires);
        }

        boolean fires(String doc) {
            if (requires != null && !requires.matcher(doc).find()) return false;
            boolean found = pattern.matcher(doc).find();
            return rule.getTrigger() == QualityRule.Trigger.PRESENT ? found : !found;
        }

        Issue toIssue() {
            return new Issue(rule.getName(), rule.getDetail(), rule.getHint(), rule.getSeverity());
        }
    }
}
