package com.playpilot.orchestrator.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.playpilot.orchestrator.model.SafetyLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores a playbook against the denylist and the per-level policy.
 *
 * Checks, in order:
 *   1. Denylist: case-insensitive substring search over the raw text.
 *      Each pattern found costs 20 points and is a violation at every level.
 *   2. Structure: the text must parse as YAML and be a non-empty list of
 *      plays, each with non-empty {@code hosts} and {@code tasks}. Any failure
 *      here ends evaluation with score 0, keeping the denylist violations.
 *   3. Capabilities: {@code become} costs 5 points per occurrence;
 *      shell/command-style modules cost 30 points each at HIGH.
 *      Both are violations at HIGH and warnings otherwise.
 *
 * The deduction constants are tunable policy, not calibrated risk figures.
 *
 * Stateless and thread-safe.
 */
@Component
public class SafetyPolicyEngine {

    static final int DENYLIST_PENALTY    = 20;
    static final int BECOME_PENALTY      = 5;
    static final int SHELL_MODULE_PENALTY = 30;

    /** Destructive filesystem, disk, power-state, firewall-reset and account-deletion fragments. */
    static final List<String> DENYLIST = List.of(
            "rm -rf",
            "dd if=",
            "mkfs",
            "fdisk",
            "parted",
            "shutdown",
            "reboot",
            "halt",
            "poweroff",
            "init 0",
            "init 6",
            "ufw --force reset",
            "ufw reset",
            "iptables -f",
            "iptables --flush",
            "userdel",
            "deluser"
    );

    /**
     * Modules that run arbitrary commands on the target, by short name.
     * Collection-qualified keys ({@code ansible.legacy.shell}) match on their last segment.
     */
    static final Set<String> SHELL_MODULES = Set.of(
            "shell", "command", "raw", "script", "win_shell", "win_command"
    );

    // Task lists inside a play, and nested task lists inside a block.
    private static final List<String> PLAY_TASK_KEYS  = List.of("pre_tasks", "tasks", "post_tasks", "handlers");
    private static final List<String> BLOCK_TASK_KEYS = List.of("block", "rescue", "always");

    private static final Set<String> TRUTHY = Set.of("yes", "true", "on", "y");

    private final YAMLMapper yaml = new YAMLMapper();

    public SafetyVerdict evaluate(String playbook, SafetyLevel level) {
        if (playbook == null || playbook.isBlank()) {
            return SafetyVerdict.structuralFailure(List.of("Empty or invalid YAML content"));
        }

        Evaluation eval = new Evaluation(level);
        scanDenylist(playbook, eval);

        JsonNode root;
        try {
            root = yaml.readTree(playbook);
        } catch (JsonProcessingException e) {
            return SafetyVerdict.structuralFailure(
                    List.of("YAML parsing error: " + e.getOriginalMessage()), eval.violations);
        }

        List<String> structural = validateStructure(root);
        if (!structural.isEmpty()) {
            return SafetyVerdict.structuralFailure(structural, eval.violations);
        }

        for (int i = 0; i < root.size(); i++) {
            scanPlay(i, root.get(i), eval);
        }
        return eval.toVerdict();
    }

    // ------------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------------

    private static List<String> validateStructure(JsonNode root) {
        List<String> errors = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            errors.add("Empty or invalid YAML content");
            return errors;
        }
        if (!root.isArray()) {
            errors.add("Playbook must be a list of plays");
            return errors;
        }
        if (root.isEmpty()) {
            errors.add("Playbook contains no plays");
            return errors;
        }
        for (int i = 0; i < root.size(); i++) {
            JsonNode play = root.get(i);
            if (!play.isObject()) {
                errors.add("Play %d must be a mapping".formatted(i));
                continue;
            }
            if (isBlank(play.get("hosts"))) {
                errors.add("Play %d missing 'hosts' field".formatted(i));
            }
            JsonNode tasks = play.get("tasks");
            if (tasks == null || !tasks.isArray() || tasks.isEmpty()) {
                errors.add("Play %d missing 'tasks' field".formatted(i));
            }
        }
        return errors;
    }

    private static boolean isBlank(JsonNode node) {
        if (node == null || node.isNull()) return true;
        if (node.isTextual()) return node.asText().isBlank();
        if (node.isContainerNode()) return node.isEmpty();
        return false;
    }

    // ------------------------------------------------------------------
    // Denylist
    // ------------------------------------------------------------------

    private static void scanDenylist(String playbook, Evaluation eval) {
        String lower = playbook.toLowerCase(Locale.ROOT);
        for (String pattern : DENYLIST) {
            int idx = lower.indexOf(pattern);
            if (idx >= 0) {
                eval.violation(new Violation(pattern, lineAt(playbook, idx),
                        "Dangerous pattern detected: " + pattern), DENYLIST_PENALTY);
            }
        }
    }

    private static String lineAt(String text, int idx) {
        int start = text.lastIndexOf('\n', idx) + 1;
        int end   = text.indexOf('\n', idx);
        return text.substring(start, end < 0 ? text.length() : end).strip();
    }

    // ------------------------------------------------------------------
    // Capabilities
    // ------------------------------------------------------------------

    private void scanPlay(int index, JsonNode play, Evaluation eval) {
        String where = "Play %d".formatted(index);
        if (isTruthy(play.get("become"))) {
            eval.become(where, "become: " + play.get("become").asText());
        }
        for (String key : PLAY_TASK_KEYS) {
            scanTasks(index, play.get(key), eval);
        }
    }

    private void scanTasks(int playIndex, JsonNode tasks, Evaluation eval) {
        if (tasks == null || !tasks.isArray()) {
            return;
        }
        for (JsonNode task : tasks) {
            if (!task.isObject()) {
                continue;
            }
            String where = "Task '%s' in play %d".formatted(task.path("name").asText("unnamed"), playIndex);
            if (isTruthy(task.get("become"))) {
                eval.become(where, "become: " + task.get("become").asText());
            }
            task.fieldNames().forEachRemaining(field -> {
                if (SHELL_MODULES.contains(shortName(field))) {
                    eval.shellModule(where, field, field + ": " + task.get(field).asText(""));
                }
            });
            for (String key : BLOCK_TASK_KEYS) {
                scanTasks(playIndex, task.get(key), eval);
            }
        }
    }

    static String shortName(String module) {
        return module.substring(module.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null) return false;
        if (node.isBoolean()) return node.booleanValue();
        return node.isTextual() && TRUTHY.contains(node.asText().toLowerCase(Locale.ROOT));
    }

    // ------------------------------------------------------------------
    // Accumulator for one evaluate() call
    // ------------------------------------------------------------------

    private static final class Evaluation {
        private final SafetyLevel     level;
        private final List<Violation> violations = new ArrayList<>();
        private final List<String>    warnings   = new ArrayList<>();
        private int score = 100;

        Evaluation(SafetyLevel level) {
            this.level = level;
        }

        void violation(Violation v, int penalty) {
            violations.add(v);
            score -= penalty;
        }

        void become(String where, String segment) {
            score -= BECOME_PENALTY;
            if (level.strict()) {
                violations.add(new Violation("become", segment,
                        where + " uses become: elevated privilege is not allowed at high safety level"));
            } else {
                warnings.add(where + " uses become - ensure this is necessary");
            }
        }

        void shellModule(String where, String module, String segment) {
            if (level.strict()) {
                score -= SHELL_MODULE_PENALTY;
                violations.add(new Violation(module, segment,
                        where + " uses unrestricted module '" + module + "': not allowed at high safety level"));
            } else {
                warnings.add(where + " uses unrestricted module '" + module + "'");
            }
        }

        SafetyVerdict toVerdict() {
            int finalScore = Math.max(0, score);
            boolean accepted = violations.isEmpty() && finalScore >= level.acceptanceThreshold();
            return new SafetyVerdict(accepted, finalScore, violations, List.of(), warnings,
                    accepted && !warnings.isEmpty());
        }
    }
}
