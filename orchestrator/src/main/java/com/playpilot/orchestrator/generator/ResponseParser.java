package com.playpilot.orchestrator.generator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the playbook out of a raw model reply.
 *
 * Models usually wrap YAML in a fenced block, sometimes untagged, sometimes
 * with a sentence of preamble. Order of preference:
 *   1. first block fenced as ```yaml or ```yml
 *   2. first fenced block of any kind
 *   3. the whole reply, stripped
 */
public final class ResponseParser {

    private static final Pattern YAML_BLOCK = Pattern.compile(
            "```(?:yaml|yml)[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE
    );

    // Any language label, or none
    private static final Pattern ANY_BLOCK = Pattern.compile(
            "```[\\w+-]*[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    public static String extractPlaybook(String response) {
        if (response == null) {
            return "";
        }
        Matcher m = YAML_BLOCK.matcher(response);
        if (m.find()) {
            return m.group(1).strip();
        }
        m = ANY_BLOCK.matcher(response);
        if (m.find()) {
            return m.group(1).strip();
        }
        return response.strip();
    }
}
