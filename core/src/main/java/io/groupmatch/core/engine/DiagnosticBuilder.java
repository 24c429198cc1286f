package io.groupmatch.core.engine;

import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.RaisedException;
import io.groupmatch.core.model.SpecRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns a failed {@link MatchAttempt} into the reason text for its level.
 *
 * <p>
 * The shortest applicable form is chosen:
 *
 * <ol>
 *   <li>one spec against one exception: the pair's own reason;
 *   <li>every spec paired, exceptions left over: the unexpected exceptions;
 *   <li>every exception paired, specs left over: the unsatisfied specs;
 *   <li>one spec and one exception left, and that exception fits no paired spec either: the pair's
 *       reason, after the matched count;
 *   <li>otherwise a table listing, per unmatched exception, why each unmatched spec rejected it
 *       and which paired specs it would also satisfy.
 * </ol>
 */
final class DiagnosticBuilder {

    static final String INDENT = "    ";

    private final SpecRenderer specs;

    DiagnosticBuilder(SpecRenderer specs) {
        this.specs = specs;
    }

    String describe(MatchAttempt attempt) {
        List<ExpectedSpec> expected = attempt.specs();
        List<RaisedException> actuals = attempt.actuals();
        if (expected.size() == 1 && actuals.size() == 1) {
            return attempt.reason(0, 0);
        }
        int matched = attempt.matchedCount();
        List<Integer> unmatchedSpecs = attempt.unmatchedSpecs();
        List<Integer> unmatchedActuals = attempt.unmatchedActuals();
        String count = matchedCount(matched);
        String prefix = matched > 0 ? count : "";

        if (unmatchedSpecs.isEmpty()) {
            return prefix + "Unexpected exception(s): " + reprs(actuals, unmatchedActuals);
        }
        if (unmatchedActuals.isEmpty()) {
            return prefix + "Too few exceptions raised, found no match for: " + renderSpecs(expected, unmatchedSpecs);
        }
        if (unmatchedSpecs.size() == 1
                && unmatchedActuals.size() == 1
                && attempt.nearMisses(unmatchedActuals.get(0)).isEmpty()) {
            return prefix + attempt.reason(unmatchedSpecs.get(0), unmatchedActuals.get(0));
        }

        StringBuilder text = new StringBuilder();
        if (matched > 0) {
            text.append('\n').append(count);
        }
        text.append("\nThe following expected exceptions did not find a match: ")
                .append(renderSpecs(expected, unmatchedSpecs));
        text.append("\nThe following raised exceptions did not find a match");
        for (int actual : unmatchedActuals) {
            text.append("\n  ").append(actuals.get(actual).repr()).append(':');
            for (int spec : unmatchedSpecs) {
                String reason = attempt.reason(spec, actual);
                if (!reason.startsWith("\n")) {
                    text.append('\n');
                }
                text.append(indent(reason, INDENT));
            }
            for (int spec : attempt.nearMisses(actual)) {
                text.append("\n    It matches ")
                        .append(specs.render(expected.get(spec)))
                        .append(" which was paired with ")
                        .append(actuals.get(attempt.actualFor(spec)).repr());
            }
        }
        return text.toString();
    }

    /** {@code "1 matched exception. "} or {@code "3 matched exceptions. "}. */
    static String matchedCount(int matched) {
        return matched + (matched == 1 ? " matched exception. " : " matched exceptions. ");
    }

    /** Prefixes every line that is not blank with {@code prefix}. */
    static String indent(String text, String prefix) {
        StringBuilder out = new StringBuilder(text.length() + prefix.length());
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            int next = end < 0 ? text.length() : end + 1;
            String line = text.substring(start, next);
            if (!line.isBlank()) {
                out.append(prefix);
            }
            out.append(line);
            start = next;
        }
        return out.toString();
    }

    private String renderSpecs(List<ExpectedSpec> expected, List<Integer> indices) {
        List<ExpectedSpec> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(expected.get(index));
        }
        return specs.renderAll(selected);
    }

    private static String reprs(List<RaisedException> actuals, List<Integer> indices) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (int index : indices) {
            joiner.add(actuals.get(index).repr());
        }
        return joiner.toString();
    }
}
