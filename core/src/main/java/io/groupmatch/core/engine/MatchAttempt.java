package io.groupmatch.core.engine;

import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.RaisedException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Pairing state of one tree level during one match call: the lazily filled compatibility table
 * between expected and raised children, and the current one-to-one assignment.
 *
 * <p>
 * Each (spec, actual) pair is evaluated at most once; later lookups, including the near-miss
 * checks of the diagnostic, reuse the stored reason. Not thread-safe; confined to one call.
 */
final class MatchAttempt {

    private final List<ExpectedSpec> specs;
    private final List<RaisedException> actuals;
    private final BiFunction<ExpectedSpec, RaisedException, String> compatibility;

    private final String[][] reasons;
    private final boolean[][] evaluated;

    private final int[] actualForSpec;
    private final int[] specForActual;

    MatchAttempt(
            List<ExpectedSpec> specs,
            List<RaisedException> actuals,
            BiFunction<ExpectedSpec, RaisedException, String> compatibility) {
        this.specs = specs;
        this.actuals = actuals;
        this.compatibility = compatibility;
        this.reasons = new String[specs.size()][actuals.size()];
        this.evaluated = new boolean[specs.size()][actuals.size()];
        this.actualForSpec = new int[specs.size()];
        this.specForActual = new int[actuals.size()];
        Arrays.fill(actualForSpec, -1);
        Arrays.fill(specForActual, -1);
    }

    List<ExpectedSpec> specs() {
        return specs;
    }

    List<RaisedException> actuals() {
        return actuals;
    }

    /**
     * Why {@code actuals[actual]} does not satisfy {@code specs[spec]}, or {@code null} when it
     * does. Evaluated on first access.
     */
    String reason(int spec, int actual) {
        if (!evaluated[spec][actual]) {
            reasons[spec][actual] = compatibility.apply(specs.get(spec), actuals.get(actual));
            evaluated[spec][actual] = true;
        }
        return reasons[spec][actual];
    }

    boolean compatible(int spec, int actual) {
        return reason(spec, actual) == null;
    }

    void assign(int spec, int actual) {
        actualForSpec[spec] = actual;
        specForActual[actual] = spec;
    }

    /** Index of the actual paired with {@code spec}, or -1. */
    int actualFor(int spec) {
        return actualForSpec[spec];
    }

    /** Index of the spec paired with {@code actual}, or -1. */
    int specFor(int actual) {
        return specForActual[actual];
    }

    int matchedCount() {
        int count = 0;
        for (int actual : actualForSpec) {
            if (actual >= 0) {
                count++;
            }
        }
        return count;
    }

    /** Every spec and every actual is paired. */
    boolean isComplete() {
        return specs.size() == actuals.size() && matchedCount() == specs.size();
    }

    List<Integer> unmatchedSpecs() {
        List<Integer> unmatched = new ArrayList<>();
        for (int i = 0; i < actualForSpec.length; i++) {
            if (actualForSpec[i] < 0) {
                unmatched.add(i);
            }
        }
        return unmatched;
    }

    List<Integer> unmatchedActuals() {
        List<Integer> unmatched = new ArrayList<>();
        for (int i = 0; i < specForActual.length; i++) {
            if (specForActual[i] < 0) {
                unmatched.add(i);
            }
        }
        return unmatched;
    }

    /** Specs paired with some other actual that {@code actual} would also satisfy. */
    List<Integer> nearMisses(int actual) {
        List<Integer> hits = new ArrayList<>();
        for (int spec = 0; spec < specs.size(); spec++) {
            if (actualForSpec[spec] >= 0 && actualForSpec[spec] != actual && compatible(spec, actual)) {
                hits.add(spec);
            }
        }
        return hits;
    }
}
