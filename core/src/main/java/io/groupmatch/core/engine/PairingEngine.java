package io.groupmatch.core.engine;

import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.RaisedException;
import java.util.List;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs the expected children of one group spec with the raised children of one group, one-to-one,
 * finding a maximum-cardinality pairing.
 *
 * <p>
 * Specs are processed in declaration order. Each spec first takes the earliest free actual it is
 * compatible with; only when none is free does it try to re-route an earlier spec along an
 * augmenting path. A pairing therefore exists whenever any assignment of actuals to specs exists,
 * independent of the order specs were declared in, and the result is deterministic.
 */
final class PairingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PairingEngine.class);

    private PairingEngine() {}

    /**
     * Pairs {@code specs} against {@code actuals}.
     *
     * @param compatibility returns the mismatch reason for a pair, or {@code null} when compatible;
     *     called at most once per pair
     */
    static MatchAttempt pair(
            List<ExpectedSpec> specs,
            List<RaisedException> actuals,
            BiFunction<ExpectedSpec, RaisedException, String> compatibility) {
        MatchAttempt attempt = new MatchAttempt(specs, actuals, compatibility);
        for (int spec = 0; spec < specs.size(); spec++) {
            if (!takeFree(attempt, spec)) {
                boolean rerouted = augment(attempt, spec, new boolean[actuals.size()]);
                if (rerouted) {
                    LOG.debug("Re-paired earlier specs to place {}", specs.get(spec));
                }
            }
        }
        return attempt;
    }

    private static boolean takeFree(MatchAttempt attempt, int spec) {
        for (int actual = 0; actual < attempt.actuals().size(); actual++) {
            if (attempt.specFor(actual) < 0 && attempt.compatible(spec, actual)) {
                attempt.assign(spec, actual);
                return true;
            }
        }
        return false;
    }

    private static boolean augment(MatchAttempt attempt, int spec, boolean[] visited) {
        for (int actual = 0; actual < attempt.actuals().size(); actual++) {
            if (visited[actual] || !attempt.compatible(spec, actual)) {
                continue;
            }
            visited[actual] = true;
            int owner = attempt.specFor(actual);
            if (owner < 0 || takeFree(attempt, owner) || augment(attempt, owner, visited)) {
                attempt.assign(spec, actual);
                return true;
            }
        }
        return false;
    }
}
