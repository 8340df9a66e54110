package com.ryuqq.protocheck.adapter.inmemory.verifier;

import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.ObligationKind;
import com.ryuqq.protocheck.core.outcome.Proof;
import com.ryuqq.protocheck.core.outcome.VerificationFailure;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted in-memory oracle implementing both {@link FormalVerifier} and
 * {@link TemporalLogicSolver}, for testing and reference purposes.
 *
 * <p>Answers are looked up in this order:</p>
 * <ol>
 *   <li>a rule registered for the obligation's rendered formula</li>
 *   <li>a rule registered for the obligation's {@link ObligationKind}</li>
 *   <li>the default: {@code VerificationFailure(UNKNOWN)}</li>
 * </ol>
 *
 * <p>Every call is recorded (thread-safe, in call order) so tests can assert which
 * obligations reached the oracle.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryFormalVerifier verifier = new InMemoryFormalVerifier()
 *     .proveKind(ObligationKind.LIVENESS)
 *     .refute("safe", List.of("Idle", "Broken"));
 *
 * engine = new DefaultAnalysisEngine(config, extractor, verifier, verifier);
 * ...
 * assertThat(verifier.getCalls()).hasSize(3);
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public class InMemoryFormalVerifier implements FormalVerifier, TemporalLogicSolver {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFormalVerifier.class);

    private static final String METHOD = "in-memory";

    private final Map<String, Function<VerificationObligation, VerificationOutcome>> rulesByFormula;
    private final Map<ObligationKind, Function<VerificationObligation, VerificationOutcome>> rulesByKind;
    private final List<VerificationObligation> calls;

    public InMemoryFormalVerifier() {
        this.rulesByFormula = new ConcurrentHashMap<>();
        this.rulesByKind = new ConcurrentHashMap<>();
        this.calls = new CopyOnWriteArrayList<>();
    }

    /**
     * Proves every obligation whose formula renders to the given text.
     *
     * @param renderedFormula the formula's {@code render()} output
     * @return this verifier
     */
    public InMemoryFormalVerifier prove(String renderedFormula) {
        return onFormula(renderedFormula, obligation -> Proof.of(obligation.obligationId(), METHOD));
    }

    /**
     * Refutes every obligation whose formula renders to the given text.
     *
     * @param renderedFormula the formula's {@code render()} output
     * @param counterexample the counterexample trace to return (may be empty)
     * @return this verifier
     */
    public InMemoryFormalVerifier refute(String renderedFormula, List<String> counterexample) {
        return onFormula(renderedFormula, obligation -> VerificationFailure.refuted(
            obligation.obligationId(), "refuted by script", counterexample));
    }

    /**
     * Answers every obligation whose formula renders to the given text with a failure reason.
     *
     * @param renderedFormula the formula's {@code render()} output
     * @param reason the failure reason
     * @return this verifier
     */
    public InMemoryFormalVerifier fail(String renderedFormula, FailureReason reason) {
        return onFormula(renderedFormula, obligation -> VerificationFailure.of(
            obligation.obligationId(), reason, "scripted " + reason));
    }

    /**
     * Throws the given exception for every obligation whose formula renders to the given text.
     *
     * @param renderedFormula the formula's {@code render()} output
     * @param exception the exception to throw
     * @return this verifier
     */
    public InMemoryFormalVerifier throwOn(String renderedFormula, RuntimeException exception) {
        return onFormula(renderedFormula, obligation -> {
            throw exception;
        });
    }

    /**
     * Proves every obligation of a kind not matched by a formula rule.
     *
     * @param kind the obligation kind
     * @return this verifier
     */
    public InMemoryFormalVerifier proveKind(ObligationKind kind) {
        return onKind(kind, obligation -> Proof.of(obligation.obligationId(), METHOD));
    }

    /**
     * Answers every obligation of a kind not matched by a formula rule with a failure reason.
     *
     * @param kind the obligation kind
     * @param reason the failure reason
     * @return this verifier
     */
    public InMemoryFormalVerifier failKind(ObligationKind kind, FailureReason reason) {
        return onKind(kind, obligation -> VerificationFailure.of(
            obligation.obligationId(), reason, "scripted " + reason));
    }

    public InMemoryFormalVerifier onFormula(String renderedFormula,
                                            Function<VerificationObligation, VerificationOutcome> rule) {
        if (renderedFormula == null || rule == null) {
            throw new IllegalArgumentException("renderedFormula and rule cannot be null");
        }
        rulesByFormula.put(renderedFormula, rule);
        return this;
    }

    public InMemoryFormalVerifier onKind(ObligationKind kind,
                                         Function<VerificationObligation, VerificationOutcome> rule) {
        if (kind == null || rule == null) {
            throw new IllegalArgumentException("kind and rule cannot be null");
        }
        rulesByKind.put(kind, rule);
        return this;
    }

    @Override
    public VerificationOutcome verifyProperty(VerificationObligation obligation) {
        return answer(obligation);
    }

    @Override
    public VerificationOutcome solve(VerificationObligation obligation) {
        return answer(obligation);
    }

    /**
     * Obligations received so far, in call order.
     *
     * @return immutable snapshot of recorded calls
     */
    public List<VerificationObligation> getCalls() {
        return List.copyOf(calls);
    }

    public List<VerificationObligation> getCalls(ObligationKind kind) {
        List<VerificationObligation> matching = new ArrayList<>();
        for (VerificationObligation call : calls) {
            if (call.kind() == kind) {
                matching.add(call);
            }
        }
        return matching;
    }

    /**
     * Removes every rule and recorded call.
     */
    public void reset() {
        rulesByFormula.clear();
        rulesByKind.clear();
        calls.clear();
    }

    private VerificationOutcome answer(VerificationObligation obligation) {
        if (obligation == null) {
            throw new IllegalArgumentException("obligation cannot be null");
        }
        calls.add(obligation);

        Function<VerificationObligation, VerificationOutcome> rule = rulesByFormula.get(obligation.formula().render());
        if (rule == null) {
            rule = rulesByKind.get(obligation.kind());
        }
        if (rule == null) {
            log.debug("No rule for obligation {}, answering UNKNOWN", obligation.obligationId());
            return VerificationFailure.unknown(obligation.obligationId(), "no scripted answer");
        }
        return rule.apply(obligation);
    }
}
