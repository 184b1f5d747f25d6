package org.templatize.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one conversion request: either a replacement for the span of the chain root, or the
 * reason the conversion does not apply.
 */
public final class ConversionOutcome<N> {

    public static final String TITLE = "Convert to interpolated string";

    public enum Reason {
        /** The node, after climbing to the top of its chain, is not a string "+". */
        NOT_A_STRING_CONCATENATION,
        /** The chain consists of string literals only. */
        NO_EMBEDDED_EXPRESSION
    }

    private final N root;
    private final SourceSpan span;
    private final SynthesizedResult<N> result;
    private final Reason reason;

    private ConversionOutcome(N root, SourceSpan span, SynthesizedResult<N> result, Reason reason) {
        this.root = root;
        this.span = span;
        this.result = result;
        this.reason = reason;
    }

    public static <N> ConversionOutcome<N> applicable(N root, SourceSpan span, SynthesizedResult<N> result) {
        return new ConversionOutcome<>(Objects.requireNonNull(root, "root"), Objects.requireNonNull(span, "span"),
                                       Objects.requireNonNull(result, "result"), null);
    }

    public static <N> ConversionOutcome<N> notApplicable(Reason reason) {
        return new ConversionOutcome<>(null, null, null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isApplicable() {
        return reason == null;
    }

    public Optional<Reason> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<N> getRoot() {
        return Optional.ofNullable(root);
    }

    public Optional<SourceSpan> getSpan() {
        return Optional.ofNullable(span);
    }

    public Optional<SynthesizedResult<N>> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> renderedText() {
        return getResult().map(SynthesizedResult::render);
    }

    public String getTitle() {
        return TITLE;
    }

    @Override
    public String toString() {
        return isApplicable()
                ? "ConversionOutcome{span=" + span + ", text=" + result.render() + '}'
                : "ConversionOutcome{notApplicable=" + reason + '}';
    }
}
