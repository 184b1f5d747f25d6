package org.templatize.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.templatize.TemplatizeConfiguration;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Converts a string concatenation chain into a template string description.
 * <p>
 * Stateless: one instance can serve any number of requests, from any thread, as long as the host
 * tree and type oracle stay unchanged for the duration of a call.
 *
 * @param <N> the host's expression node type
 * @param <T> the host's type representation
 */
public final class ConcatToTemplateEngine<N, T> {

    private static final Logger LOG = LoggerFactory.getLogger(ConcatToTemplateEngine.class);

    private final SyntaxAdapter<N> syntax;
    private final NodeClassifier<N, T> classifier;
    private final ChainFlattener<N, T> flattener;
    private final LiteralMerger<N> merger;
    private final InterpolationSynthesizer<N> synthesizer;
    private final OfferPolicy offerPolicy;

    public ConcatToTemplateEngine(SyntaxAdapter<N> syntax, TypeOracle<N, T> typeOracle, TemplatizeConfiguration configuration) {
        this(syntax, typeOracle, configuration, OfferPolicy.REQUIRE_PLACEHOLDER);
    }

    public ConcatToTemplateEngine(SyntaxAdapter<N> syntax, TypeOracle<N, T> typeOracle,
                                  TemplatizeConfiguration configuration, OfferPolicy offerPolicy) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
        this.classifier = new NodeClassifier<>(syntax, typeOracle);
        this.flattener = new ChainFlattener<>(classifier, configuration.getCancellationCheckInterval());
        this.merger = new LiteralMerger<>();
        this.synthesizer = new InterpolationSynthesizer<>(syntax, configuration.getSyntax(), configuration.isParenthesizeAll());
        this.offerPolicy = Objects.requireNonNull(offerPolicy, "offerPolicy");
    }

    public ConversionOutcome<N> convert(N node) {
        return convert(node, CancellationSignal.NONE);
    }

    public ConversionOutcome<N> convert(N node, CancellationSignal cancellation) {
        Objects.requireNonNull(node, "node");
        cancellation.throwIfCancellationRequested("classify");

        N root = flattener.climbToChainRoot(node);
        if (!classifier.isConcat(root)) {
            LOG.debug("{} is not a string concatenation", syntax.span(root));
            return ConversionOutcome.notApplicable(ConversionOutcome.Reason.NOT_A_STRING_CONCATENATION);
        }

        LeafSequence<N> leaves = flattener.flatten(root, cancellation);
        cancellation.throwIfCancellationRequested("merge");
        LeafSequence<N> merged = merger.merge(leaves);
        cancellation.throwIfCancellationRequested("synthesize");
        SynthesizedResult<N> result = synthesizer.synthesize(merged);
        cancellation.throwIfCancellationRequested("offer");

        if (!offerPolicy.shouldOffer(result)) {
            LOG.debug("Not offering conversion of {}: {} segment(s), no placeholder", syntax.span(root), result.getSegments().size());
            return ConversionOutcome.notApplicable(ConversionOutcome.Reason.NO_EMBEDDED_EXPRESSION);
        }
        return ConversionOutcome.applicable(root, syntax.span(root), result);
    }

    /**
     * Runs {@link #convert(Object, CancellationSignal)} on {@code executor}. Cancellation completes
     * the future exceptionally with {@link org.templatize.OperationCanceledException}.
     */
    public CompletableFuture<ConversionOutcome<N>> convertAsync(N node, Executor executor, CancellationSignal cancellation) {
        return CompletableFuture.supplyAsync(() -> convert(node, cancellation), executor);
    }
}
