package org.templatize.engine;

/**
 * Decides whether a synthesized conversion is worth proposing.
 */
@FunctionalInterface
public interface OfferPolicy {

    /**
     * Only offers results that embed at least one expression; an all-literal chain would become a
     * template string with nothing interpolated.
     */
    OfferPolicy REQUIRE_PLACEHOLDER = result -> result.placeholderCount() > 0;

    boolean shouldOffer(SynthesizedResult<?> result);
}
