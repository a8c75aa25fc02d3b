package geosite.core.model;

/**
 * Result of a ruleset request.
 *
 * @param text        rendered output
 * @param dialect     dialect the text is in
 * @param fingerprint upstream archive version the text was derived from
 * @param cached      whether the text was served from the result cache
 */
public record RenderedRuleset(String text, Dialect dialect, String fingerprint, boolean cached) {}
