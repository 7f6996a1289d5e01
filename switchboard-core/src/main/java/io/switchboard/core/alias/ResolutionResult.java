package io.switchboard.core.alias;

import java.util.List;

/**
 * Outcome of resolving a model string.
 *
 * @param resolvedModel model name to send upstream, without provider prefix
 * @param provider provider that serves the model
 * @param wasResolved whether any alias fired
 * @param resolutionPath aliases followed, in order
 * @param matches candidate matches, only populated while ranking
 */
public record ResolutionResult(
    String resolvedModel,
    String provider,
    boolean wasResolved,
    List<String> resolutionPath,
    List<Match> matches
) {

    public ResolutionResult {
        resolutionPath = resolutionPath == null ? List.of() : List.copyOf(resolutionPath);
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static ResolutionResult unresolved(String provider, String model) {
        return new ResolutionResult(model, provider, false, List.of(), List.of());
    }

    public static ResolutionResult resolved(String provider, String model, List<String> path) {
        return new ResolutionResult(model, provider, true, path, List.of());
    }

    public static ResolutionResult candidates(ResolutionContext context, List<Match> matches) {
        return new ResolutionResult(context.model(), context.provider(), false, List.of(), matches);
    }

    public String qualifiedModel() {
        return provider == null ? resolvedModel : provider + ":" + resolvedModel;
    }
}
