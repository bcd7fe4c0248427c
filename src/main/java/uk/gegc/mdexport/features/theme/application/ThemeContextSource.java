package uk.gegc.mdexport.features.theme.application;

import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;

/**
 * Collects dark/light signals from the host environment.
 * Implementations may be impure; {@link ThemeResolver} only ever sees the result.
 */
@FunctionalInterface
public interface ThemeContextSource {

    ThemeContext detect();
}
