package org.dxworks.formframe.analyzer.infopath;

import java.util.List;
import java.util.Objects;

/**
 * Identifies one expansion of a moded template: the mode plus the bindings of the
 * repeating scopes it is expanded under. Section scopes are left out, so a template
 * that re-applies its own mode inside a section it opens is expanded once.
 */
final class TemplateExpansionKey {
    private final String mode;
    private final List<String> repeatingBindings;

    TemplateExpansionKey(String mode, List<String> repeatingBindings) {
        this.mode = mode;
        this.repeatingBindings = List.copyOf(repeatingBindings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateExpansionKey)) return false;
        TemplateExpansionKey that = (TemplateExpansionKey) o;
        return mode.equals(that.mode) && repeatingBindings.equals(that.repeatingBindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, repeatingBindings);
    }

    @Override
    public String toString() {
        return mode + " " + repeatingBindings;
    }
}
