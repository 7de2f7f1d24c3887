package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.ControlOrigin;
import org.dxworks.formframe.model.infopath.RepeatingScope;
import org.dxworks.formframe.model.infopath.SectionScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Scopes in effect at one point of the walk. Immutable: entering a scope produces a
 * new context for the recursive call only.
 */
final class WalkContext {

    private static final WalkContext ROOT = new WalkContext(ScopeChain.empty(), ScopeChain.empty(), null);

    final ScopeChain<SectionScope> sections;
    final ScopeChain<RepeatingScope> repeating;
    final String templateMode; // null outside template expansion

    private WalkContext(ScopeChain<SectionScope> sections, ScopeChain<RepeatingScope> repeating, String templateMode) {
        this.sections = sections;
        this.repeating = repeating;
        this.templateMode = templateMode;
    }

    static WalkContext root() {
        return ROOT;
    }

    WalkContext withSection(SectionScope section) {
        return new WalkContext(sections.push(section), repeating, templateMode);
    }

    WalkContext withRepeating(RepeatingScope scope) {
        return new WalkContext(sections, repeating.push(scope), templateMode);
    }

    WalkContext inTemplate(String mode) {
        return new WalkContext(sections, repeating, mode);
    }

    boolean inTemplate() {
        return templateMode != null;
    }

    boolean inRepeating() {
        return !repeating.isEmpty();
    }

    RepeatingScope currentRepeating() {
        return repeating.peek();
    }

    SectionScope currentSection() {
        return sections.peek();
    }

    ControlOrigin origin() {
        return templateMode == null ? ControlOrigin.MAIN : ControlOrigin.TEMPLATE;
    }

    boolean hasRepeatingBinding(String binding) {
        for (RepeatingScope scope : repeating) {
            if (binding.equals(scope.binding)) {
                return true;
            }
        }
        return false;
    }

    List<String> repeatingPath() {
        List<String> path = new ArrayList<>();
        for (RepeatingScope scope : repeating.outermostFirst()) {
            path.add(scope.name);
        }
        return path;
    }

    /**
     * Source bindings of the enclosing repeating scopes, outermost first. Unlike the
     * display names these do not change when a recursive template re-enters a scope.
     */
    List<String> repeatingBindings() {
        List<String> bindings = new ArrayList<>();
        for (RepeatingScope scope : repeating.outermostFirst()) {
            bindings.add(scope.binding == null ? "" : scope.binding);
        }
        return bindings;
    }
}
