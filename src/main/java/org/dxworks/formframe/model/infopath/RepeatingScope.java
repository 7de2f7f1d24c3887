package org.dxworks.formframe.model.infopath;

/**
 * A region that repeats once per data item. Nested scopes compose their display
 * name from the enclosing scope: {@code outer.displayName + "_" + localName}.
 */
public class RepeatingScope {
    public String name;
    public String localName;
    public String binding;
    public RepeatingKind kind;
    public String displayName;
    public int depth;
}
