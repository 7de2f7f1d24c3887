package org.dxworks.formframe.model.infopath;

import java.util.ArrayList;
import java.util.List;

/**
 * A section of one view. Opened when the walker enters the container and closed,
 * with {@link #endRow} filled in, when it leaves it.
 */
public class SectionScope {
    public String name;
    public SectionKind kind;
    public String ctrlId;
    public int startRow;
    public Integer endRow; // null while the section is still open
    public boolean optional;
    public boolean nestedInRepeating;
    public List<String> controlIds = new ArrayList<>();
}
