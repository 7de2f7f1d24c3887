package org.dxworks.formframe.model.infopath;

import java.util.Collections;
import java.util.List;

/**
 * A template fragment whose visibility depends on a data field, found through an
 * {@code xsl:if} inside a moded template.
 */
public final class DynamicSection {
    public final String mode;
    public final String ctrlId;
    public final String caption;
    public final String condition;
    public final String conditionField;
    public final String conditionValue;
    public final List<String> controls;

    public DynamicSection(String mode, String ctrlId, String caption, String condition,
                          String conditionField, String conditionValue, List<String> controls) {
        this.mode = mode;
        this.ctrlId = ctrlId;
        this.caption = caption;
        this.condition = condition;
        this.conditionField = conditionField;
        this.conditionValue = conditionValue;
        this.controls = Collections.unmodifiableList(controls);
    }
}
