package org.dxworks.formframe.model.infopath;

import java.util.List;

public class DataColumn {
    public String columnName;
    public String type;
    public String owningSection; // repeating scope name for repeating columns, else the cosmetic section
    public boolean repeating;
    public String repeatingSectionPath;
    public boolean conditional;
    public String conditionalOnField;
    public String displayName;
    public List<ChoiceOption> validValues; // null when the column has no static options
    public String defaultValue;

    public boolean hasConstraints() {
        return validValues != null && !validValues.isEmpty();
    }
}
